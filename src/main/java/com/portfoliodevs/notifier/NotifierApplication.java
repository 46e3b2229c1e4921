package com.portfoliodevs.notifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class NotifierApplication {

	private static final Logger logger = LoggerFactory.getLogger(NotifierApplication.class);

	public static void main(String[] args) {
		SpringApplication.run(NotifierApplication.class, args);
	}

	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Advisory notifier listening on port {}", event.getWebServer().getPort());
	}

}
