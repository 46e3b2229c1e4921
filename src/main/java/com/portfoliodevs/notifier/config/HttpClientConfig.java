package com.portfoliodevs.notifier.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP clients for outbound notification providers.
 */
@Configuration
public class HttpClientConfig {

    /**
     * Client for the transactional email API, built from Boot's builder so its message
     * converters and customizers apply. A hung provider releases the send thread
     * once the connect or read timeout expires.
     */
    @Bean("emailRestTemplate")
    public RestTemplate emailRestTemplate(RestTemplateBuilder builder, NotificationProperties properties) {
        NotificationProperties.Email email = properties.getEmail();
        return builder
                .setConnectTimeout(email.getConnectTimeout())
                .setReadTimeout(email.getReadTimeout())
                .build();
    }
}
