package com.portfoliodevs.notifier.controller;

import com.portfoliodevs.notifier.scheduler.DelayedJobScheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final DelayedJobScheduler scheduler;

    public HealthController(DelayedJobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/")
    public Map<String, Object> home() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "advisory-notifier");
        body.put("status", "running");
        body.put("docs", "/swagger-ui.html");
        return body;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "OK");
        body.put("pendingReminders", scheduler.pendingCount());
        return body;
    }
}
