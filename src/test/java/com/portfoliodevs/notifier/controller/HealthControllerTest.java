package com.portfoliodevs.notifier.controller;

import com.portfoliodevs.notifier.scheduler.DelayedJobScheduler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private DelayedJobScheduler scheduler;

    @Test
    void health_ReportsPendingReminderCount() throws Exception {
        when(scheduler.pendingCount()).thenReturn(3);
        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(scheduler))
                .defaultRequest(get("/").accept(MediaType.APPLICATION_JSON)).build();

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.pendingReminders").value(3));
    }

    @Test
    void home_ReportsServiceRunning() throws Exception {
        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(scheduler))
                .defaultRequest(get("/").accept(MediaType.APPLICATION_JSON)).build();

        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("advisory-notifier"));
    }
}
