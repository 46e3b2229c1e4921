package com.portfoliodevs.notifier.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReminderScheduleResponse {

    private String correlationId;
    private List<String> jobIds;
    private String fireAt;
    private boolean clamped;
    private String message;
}
