package com.portfoliodevs.notifier.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancelReminderResponse {

    private String jobId;
    private boolean cancelled;
}
