package com.portfoliodevs.notifier.dto;

import com.portfoliodevs.notifier.scheduler.JobSummary;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PendingReminderDTO {

    private String id;
    private String description;
    private String correlationId;
    private String nextFireTime;

    public static PendingReminderDTO from(JobSummary summary) {
        return new PendingReminderDTO(
                summary.id(),
                summary.description(),
                summary.correlationId(),
                summary.nextFireTime().toString());
    }
}
