package com.portfoliodevs.notifier.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PendingRemindersResponse {

    private int total;
    private List<PendingReminderDTO> reminders;
}
