package com.portfoliodevs.notifier.dto;

import com.portfoliodevs.notifier.model.AdvisoryStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AdvisoryNotificationResult {

    private String sessionId;
    private AdvisoryStatus status;
    private List<DeliveryReport> deliveries;

    public boolean isAllDelivered() {
        return deliveries != null && deliveries.stream().allMatch(DeliveryReport::isSuccess);
    }
}
