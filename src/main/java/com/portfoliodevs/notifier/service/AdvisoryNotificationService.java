package com.portfoliodevs.notifier.service;

import com.portfoliodevs.notifier.dto.AdvisoryNotificationRequest;
import com.portfoliodevs.notifier.dto.AdvisoryNotificationResult;

/**
 * Service for notifying both parties of an advisory session about lifecycle changes.
 */
public interface AdvisoryNotificationService {

    /**
     * Send the notifications for a session that was created, approved, rejected or cancelled.
     * Deliveries are independent: a failed one is reported in the result and the rest still go out.
     *
     * @param request the lifecycle event
     * @return one report per delivery attempted
     */
    AdvisoryNotificationResult notifyStatusChange(AdvisoryNotificationRequest request);
}
