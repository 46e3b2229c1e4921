package com.portfoliodevs.notifier.service.impl;

import com.portfoliodevs.notifier.dto.AdvisoryNotificationRequest;
import com.portfoliodevs.notifier.dto.AdvisoryNotificationResult;
import com.portfoliodevs.notifier.dto.DeliveryReport;
import com.portfoliodevs.notifier.exception.ValidationException;
import com.portfoliodevs.notifier.model.AdvisoryStatus;
import com.portfoliodevs.notifier.model.NotificationChannel;
import com.portfoliodevs.notifier.model.NotificationKind;
import com.portfoliodevs.notifier.service.AdvisoryNotificationService;
import com.portfoliodevs.notifier.service.EmailNotificationSender;
import com.portfoliodevs.notifier.service.NotificationSender;
import com.portfoliodevs.notifier.service.SendOutcome;
import com.portfoliodevs.notifier.service.WhatsAppNotificationSender;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class AdvisoryNotificationServiceImpl implements AdvisoryNotificationService {

    private static final Logger logger = LoggerFactory.getLogger(AdvisoryNotificationServiceImpl.class);

    static final String EMAIL = "email";
    static final String WHATSAPP = "whatsapp";

    private final EmailNotificationSender emailSender;
    private final WhatsAppNotificationSender whatsAppSender;
    private final MeterRegistry meterRegistry;

    public AdvisoryNotificationServiceImpl(EmailNotificationSender emailSender,
                                           WhatsAppNotificationSender whatsAppSender,
                                           MeterRegistry meterRegistry) {
        this.emailSender = emailSender;
        this.whatsAppSender = whatsAppSender;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public AdvisoryNotificationResult notifyStatusChange(AdvisoryNotificationRequest request) {
        if (request == null || request.getStatus() == null) {
            throw new ValidationException("Advisory status is required");
        }
        NotificationChannel channel = request.getChannel() != null ? request.getChannel() : NotificationChannel.EMAIL;
        logger.info("Notifying {} for advisory session {} via {}", request.getStatus(), request.getSessionId(), channel);

        List<DeliveryReport> deliveries = new ArrayList<>();
        String user = nameOrDefault(request.getUserName(), "User");
        String programmer = nameOrDefault(request.getProgrammerName(), "the programmer");

        switch (request.getStatus()) {
            case PENDING -> {
                deliveries.add(email(request, request.getProgrammerEmail(), NotificationKind.NEW_REQUEST,
                        null, user + " has requested an advisory session with you.", null));
                deliveries.add(email(request, request.getUserEmail(), NotificationKind.GENERIC,
                        "Advisory request sent",
                        "Your advisory request was sent to " + programmer
                                + ". You will be notified as soon as they respond.", null));
            }
            case APPROVED -> {
                if (channel.includesEmail()) {
                    deliveries.add(email(request, request.getUserEmail(), NotificationKind.APPROVED,
                            null, "Great news! " + programmer + " approved your advisory session.", null));
                }
                deliveries.add(email(request, request.getProgrammerEmail(), NotificationKind.APPROVED,
                        "You confirmed an advisory session",
                        "You approved the advisory session with " + user + ".",
                        request.getProgrammerName()));
                whatsApp(request, channel, null).ifPresent(deliveries::add);
            }
            case REJECTED -> {
                if (channel.includesEmail()) {
                    deliveries.add(email(request, request.getUserEmail(), NotificationKind.REJECTED,
                            null, "Your advisory request could not be accepted.", null));
                }
                deliveries.add(email(request, request.getProgrammerEmail(), NotificationKind.GENERIC,
                        "Advisory request declined",
                        "You declined the advisory request from " + user + ".", null));
                whatsApp(request, channel, null).ifPresent(deliveries::add);
            }
            case CANCELLED -> {
                String when = describeWhen(request);
                if (channel.includesEmail()) {
                    deliveries.add(email(request, request.getUserEmail(), NotificationKind.REJECTED,
                            "Advisory session cancelled",
                            "Your advisory session with " + programmer + when + " was cancelled.", null));
                }
                deliveries.add(email(request, request.getProgrammerEmail(), NotificationKind.REJECTED,
                        "Advisory session cancelled",
                        "The advisory session with " + user + when + " was cancelled.",
                        request.getProgrammerName()));
                whatsApp(request, channel,
                        "Your advisory session with " + programmer + when + " was cancelled.")
                        .ifPresent(deliveries::add);
            }
        }

        long failed = deliveries.stream().filter(d -> !d.isSuccess()).count();
        if (failed > 0) {
            logger.warn("{} of {} notification(s) failed for advisory session {}",
                    failed, deliveries.size(), request.getSessionId());
        }
        return new AdvisoryNotificationResult(request.getSessionId(), request.getStatus(), deliveries);
    }

    private DeliveryReport email(AdvisoryNotificationRequest request, String recipient, NotificationKind kind,
                                 String subject, String message, String recipientName) {
        Map<String, String> context = baseContext(request);
        putIfPresent(context, "subject", subject);
        putIfPresent(context, "message", message);
        putIfPresent(context, "recipient_name", recipientName);
        return deliver(EMAIL, emailSender, recipient, kind, context, request.getStatus());
    }

    private Optional<DeliveryReport> whatsApp(AdvisoryNotificationRequest request,
                                               NotificationChannel channel, String message) {
        if (!channel.includesWhatsApp()) {
            return Optional.empty();
        }
        if (request.getUserPhone() == null || request.getUserPhone().isBlank()) {
            logger.warn("WhatsApp requested for advisory session {} but no user phone was given",
                    request.getSessionId());
            return Optional.empty();
        }
        NotificationKind kind = switch (request.getStatus()) {
            case APPROVED -> NotificationKind.APPROVED;
            case REJECTED, CANCELLED -> NotificationKind.REJECTED;
            case PENDING -> NotificationKind.GENERIC;
        };
        Map<String, String> context = baseContext(request);
        putIfPresent(context, "message", message);
        return Optional.of(deliver(WHATSAPP, whatsAppSender, request.getUserPhone(), kind, context, request.getStatus()));
    }

    private DeliveryReport deliver(String channel, NotificationSender sender, String recipient,
                                   NotificationKind kind, Map<String, String> context, AdvisoryStatus status) {
        SendOutcome outcome;
        try {
            outcome = sender.send(recipient, kind, context);
        } catch (RuntimeException e) {
            logger.error("Unexpected error sending {} {} notification to {}: {}",
                    channel, kind, recipient, e.getMessage(), e);
            outcome = SendOutcome.failure("unexpected error: " + e.getMessage());
        }
        meterRegistry.counter("advisory_notification_total",
                "event", status.name(),
                "channel", channel,
                "status", outcome.isSuccess() ? "success" : "failure").increment();
        if (!outcome.isSuccess()) {
            logger.warn("Failed to send {} {} notification to {}: {}", channel, kind, recipient, outcome.getDetail());
        }
        return new DeliveryReport(channel, recipient, kind, outcome.isSuccess(), outcome.getDetail());
    }

    private static Map<String, String> baseContext(AdvisoryNotificationRequest request) {
        Map<String, String> context = new HashMap<>();
        putIfPresent(context, "session_id", request.getSessionId());
        putIfPresent(context, "user_name", request.getUserName());
        putIfPresent(context, "programmer_name", request.getProgrammerName());
        putIfPresent(context, "date", request.getDate());
        putIfPresent(context, "time", request.getTime());
        putIfPresent(context, "reason", request.getReason());
        putIfPresent(context, "response_message", request.getResponseMessage());
        return context;
    }

    private static String describeWhen(AdvisoryNotificationRequest request) {
        if (request.getDate() == null || request.getDate().isBlank()) {
            return "";
        }
        String when = " on " + request.getDate();
        if (request.getTime() != null && !request.getTime().isBlank()) {
            when += " at " + request.getTime();
        }
        return when;
    }

    private static String nameOrDefault(String name, String fallback) {
        return name != null && !name.isBlank() ? name : fallback;
    }

    private static void putIfPresent(Map<String, String> context, String key, String value) {
        if (value != null && !value.isBlank()) {
            context.put(key, value);
        }
    }
}
