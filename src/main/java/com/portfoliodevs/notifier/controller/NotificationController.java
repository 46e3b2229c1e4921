package com.portfoliodevs.notifier.controller;

import com.portfoliodevs.notifier.dto.AdvisoryNotificationRequest;
import com.portfoliodevs.notifier.dto.AdvisoryNotificationResult;
import com.portfoliodevs.notifier.dto.DeliveryResponse;
import com.portfoliodevs.notifier.dto.EmailRequest;
import com.portfoliodevs.notifier.dto.WhatsAppRequest;
import com.portfoliodevs.notifier.exception.NotificationDeliveryException;
import com.portfoliodevs.notifier.model.NotificationKind;
import com.portfoliodevs.notifier.service.AdvisoryNotificationService;
import com.portfoliodevs.notifier.service.EmailNotificationSender;
import com.portfoliodevs.notifier.service.SendOutcome;
import com.portfoliodevs.notifier.service.WhatsAppNotificationSender;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/notifications")
@Tag(name = "Notifications", description = "Immediate email and WhatsApp notifications")
public class NotificationController extends BaseController {

    private final AdvisoryNotificationService advisoryNotificationService;
    private final EmailNotificationSender emailSender;
    private final WhatsAppNotificationSender whatsAppSender;

    public NotificationController(AdvisoryNotificationService advisoryNotificationService,
                                  EmailNotificationSender emailSender,
                                  WhatsAppNotificationSender whatsAppSender) {
        this.advisoryNotificationService = advisoryNotificationService;
        this.emailSender = emailSender;
        this.whatsAppSender = whatsAppSender;
    }

    @PostMapping("/advisory")
    @Operation(summary = "Notify an advisory lifecycle change",
               description = "Notifies the programmer and the user that a session was requested, approved, "
                       + "rejected or cancelled. Each delivery is reported separately.")
    public ResponseEntity<AdvisoryNotificationResult> notifyAdvisory(
            @Valid @RequestBody AdvisoryNotificationRequest request) {
        return ResponseEntity.ok(advisoryNotificationService.notifyStatusChange(request));
    }

    @PostMapping("/email")
    @Operation(summary = "Send an email", description = "Sends one email right away. Returns 502 if the provider fails.")
    public ResponseEntity<DeliveryResponse> sendEmail(@Valid @RequestBody EmailRequest request) {
        Map<String, String> context = new HashMap<>();
        if (request.getData() != null) {
            context.putAll(request.getData());
        }
        context.put("subject", request.getSubject());
        context.put("message", request.getMessage());
        NotificationKind kind = request.getKind() != null ? request.getKind() : NotificationKind.GENERIC;

        SendOutcome outcome = emailSender.send(request.getRecipient(), kind, context);
        if (!outcome.isSuccess()) {
            throw new NotificationDeliveryException("email", outcome.getDetail());
        }
        return ResponseEntity.ok(new DeliveryResponse("email", request.getRecipient(), outcome.getDetail()));
    }

    @PostMapping("/whatsapp")
    @Operation(summary = "Send a WhatsApp message",
               description = "Sends one WhatsApp message right away. Simulated when Twilio is not configured.")
    public ResponseEntity<DeliveryResponse> sendWhatsApp(@Valid @RequestBody WhatsAppRequest request) {
        SendOutcome outcome = whatsAppSender.send(request.getPhoneNumber(), NotificationKind.GENERIC,
                Map.of("message", request.getMessage()));
        if (!outcome.isSuccess()) {
            throw new NotificationDeliveryException("whatsapp", outcome.getDetail());
        }
        return ResponseEntity.ok(new DeliveryResponse("whatsapp", request.getPhoneNumber(), outcome.getDetail()));
    }
}
