package com.portfoliodevs.notifier.service;

import com.portfoliodevs.notifier.model.NotificationKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChannelRoutingNotificationSenderTest {

    @Mock
    private EmailNotificationSender emailSender;

    @Mock
    private WhatsAppNotificationSender whatsAppSender;

    private ChannelRoutingNotificationSender sender;

    private static final Map<String, String> CONTEXT = Map.of("date", "2026-11-20");

    @BeforeEach
    void setUp() {
        sender = new ChannelRoutingNotificationSender(emailSender, whatsAppSender);
    }

    @Test
    void send_InternationalPhoneNumber_GoesToWhatsApp() {
        when(whatsAppSender.send("+51987654321", NotificationKind.REMINDER, CONTEXT)).thenReturn(SendOutcome.success("SM1"));

        SendOutcome outcome = sender.send("+51987654321", NotificationKind.REMINDER, CONTEXT);

        assertThat(outcome.getDetail()).isEqualTo("SM1");
        verifyNoInteractions(emailSender);
    }

    @Test
    void send_PrefixedWhatsAppAddress_GoesToWhatsApp() {
        when(whatsAppSender.send("whatsapp:+51987654321", NotificationKind.REMINDER, CONTEXT))
                .thenReturn(SendOutcome.success("SM2"));

        sender.send("whatsapp:+51987654321", NotificationKind.REMINDER, CONTEXT);

        verifyNoInteractions(emailSender);
    }

    @Test
    void send_EmailAddress_GoesToEmail() {
        when(emailSender.send("ana@devs.com", NotificationKind.REMINDER, CONTEXT)).thenReturn(SendOutcome.success("msg-1"));

        SendOutcome outcome = sender.send("ana@devs.com", NotificationKind.REMINDER, CONTEXT);

        assertThat(outcome.isSuccess()).isTrue();
        verifyNoInteractions(whatsAppSender);
    }

    @Test
    void isPhoneNumber_RequiresLeadingPlusAndDigits() {
        assertThat(ChannelRoutingNotificationSender.isPhoneNumber("+14155238886")).isTrue();
        assertThat(ChannelRoutingNotificationSender.isPhoneNumber("987654321")).isFalse();
        assertThat(ChannelRoutingNotificationSender.isPhoneNumber("+51 987 654 321")).isFalse();
        assertThat(ChannelRoutingNotificationSender.isPhoneNumber(null)).isFalse();
    }
}
