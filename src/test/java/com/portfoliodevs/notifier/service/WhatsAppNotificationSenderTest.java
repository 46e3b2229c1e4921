package com.portfoliodevs.notifier.service;

import com.portfoliodevs.notifier.config.NotificationProperties;
import com.portfoliodevs.notifier.model.NotificationKind;
import com.twilio.exception.ApiException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.rest.api.v2010.account.MessageCreator;
import com.twilio.type.PhoneNumber;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.MockedStatic;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WhatsAppNotificationSenderTest {

    @Mock
    private MessageCreator mockMessageCreator;

    @Mock
    private Message mockMessage;

    private NotificationProperties properties;
    private MeterRegistry meterRegistry;

    private static final String PHONE = "+51987654321";

    @BeforeEach
    void setUp() {
        properties = new NotificationProperties();
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void send_WithoutCredentials_IsSimulated() {
        // Given
        WhatsAppNotificationSender sender = newSender();

        try (MockedStatic<Message> mockedMessage = mockStatic(Message.class)) {
            // When
            SendOutcome outcome = sender.send(PHONE, NotificationKind.REMINDER, Map.of("programmer_name", "Ana"));

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.getDetail()).isEqualTo("simulated");
            mockedMessage.verifyNoInteractions();
        }
        assertThat(meterRegistry.counter("whatsapp_notification_total", "status", "simulated", "kind", "REMINDER").count()).isEqualTo(1.0);
    }

    @Test
    void send_WithCredentials_CreatesTwilioMessage() {
        // Given: Twilio.init() runs with test credentials, no API call is made
        configureCredentials();
        WhatsAppNotificationSender sender = newSender();

        try (MockedStatic<Message> mockedMessage = mockStatic(Message.class)) {
            mockedMessage.when(() -> Message.creator(any(PhoneNumber.class), any(PhoneNumber.class), anyString()))
                    .thenReturn(mockMessageCreator);
            when(mockMessageCreator.create()).thenReturn(mockMessage);
            when(mockMessage.getSid()).thenReturn("SM123456");

            // When
            SendOutcome outcome = sender.send(PHONE, NotificationKind.GENERIC, Map.of("message", "Hello from Portfolio Devs"));

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.getDetail()).isEqualTo("SM123456");
            mockedMessage.verify(() -> Message.creator(any(PhoneNumber.class), any(PhoneNumber.class),
                    eq("Hello from Portfolio Devs")));
        }
    }

    @Test
    void send_TwilioApiException_ReturnsFailure() {
        // Given
        configureCredentials();
        WhatsAppNotificationSender sender = newSender();
        ApiException apiException = mock(ApiException.class);
        when(apiException.getMessage()).thenReturn("Channel not enabled");
        when(apiException.getCode()).thenReturn(63007);

        try (MockedStatic<Message> mockedMessage = mockStatic(Message.class)) {
            mockedMessage.when(() -> Message.creator(any(PhoneNumber.class), any(PhoneNumber.class), anyString()))
                    .thenReturn(mockMessageCreator);
            when(mockMessageCreator.create()).thenThrow(apiException);

            // When
            SendOutcome outcome = sender.send(PHONE, NotificationKind.GENERIC, Map.of("message", "Hi"));

            // Then
            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.getDetail()).contains("63007").contains("Channel not enabled");
        }
    }

    @Test
    void toWhatsAppAddress_AddsPrefixOnlyOnce() {
        assertThat(WhatsAppNotificationSender.toWhatsAppAddress("+51987654321")).isEqualTo("whatsapp:+51987654321");
        assertThat(WhatsAppNotificationSender.toWhatsAppAddress("whatsapp:+51987654321")).isEqualTo("whatsapp:+51987654321");
        assertThat(WhatsAppNotificationSender.toWhatsAppAddress(" +51987654321 ")).isEqualTo("whatsapp:+51987654321");
    }

    private void configureCredentials() {
        properties.getWhatsapp().setAccountSid("ACtest");
        properties.getWhatsapp().setAuthToken("test-auth-token");
    }

    private WhatsAppNotificationSender newSender() {
        return new WhatsAppNotificationSender(properties, new NotificationTextGenerator(properties), meterRegistry);
    }
}
