package com.portfoliodevs.notifier.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Component
@ConfigurationProperties(prefix = "notifications")
public class NotificationProperties {

    /**
     * Link placed in email call-to-action buttons.
     */
    private String frontendUrl = "http://localhost:4200";

    private final Email email = new Email();

    private final WhatsApp whatsapp = new WhatsApp();

    public String getFrontendUrl() {
        return frontendUrl;
    }

    public void setFrontendUrl(String frontendUrl) {
        this.frontendUrl = frontendUrl;
    }

    public Email getEmail() {
        return email;
    }

    public WhatsApp getWhatsapp() {
        return whatsapp;
    }

    public static class Email {

        private String apiUrl = "https://api.brevo.com/v3/smtp/email";

        /**
         * Brevo API key. Email delivery fails fast when it is blank.
         */
        private String apiKey = "";

        private String fromAddress = "no-reply@portfoliodevs.com";

        private String fromName = "Portfolio Devs";

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration connectTimeout = Duration.ofSeconds(5);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration readTimeout = Duration.ofSeconds(30);

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getFromAddress() {
            return fromAddress;
        }

        public void setFromAddress(String fromAddress) {
            this.fromAddress = fromAddress;
        }

        public String getFromName() {
            return fromName;
        }

        public void setFromName(String fromName) {
            this.fromName = fromName;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class WhatsApp {

        private String accountSid = "";

        private String authToken = "";

        private String fromNumber = "whatsapp:+14155238886";

        /**
         * Messages are only logged, not sent, when credentials are missing.
         */
        public boolean isConfigured() {
            return accountSid != null && !accountSid.isBlank()
                    && authToken != null && !authToken.isBlank();
        }

        public String getAccountSid() {
            return accountSid;
        }

        public void setAccountSid(String accountSid) {
            this.accountSid = accountSid;
        }

        public String getAuthToken() {
            return authToken;
        }

        public void setAuthToken(String authToken) {
            this.authToken = authToken;
        }

        public String getFromNumber() {
            return fromNumber;
        }

        public void setFromNumber(String fromNumber) {
            this.fromNumber = fromNumber;
        }
    }
}
