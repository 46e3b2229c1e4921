package com.portfoliodevs.notifier.service;

import com.portfoliodevs.notifier.config.NotificationProperties;
import com.portfoliodevs.notifier.model.NotificationKind;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.Map;

/**
 * Shared notification text generator for email and WhatsApp.
 * Context keys {@code subject} and {@code message} override the defaults of each kind;
 * {@code recipient_name} overrides who the email greets.
 */
@Component
public class NotificationTextGenerator {

    public static final String NEW_REQUEST_SUBJECT = "New advisory request";
    public static final String APPROVED_SUBJECT = "Your advisory session was approved";
    public static final String REJECTED_SUBJECT = "Update on your advisory request";
    public static final String REMINDER_SUBJECT = "Reminder: upcoming advisory session";
    public static final String GENERIC_SUBJECT = "Notification";

    private final NotificationProperties properties;

    public NotificationTextGenerator(NotificationProperties properties) {
        this.properties = properties;
    }

    public String getSubject(NotificationKind kind, Map<String, String> context) {
        String override = context.get("subject");
        if (hasText(override)) {
            return override;
        }
        return switch (kind) {
            case NEW_REQUEST -> NEW_REQUEST_SUBJECT;
            case APPROVED -> APPROVED_SUBJECT;
            case REJECTED -> REJECTED_SUBJECT;
            case REMINDER -> REMINDER_SUBJECT;
            case GENERIC -> GENERIC_SUBJECT;
        };
    }

    /**
     * Plain text body for WhatsApp.
     */
    public String getPlainBody(NotificationKind kind, Map<String, String> context) {
        String override = context.get("message");
        if (hasText(override)) {
            return override;
        }
        String programmer = value(context, "programmer_name", "your programmer");
        String when = value(context, "date", "today") + " at " + value(context, "time", "the agreed time");
        return switch (kind) {
            case NEW_REQUEST -> String.format("New advisory request from %s for %s",
                    value(context, "user_name", "a user"), when);
            case APPROVED -> String.format("Your advisory session was approved!\nDate: %s\nWith: %s", when, programmer);
            case REJECTED -> String.format("Your advisory request was not approved.\nProgrammer: %s\nReason: %s",
                    programmer, value(context, "response_message", "Not specified"));
            case REMINDER -> String.format("Reminder: your advisory session is %s with %s", when, programmer);
            case GENERIC -> GENERIC_SUBJECT;
        };
    }

    /**
     * HTML body for email. All context values are HTML-escaped.
     */
    public String getHtmlBody(NotificationKind kind, Map<String, String> context) {
        String message = escape(value(context, "message", ""));
        String content = switch (kind) {
            case NEW_REQUEST -> "<h2>New Advisory Request</h2>"
                    + "<p>Hello <strong>" + greeting(context, "programmer_name", "Programmer") + "</strong>,</p>"
                    + "<p>" + message + "</p>"
                    + detailList(
                    item("Requested by", escaped(context, "user_name", "User")),
                    item("Date", escaped(context, "date", "Not specified")),
                    item("Time", escaped(context, "time", "Not specified")),
                    item("Reason", escaped(context, "reason", "Not specified")))
                    + "<p>Open your dashboard to approve or reject this request.</p>"
                    + button("/programmer", "Open dashboard");
            case APPROVED -> "<h2>Advisory Session Approved</h2>"
                    + "<p>Hello <strong>" + greeting(context, "user_name", "User") + "</strong>,</p>"
                    + "<p>" + message + "</p>"
                    + detailList(
                    item("Programmer", escaped(context, "programmer_name", "Programmer")),
                    item("Date", escaped(context, "date", "Not specified")),
                    item("Time", escaped(context, "time", "Not specified")))
                    + "<p><em>" + escaped(context, "response_message", "No additional message") + "</em></p>";
            case REJECTED -> "<h2>Advisory Request Update</h2>"
                    + "<p>Hello <strong>" + greeting(context, "user_name", "User") + "</strong>,</p>"
                    + "<p>" + message + "</p>"
                    + "<p><strong>Reason:</strong> <em>"
                    + escaped(context, "response_message", "The programmer is not available at that time")
                    + "</em></p>"
                    + "<p>You can try booking another time.</p>"
                    + button("", "Browse programmers");
            case REMINDER -> "<h2>Advisory Session Reminder</h2>"
                    + "<p>Hello,</p>"
                    + "<p>This is a reminder of your upcoming advisory session:</p>"
                    + detailList(
                    item("Date", escaped(context, "date", "Today")),
                    item("Time", escaped(context, "time", "Soon")),
                    item("With", escaped(context, "programmer_name", "Programmer")))
                    + "<p>Don't forget to join on time!</p>";
            case GENERIC -> "<h2>Notification</h2><p>" + message + "</p>";
        };
        return "<!DOCTYPE html><html><head><meta charset=\"UTF-8\"></head><body>"
                + "<div class=\"header\"><h1>Portfolio Devs</h1></div>"
                + "<div class=\"content\">" + content + "</div>"
                + "<div class=\"footer\"><p>This is an automated email, please do not reply.</p></div>"
                + "</body></html>";
    }

    private String button(String path, String label) {
        String href = escape(properties.getFrontendUrl() + path);
        return "<a href=\"" + href + "\" class=\"button\">" + label + "</a>";
    }

    private static String greeting(Map<String, String> context, String defaultKey, String fallback) {
        String name = context.get("recipient_name");
        return hasText(name) ? escape(name) : escaped(context, defaultKey, fallback);
    }

    private static String detailList(String... items) {
        return "<div class=\"info-box\"><ul>" + String.join("", items) + "</ul></div>";
    }

    private static String item(String label, String escapedValue) {
        return "<li><strong>" + label + ":</strong> " + escapedValue + "</li>";
    }

    private static String escaped(Map<String, String> context, String key, String fallback) {
        return escape(value(context, key, fallback));
    }

    private static String value(Map<String, String> context, String key, String fallback) {
        String value = context.get(key);
        return hasText(value) ? value : fallback;
    }

    private static String escape(String value) {
        return HtmlUtils.htmlEscape(value);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
