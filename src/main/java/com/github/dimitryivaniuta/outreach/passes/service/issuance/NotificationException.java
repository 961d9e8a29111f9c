package com.github.dimitryivaniuta.outreach.passes.service.issuance;

/**
 * The pass notification could not be delivered to the notification channel.
 */
public class NotificationException extends IssuanceException {

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
