package com.github.dimitryivaniuta.outreach.passes.service.events;

import java.time.Instant;
import java.util.Map;

/**
 * Message published when an attendee's pass is ready; the email sender renders and delivers it.
 *
 * @param schemaVersion payload version
 * @param notificationId unique message id
 * @param occurredAt publish time
 * @param jobId job that issued the pass
 * @param tenantId tenant
 * @param eventId attendee's event
 * @param attendeeId attendee (Kafka key)
 * @param recipientEmail recipient
 * @param displayName recipient name
 * @param cardId card
 * @param cardUrl public card URL
 * @param vcardUrl vCard download URL
 * @param qrUrl QR image location
 * @param walletPasses pass URL per platform key
 */
public record PassIssuedNotification(
        String schemaVersion,
        String notificationId,
        Instant occurredAt,
        String jobId,
        String tenantId,
        String eventId,
        String attendeeId,
        String recipientEmail,
        String displayName,
        String cardId,
        String cardUrl,
        String vcardUrl,
        String qrUrl,
        Map<String, String> walletPasses
) {}
