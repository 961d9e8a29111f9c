package com.github.dimitryivaniuta.outreach.passes.service.issuance;

import com.github.dimitryivaniuta.outreach.passes.service.events.PassIssuedNotification;

/**
 * Hands the "your pass is ready" message to the delivery channel.
 */
public interface PassNotifier {

    /**
     * @param notification notification
     * @throws NotificationException when the channel did not accept the message
     */
    void sendPassNotification(PassIssuedNotification notification);
}
