package com.github.dimitryivaniuta.outreach.passes.service.issuance;

import com.github.dimitryivaniuta.outreach.passes.domain.Attendee;

/**
 * Creates the attendee's contact card.
 */
public interface CardIssuer {

    /**
     * Returns the id of the attendee's card, creating it from the contact fields when none exists.
     *
     * @param attendee attendee
     * @return card id
     */
    String createCard(Attendee attendee);
}
