package com.github.dimitryivaniuta.outreach.passes.service.issuance;

/**
 * Failure that another attempt cannot fix, e.g. the attendee no longer exists.
 */
public class NonRetryableIssuanceException extends IssuanceException {

    public NonRetryableIssuanceException(String message) {
        super(message);
    }
}
