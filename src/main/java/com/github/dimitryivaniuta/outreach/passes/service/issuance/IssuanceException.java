package com.github.dimitryivaniuta.outreach.passes.service.issuance;

/**
 * Failure of an issuance step. Retryable unless it is a {@link NonRetryableIssuanceException}.
 */
public class IssuanceException extends RuntimeException {

    public IssuanceException(String message) {
        super(message);
    }

    public IssuanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
