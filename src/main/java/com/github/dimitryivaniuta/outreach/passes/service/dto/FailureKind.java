package com.github.dimitryivaniuta.outreach.passes.service.dto;

/**
 * Classification of a failed issuance attempt.
 */
public enum FailureKind {
    /** Network/service errors and anything unclassified. */
    RETRYABLE,
    /** Retrying cannot help (missing attendee, tenant mismatch). */
    NON_RETRYABLE
}
