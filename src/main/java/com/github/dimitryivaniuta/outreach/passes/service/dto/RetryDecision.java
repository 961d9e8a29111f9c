package com.github.dimitryivaniuta.outreach.passes.service.dto;

import java.time.Instant;

/**
 * What to do with a job after a failed attempt.
 *
 * @param deadLetter true to move the job to FAILED
 * @param retryCount retry count to store (previous count + 1)
 * @param notBefore earliest next claim when re-queued, null when dead-lettered
 */
public record RetryDecision(boolean deadLetter, int retryCount, Instant notBefore) {

    public static RetryDecision retryAt(int retryCount, Instant notBefore) {
        return new RetryDecision(false, retryCount, notBefore);
    }

    public static RetryDecision deadLetter(int retryCount) {
        return new RetryDecision(true, retryCount, null);
    }
}
