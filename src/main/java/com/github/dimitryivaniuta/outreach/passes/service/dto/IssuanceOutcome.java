package com.github.dimitryivaniuta.outreach.passes.service.dto;

/**
 * Result of running the issuance pipeline for one claimed job.
 *
 * @param success true when card and QR are issued
 * @param progress outputs produced (also on failure, for partial progress)
 * @param notificationError reason the notification failed, null if sent or skipped
 * @param failureKind classification when not successful
 * @param errorMessage failure reason when not successful
 */
public record IssuanceOutcome(
        boolean success,
        IssuanceProgress progress,
        String notificationError,
        FailureKind failureKind,
        String errorMessage
) {

    public static IssuanceOutcome completed(IssuanceProgress progress, String notificationError) {
        return new IssuanceOutcome(true, progress, notificationError, null, null);
    }

    public static IssuanceOutcome failed(IssuanceProgress progress, FailureKind kind, String errorMessage) {
        return new IssuanceOutcome(false, progress, null, kind, errorMessage);
    }
}
