package com.github.dimitryivaniuta.outreach.passes.service.dto;

import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;
import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of a job taken right after this invocation claimed it.
 *
 * @param jobId job id
 * @param attendeeId attendee
 * @param tenantId tenant
 * @param claimToken token every write-back for this attempt must present
 * @param retryCount failed attempts so far
 * @param maxRetries failed attempts allowed
 * @param startedAt claim time
 * @param progress outputs already populated by earlier attempts
 * @param metadata parsed job metadata
 */
public record ClaimedJob(
        String jobId,
        String attendeeId,
        String tenantId,
        String claimToken,
        int retryCount,
        int maxRetries,
        Instant startedAt,
        IssuanceProgress progress,
        JobMetadata metadata
) {

    /**
     * @return wallet pass URLs issued by earlier attempts
     */
    public Map<WalletPlatform, String> walletPassUrls() {
        return progress.walletPassUrls();
    }
}
