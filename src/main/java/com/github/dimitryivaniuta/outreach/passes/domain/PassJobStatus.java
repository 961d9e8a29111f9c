package com.github.dimitryivaniuta.outreach.passes.domain;

import java.util.Locale;

/**
 * Pass generation job status.
 *
 * <p>Stored as VARCHAR; values are enforced in code. COMPLETED and FAILED are terminal.</p>
 */
public enum PassJobStatus {
    /** Waiting to be claimed (initial, or re-queued after a failed attempt). */
    PENDING,
    /** Claimed by a worker invocation. */
    PROCESSING,
    /** Card and QR issued. */
    COMPLETED,
    /** Dead-lettered after exhausting retries. */
    FAILED;

    /**
     * Case-insensitive parse, accepting {@code pending} as well as {@code PENDING}.
     *
     * @param value raw value
     * @return status
     */
    public static PassJobStatus parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
