package com.github.dimitryivaniuta.outreach.passes.service.dto;

import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;
import java.util.List;

/**
 * Parsed {@code metadata_json} of a job.
 *
 * @param requestedPlatforms wallet platforms requested by the trigger (may be empty)
 * @param source what created the job (enrollment, admin, ...), may be null
 */
public record JobMetadata(List<WalletPlatform> requestedPlatforms, String source) {

    public JobMetadata {
        requestedPlatforms = requestedPlatforms == null ? List.of() : List.copyOf(requestedPlatforms);
    }

    /**
     * @return metadata with no platforms and no source
     */
    public static JobMetadata empty() {
        return new JobMetadata(List.of(), null);
    }
}
