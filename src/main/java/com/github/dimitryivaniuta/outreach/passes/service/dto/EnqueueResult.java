package com.github.dimitryivaniuta.outreach.passes.service.dto;

import com.github.dimitryivaniuta.outreach.passes.domain.PassGenerationJob;

/**
 * Result of an issuance trigger.
 *
 * @param job the new job, or the existing job that made the trigger a no-op
 * @param created true if a new job row was inserted
 */
public record EnqueueResult(PassGenerationJob job, boolean created) {}
