package com.github.dimitryivaniuta.outreach.passes.service.dto;

/**
 * Counters of one worker invocation.
 *
 * @param runId invocation id (also in the {@code workerRunId} MDC key)
 * @param recovered stale PROCESSING jobs released before claiming
 * @param claimed jobs claimed by this invocation
 * @param completed jobs written back as COMPLETED
 * @param retried jobs re-queued for another attempt
 * @param deadLettered jobs moved to FAILED
 * @param writeBackConflicts write-backs rejected because the claim was superseded
 * @param writeBackErrors write-backs that failed; those jobs stay PROCESSING until stale recovery
 */
public record WorkerRunSummary(
        String runId,
        int recovered,
        int claimed,
        int completed,
        int retried,
        int deadLettered,
        int writeBackConflicts,
        int writeBackErrors
) {

    public static WorkerRunSummary idle(String runId, int recovered) {
        return new WorkerRunSummary(runId, recovered, 0, 0, 0, 0, 0, 0);
    }
}
