package com.github.dimitryivaniuta.outreach.passes.service;

/**
 * A progress checkpoint was rejected: the job is no longer PROCESSING under this invocation's claim token
 * (stale recovery released it, or another invocation re-claimed it).
 */
public class ClaimLostException extends RuntimeException {

    public ClaimLostException(String jobId) {
        super("Claim on job " + jobId + " was superseded");
    }
}
