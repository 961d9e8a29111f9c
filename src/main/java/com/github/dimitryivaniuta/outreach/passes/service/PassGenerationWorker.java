package com.github.dimitryivaniuta.outreach.passes.service;

import static com.github.dimitryivaniuta.outreach.passes.config.WorkerConfig.ISSUANCE_EXECUTOR;

import com.github.dimitryivaniuta.outreach.passes.config.AppProperties;
import com.github.dimitryivaniuta.outreach.passes.service.dto.ClaimedJob;
import com.github.dimitryivaniuta.outreach.passes.service.dto.FailureKind;
import com.github.dimitryivaniuta.outreach.passes.service.dto.IssuanceOutcome;
import com.github.dimitryivaniuta.outreach.passes.service.dto.RetryDecision;
import com.github.dimitryivaniuta.outreach.passes.service.dto.WorkerRunSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * One worker invocation: release stale claims, claim a batch, run the issuance pipeline for each job on the
 * issuance executor and write each outcome back.
 *
 * <p>Jobs of a batch are isolated from each other: one job failing, timing out or losing its claim never changes
 * the result recorded for another. Write-backs are per job and conditional on the job's claim token.</p>
 */
@Service
public class PassGenerationWorker {

    private static final Logger log = LoggerFactory.getLogger(PassGenerationWorker.class);

    /** MDC key carrying the invocation id. */
    public static final String RUN_ID_MDC_KEY = "workerRunId";

    /** MDC key carrying the job id while a job is processed. */
    public static final String JOB_ID_MDC_KEY = "jobId";

    private enum WriteBack { COMPLETED, RETRIED, DEAD_LETTERED, CONFLICT, ERROR }

    private final PassJobClaimEngine claimEngine;
    private final IssuancePipeline pipeline;
    private final PassJobStore jobStore;
    private final RetryPolicy retryPolicy;
    private final AppProperties properties;
    private final AsyncTaskExecutor executor;

    private final Counter completedCounter;
    private final Counter retriedCounter;
    private final Counter deadCounter;

    public PassGenerationWorker(
            PassJobClaimEngine claimEngine,
            IssuancePipeline pipeline,
            PassJobStore jobStore,
            RetryPolicy retryPolicy,
            AppProperties properties,
            @Qualifier(ISSUANCE_EXECUTOR) AsyncTaskExecutor executor,
            MeterRegistry meterRegistry
    ) {
        this.claimEngine = claimEngine;
        this.pipeline = pipeline;
        this.jobStore = jobStore;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.executor = executor;

        AppProperties.Worker worker = properties.getWorker();
        // a job may start just before the batch deadline and then run for its own timeout
        Duration longestRun = worker.maxBatchDuration(worker.getBatchSize()).plus(worker.getJobTimeout());
        if (longestRun.compareTo(worker.getStaleProcessingAfter()) >= 0) {
            throw new IllegalStateException("app.worker.job-timeout allows a batch to run for " + longestRun
                    + ", which is not below app.worker.stale-processing-after (" + worker.getStaleProcessingAfter()
                    + "); claimed jobs would be released while still running");
        }

        this.completedCounter = Counter.builder("passes.jobs.completed").register(meterRegistry);
        this.retriedCounter = Counter.builder("passes.jobs.retried").register(meterRegistry);
        this.deadCounter = Counter.builder("passes.jobs.dead").register(meterRegistry);
    }

    /**
     * Runs one invocation to completion.
     *
     * @return counters of the invocation
     */
    public WorkerRunSummary runOnce() {
        String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID_MDC_KEY, runId);
        try {
            return process(runId);
        } finally {
            MDC.remove(RUN_ID_MDC_KEY);
        }
    }

    private WorkerRunSummary process(String runId) {
        AppProperties.Worker worker = properties.getWorker();

        int recovered = claimEngine.recoverStaleJobs();
        List<ClaimedJob> batch = claimEngine.claimBatch(worker.getBatchSize());
        if (batch.isEmpty()) {
            log.debug("No pass generation jobs to process");
            return WorkerRunSummary.idle(runId, recovered);
        }
        log.info("Claimed {} pass generation jobs", batch.size());

        Duration jobTimeout = worker.getJobTimeout();
        Duration batchBudget = worker.maxBatchDuration(batch.size());
        long batchDeadline = System.nanoTime() + batchBudget.toNanos();

        List<RunningJob> running = new ArrayList<>(batch.size());
        for (ClaimedJob job : batch) {
            running.add(submit(runId, job));
        }

        int completed = 0;
        int retried = 0;
        int deadLettered = 0;
        int conflicts = 0;
        int errors = 0;
        for (RunningJob run : running) {
            IssuanceOutcome outcome = await(run, jobTimeout, batchBudget, batchDeadline);
            switch (writeBack(run.job, outcome)) {
                case COMPLETED -> completed++;
                case RETRIED -> retried++;
                case DEAD_LETTERED -> deadLettered++;
                case CONFLICT -> conflicts++;
                case ERROR -> errors++;
            }
        }

        WorkerRunSummary summary = new WorkerRunSummary(
                runId, recovered, batch.size(), completed, retried, deadLettered, conflicts, errors);
        log.info("Worker run finished: claimed={} completed={} retried={} dead={} conflicts={} errors={}",
                summary.claimed(), completed, retried, deadLettered, conflicts, errors);
        return summary;
    }

    private RunningJob submit(String runId, ClaimedJob job) {
        RunningJob run = new RunningJob(job);
        try {
            run.future = executor.submit(() -> {
                run.markStarted();
                MDC.put(RUN_ID_MDC_KEY, runId);
                MDC.put(JOB_ID_MDC_KEY, job.jobId());
                try {
                    return pipeline.run(job);
                } finally {
                    MDC.remove(JOB_ID_MDC_KEY);
                    MDC.remove(RUN_ID_MDC_KEY);
                }
            });
        } catch (TaskRejectedException ex) {
            log.warn("Issuance executor rejected job {}", job.jobId());
            run.future = CompletableFuture.completedFuture(IssuanceOutcome.failed(
                    job.progress(), FailureKind.RETRYABLE, "Issuance executor rejected the job: " + ex.getMessage()));
        }
        return run;
    }

    /**
     * Waits for one job. Its timeout counts from the moment it started on the executor; a job still queued when
     * the batch deadline passes is given up without running.
     */
    private IssuanceOutcome await(RunningJob run, Duration jobTimeout, Duration batchBudget, long batchDeadline) {
        ClaimedJob job = run.job;
        Future<IssuanceOutcome> future = run.future;
        try {
            if (!future.isDone() && !run.started.await(remainingNanos(batchDeadline), TimeUnit.NANOSECONDS)) {
                future.cancel(true);
                log.warn("Job {} did not start within {}", job.jobId(), batchBudget);
                return IssuanceOutcome.failed(job.progress(), FailureKind.RETRYABLE,
                        "Issuance did not start within " + batchBudget);
            }
            long jobDeadline = future.isDone() ? System.nanoTime() : run.startedAtNanos + jobTimeout.toNanos();
            return future.get(remainingNanos(jobDeadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Job {} timed out after {}", job.jobId(), jobTimeout);
            return IssuanceOutcome.failed(job.progress(), FailureKind.RETRYABLE, "Issuance timed out after " + jobTimeout);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return IssuanceOutcome.failed(job.progress(), FailureKind.RETRYABLE, "Worker interrupted");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.error("Issuance of job {} crashed", job.jobId(), cause);
            return IssuanceOutcome.failed(job.progress(), FailureKind.RETRYABLE, Failures.describe(cause));
        }
    }

    private static long remainingNanos(long deadline) {
        return Math.max(0L, deadline - System.nanoTime());
    }

    private WriteBack writeBack(ClaimedJob job, IssuanceOutcome outcome) {
        MDC.put(JOB_ID_MDC_KEY, job.jobId());
        try {
            if (outcome.success()) {
                if (!jobStore.complete(job, outcome)) {
                    return conflict(job);
                }
                completedCounter.increment();
                log.info("Job {} completed with card {}", job.jobId(), outcome.progress().cardId());
                return WriteBack.COMPLETED;
            }

            RetryDecision decision = retryPolicy.decide(job.retryCount(), job.maxRetries(), outcome.failureKind());
            if (!jobStore.applyFailure(job.jobId(), job.claimToken(), decision, outcome.errorMessage())) {
                return conflict(job);
            }
            if (decision.deadLetter()) {
                deadCounter.increment();
                log.error("Job {} failed permanently after {} attempts: {}", job.jobId(), decision.retryCount(), outcome.errorMessage());
                return WriteBack.DEAD_LETTERED;
            }
            retriedCounter.increment();
            log.warn("Job {} attempt {} failed, retry not before {}: {}", job.jobId(), decision.retryCount(),
                    decision.notBefore(), outcome.errorMessage());
            return WriteBack.RETRIED;
        } catch (Exception ex) {
            log.error("Write-back of job {} failed; it stays PROCESSING until stale recovery", job.jobId(), ex);
            return WriteBack.ERROR;
        } finally {
            MDC.remove(JOB_ID_MDC_KEY);
        }
    }

    private WriteBack conflict(ClaimedJob job) {
        log.warn("Job {} was taken over by another worker; result discarded", job.jobId());
        return WriteBack.CONFLICT;
    }

    private static final class RunningJob {
        private final ClaimedJob job;
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startedAtNanos;
        private Future<IssuanceOutcome> future;

        private RunningJob(ClaimedJob job) {
            this.job = job;
        }

        private void markStarted() {
            startedAtNanos = System.nanoTime();
            started.countDown();
        }
    }
}
