package com.github.dimitryivaniuta.outreach.passes.service;

import com.github.dimitryivaniuta.outreach.passes.config.AppProperties;
import com.github.dimitryivaniuta.outreach.passes.service.dto.ClaimedJob;
import com.github.dimitryivaniuta.outreach.passes.service.dto.FailureKind;
import com.github.dimitryivaniuta.outreach.passes.service.dto.IssuanceOutcome;
import com.github.dimitryivaniuta.outreach.passes.service.dto.IssuanceProgress;
import com.github.dimitryivaniuta.outreach.passes.service.dto.JobMetadata;
import com.github.dimitryivaniuta.outreach.passes.service.dto.RetryDecision;
import com.github.dimitryivaniuta.outreach.passes.service.dto.WorkerRunSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Batch orchestration of the worker: per-job write-back, isolation, timeouts and run counters.
 */
class PassGenerationWorkerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final PassJobClaimEngine claimEngine = Mockito.mock(PassJobClaimEngine.class);
    private final IssuancePipeline pipeline = Mockito.mock(IssuancePipeline.class);
    private final PassJobStore jobStore = Mockito.mock(PassJobStore.class);

    private AppProperties properties;
    private ThreadPoolTaskExecutor executor;
    private SimpleMeterRegistry meterRegistry;
    private PassGenerationWorker worker;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getWorker().setBatchSize(20);
        properties.getWorker().setJobTimeout(Duration.ofSeconds(5));
        properties.getRetry().setMaxRetries(3);
        properties.getRetry().setBaseBackoff(Duration.ofSeconds(30));
        properties.getRetry().setJitter(false);

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(40);
        executor.setThreadNamePrefix("test-issuance-");
        executor.initialize();

        meterRegistry = new SimpleMeterRegistry();
        worker = newWorker(executor);

        Mockito.when(jobStore.complete(Mockito.any(), Mockito.any())).thenReturn(true);
        Mockito.when(jobStore.applyFailure(Mockito.anyString(), Mockito.anyString(), Mockito.any(), Mockito.any())).thenReturn(true);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void idleRunStillRecoversStaleJobs() {
        Mockito.when(claimEngine.recoverStaleJobs()).thenReturn(2);
        Mockito.when(claimEngine.claimBatch(20)).thenReturn(List.of());

        WorkerRunSummary summary = worker.runOnce();

        Assertions.assertEquals(2, summary.recovered());
        Assertions.assertEquals(0, summary.claimed());
        Assertions.assertNotNull(summary.runId());
        Mockito.verifyNoInteractions(pipeline);
    }

    @Test
    void eachJobOfTheBatchGetsItsOwnOutcome() {
        ClaimedJob ok = job("job-ok", 0);
        ClaimedJob flaky = job("job-flaky", 0);
        ClaimedJob exhausted = job("job-exhausted", 2);
        Mockito.when(claimEngine.claimBatch(20)).thenReturn(List.of(ok, flaky, exhausted));
        Mockito.when(pipeline.run(ok)).thenReturn(IssuanceOutcome.completed(IssuanceProgress.none().withCardId("c1"), null));
        Mockito.when(pipeline.run(flaky)).thenReturn(IssuanceOutcome.failed(IssuanceProgress.none(), FailureKind.RETRYABLE, "qr timeout"));
        Mockito.when(pipeline.run(exhausted)).thenReturn(IssuanceOutcome.failed(IssuanceProgress.none(), FailureKind.RETRYABLE, "qr timeout"));

        WorkerRunSummary summary = worker.runOnce();

        Assertions.assertEquals(3, summary.claimed());
        Assertions.assertEquals(1, summary.completed());
        Assertions.assertEquals(1, summary.retried());
        Assertions.assertEquals(1, summary.deadLettered());

        ArgumentCaptor<RetryDecision> flakyDecision = ArgumentCaptor.forClass(RetryDecision.class);
        Mockito.verify(jobStore).applyFailure(Mockito.eq("job-flaky"), Mockito.eq("token-job-flaky"), flakyDecision.capture(), Mockito.eq("qr timeout"));
        Assertions.assertFalse(flakyDecision.getValue().deadLetter());
        Assertions.assertEquals(1, flakyDecision.getValue().retryCount());
        Assertions.assertEquals(NOW.plusSeconds(30), flakyDecision.getValue().notBefore());

        ArgumentCaptor<RetryDecision> exhaustedDecision = ArgumentCaptor.forClass(RetryDecision.class);
        Mockito.verify(jobStore).applyFailure(Mockito.eq("job-exhausted"), Mockito.anyString(), exhaustedDecision.capture(), Mockito.anyString());
        Assertions.assertTrue(exhaustedDecision.getValue().deadLetter());
        Assertions.assertEquals(3, exhaustedDecision.getValue().retryCount());

        Assertions.assertEquals(1.0, meterRegistry.counter("passes.jobs.completed").count());
        Assertions.assertEquals(1.0, meterRegistry.counter("passes.jobs.retried").count());
        Assertions.assertEquals(1.0, meterRegistry.counter("passes.jobs.dead").count());
    }

    @Test
    void crashedPipelineIsRetriedWithoutAffectingOthers() {
        ClaimedJob crash = job("job-crash", 0);
        ClaimedJob ok = job("job-ok", 0);
        Mockito.when(claimEngine.claimBatch(20)).thenReturn(List.of(crash, ok));
        Mockito.when(pipeline.run(crash)).thenThrow(new IllegalStateException("boom"));
        Mockito.when(pipeline.run(ok)).thenReturn(IssuanceOutcome.completed(IssuanceProgress.none(), null));

        WorkerRunSummary summary = worker.runOnce();

        Assertions.assertEquals(1, summary.completed());
        Assertions.assertEquals(1, summary.retried());
        Mockito.verify(jobStore).applyFailure(Mockito.eq("job-crash"), Mockito.anyString(), Mockito.any(), Mockito.eq("boom"));
    }

    @Test
    void slowJobTimesOutAndIsRetried() {
        properties.getWorker().setJobTimeout(Duration.ofMillis(200));
        ClaimedJob slow = job("job-slow", 0);
        ClaimedJob ok = job("job-ok", 0);
        Mockito.when(claimEngine.claimBatch(20)).thenReturn(List.of(slow, ok));
        Mockito.when(pipeline.run(slow)).thenAnswer(inv -> {
            Thread.sleep(10_000);
            return IssuanceOutcome.completed(IssuanceProgress.none(), null);
        });
        Mockito.when(pipeline.run(ok)).thenReturn(IssuanceOutcome.completed(IssuanceProgress.none(), null));

        WorkerRunSummary summary = worker.runOnce();

        Assertions.assertEquals(1, summary.completed());
        Assertions.assertEquals(1, summary.retried());
        ArgumentCaptor<String> error = ArgumentCaptor.forClass(String.class);
        Mockito.verify(jobStore).applyFailure(Mockito.eq("job-slow"), Mockito.anyString(), Mockito.any(), error.capture());
        Assertions.assertTrue(error.getValue().startsWith("Issuance timed out"));
    }

    @Test
    void supersededClaimIsCountedAsConflict() {
        ClaimedJob lost = job("job-lost", 0);
        Mockito.when(claimEngine.claimBatch(20)).thenReturn(List.of(lost));
        Mockito.when(pipeline.run(lost)).thenReturn(IssuanceOutcome.completed(IssuanceProgress.none(), null));
        Mockito.when(jobStore.complete(Mockito.eq(lost), Mockito.any())).thenReturn(false);

        WorkerRunSummary summary = worker.runOnce();

        Assertions.assertEquals(0, summary.completed());
        Assertions.assertEquals(1, summary.writeBackConflicts());
        Assertions.assertEquals(0.0, meterRegistry.counter("passes.jobs.completed").count());
    }

    @Test
    void failedWriteBackDoesNotStopTheBatch() {
        ClaimedJob broken = job("job-broken", 0);
        ClaimedJob ok = job("job-ok", 0);
        Mockito.when(claimEngine.claimBatch(20)).thenReturn(List.of(broken, ok));
        Mockito.when(pipeline.run(Mockito.any())).thenReturn(IssuanceOutcome.completed(IssuanceProgress.none(), null));
        Mockito.when(jobStore.complete(Mockito.eq(broken), Mockito.any()))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        WorkerRunSummary summary = worker.runOnce();

        Assertions.assertEquals(1, summary.completed());
        Assertions.assertEquals(1, summary.writeBackErrors());
    }

    @Test
    void jobsRunWithRunAndJobIdsInMdc() {
        ClaimedJob first = job("job-1", 0);
        ClaimedJob second = job("job-2", 0);
        Mockito.when(claimEngine.claimBatch(20)).thenReturn(List.of(first, second));

        Map<String, String> seenRunIds = new ConcurrentHashMap<>();
        Mockito.when(pipeline.run(Mockito.any())).thenAnswer(inv -> {
            ClaimedJob job = inv.getArgument(0);
            Assertions.assertEquals(job.jobId(), MDC.get(PassGenerationWorker.JOB_ID_MDC_KEY));
            seenRunIds.put(job.jobId(), MDC.get(PassGenerationWorker.RUN_ID_MDC_KEY));
            return IssuanceOutcome.completed(IssuanceProgress.none(), null);
        });

        WorkerRunSummary summary = worker.runOnce();

        Assertions.assertEquals(2, summary.completed());
        Assertions.assertEquals(Map.of("job-1", summary.runId(), "job-2", summary.runId()), seenRunIds);
        Assertions.assertNull(MDC.get(PassGenerationWorker.RUN_ID_MDC_KEY));
    }

    @Test
    void hungJobsAreTimedOutPerWaveNotOneAfterAnother() {
        properties.getWorker().setJobTimeout(Duration.ofMillis(500));
        List<ClaimedJob> batch = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            batch.add(job("job-hung-" + i, 0));
        }
        Mockito.when(claimEngine.claimBatch(20)).thenReturn(batch);
        Mockito.when(pipeline.run(Mockito.any())).thenAnswer(inv -> {
            Thread.sleep(60_000);
            return IssuanceOutcome.completed(IssuanceProgress.none(), null);
        });

        long started = System.nanoTime();
        WorkerRunSummary summary = worker.runOnce();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        Assertions.assertEquals(8, summary.retried());
        Assertions.assertTrue(elapsedMs < 2_500, "two waves of 500ms, took " + elapsedMs + " ms");
    }

    @Test
    void jobStillQueuedAtTheBatchDeadlineIsGivenUpWithoutRunning() throws Exception {
        properties.getWorker().setParallelism(1);
        properties.getWorker().setJobTimeout(Duration.ofMillis(300));
        ThreadPoolTaskExecutor single = new ThreadPoolTaskExecutor();
        single.setCorePoolSize(1);
        single.setMaxPoolSize(1);
        single.setQueueCapacity(10);
        single.initialize();
        CountDownLatch release = new CountDownLatch(1);
        try {
            ClaimedJob stuck = job("job-stuck", 0);
            ClaimedJob queued = job("job-queued", 0);
            Mockito.when(claimEngine.claimBatch(20)).thenReturn(List.of(stuck, queued));
            Mockito.when(pipeline.run(stuck)).thenAnswer(inv -> {
                boolean released = false;
                while (!released) {
                    try {
                        released = release.await(50, TimeUnit.MILLISECONDS);
                    } catch (InterruptedException ignored) {
                        // keeps blocking, like a client call without a timeout
                    }
                }
                return IssuanceOutcome.completed(IssuanceProgress.none(), null);
            });

            WorkerRunSummary summary = newWorker(single).runOnce();

            Assertions.assertEquals(2, summary.retried());
            ArgumentCaptor<String> error = ArgumentCaptor.forClass(String.class);
            Mockito.verify(jobStore).applyFailure(Mockito.eq("job-queued"), Mockito.anyString(), Mockito.any(), error.capture());
            Assertions.assertTrue(error.getValue().startsWith("Issuance did not start"), error.getValue());
        } finally {
            release.countDown();
            single.shutdown();
        }
        Mockito.verify(pipeline, Mockito.never()).run(Mockito.argThat(j -> j.jobId().equals("job-queued")));
    }

    @Test
    void timeoutThatOutlivesTheStaleLeaseIsRejectedAtStartup() {
        properties.getWorker().setJobTimeout(Duration.ofMinutes(5));

        IllegalStateException ex = Assertions.assertThrows(IllegalStateException.class, () -> newWorker(executor));
        Assertions.assertTrue(ex.getMessage().contains("stale-processing-after"));
    }

    private PassGenerationWorker newWorker(ThreadPoolTaskExecutor taskExecutor) {
        RetryPolicy retryPolicy = new RetryPolicy(properties, Clock.fixed(NOW, ZoneOffset.UTC));
        return new PassGenerationWorker(claimEngine, pipeline, jobStore, retryPolicy, properties, taskExecutor, meterRegistry);
    }

    private static ClaimedJob job(String jobId, int retryCount) {
        return new ClaimedJob(
                jobId,
                "attendee-" + jobId,
                "tenant-1",
                "token-" + jobId,
                retryCount,
                3,
                NOW,
                IssuanceProgress.none(),
                JobMetadata.empty()
        );
    }
}
