package com.github.dimitryivaniuta.outreach.passes.service;

import com.github.dimitryivaniuta.outreach.passes.config.AppProperties;
import com.github.dimitryivaniuta.outreach.passes.domain.PassGenerationJob;
import com.github.dimitryivaniuta.outreach.passes.domain.PassJobStatus;
import com.github.dimitryivaniuta.outreach.passes.repo.PassGenerationJobRepository;
import com.github.dimitryivaniuta.outreach.passes.service.dto.ClaimedJob;
import com.github.dimitryivaniuta.outreach.passes.service.dto.FailureKind;
import com.github.dimitryivaniuta.outreach.passes.service.dto.RetryDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Claims PENDING jobs for one worker invocation and releases PROCESSING jobs whose claim has gone stale.
 *
 * <p>Claiming is a per-row conditional update ({@code PENDING -> PROCESSING}) inside one transaction, so two
 * concurrent invocations can race for the same row but only one update matches; the loser skips it. Every claim
 * gets a fresh token that later write-backs must present.</p>
 */
@Service
public class PassJobClaimEngine {

    private static final Logger log = LoggerFactory.getLogger(PassJobClaimEngine.class);

    private final PassGenerationJobRepository jobRepository;
    private final PassJobStore jobStore;
    private final RetryPolicy retryPolicy;
    private final AppProperties properties;
    private final Clock clock;

    private final Counter claimedCounter;
    private final Counter recoveredCounter;

    public PassJobClaimEngine(
            PassGenerationJobRepository jobRepository,
            PassJobStore jobStore,
            RetryPolicy retryPolicy,
            AppProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.jobRepository = jobRepository;
        this.jobStore = jobStore;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.clock = clock;

        this.claimedCounter = Counter.builder("passes.jobs.claimed").register(meterRegistry);
        this.recoveredCounter = Counter.builder("passes.jobs.recovered").register(meterRegistry);
    }

    /**
     * Claims up to {@code batchSize} eligible PENDING jobs, oldest first.
     *
     * @param batchSize maximum number of jobs
     * @return claimed jobs in creation order; may be shorter than the candidate list when other invocations won rows
     */
    @Transactional
    public List<ClaimedJob> claimBatch(int batchSize) {
        if (batchSize <= 0) {
            return List.of();
        }
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        List<String> candidates = jobRepository.findEligibleIds(PassJobStatus.PENDING, now, PageRequest.of(0, batchSize));
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<String> won = new ArrayList<>(candidates.size());
        for (String jobId : candidates) {
            int updated = jobRepository.claim(jobId, UUID.randomUUID().toString(), now,
                    PassJobStatus.PENDING, PassJobStatus.PROCESSING);
            if (updated == 1) {
                won.add(jobId);
            } else {
                log.debug("Job {} was claimed by another worker", jobId);
            }
        }

        Map<String, PassGenerationJob> byId = jobRepository.findAllById(won).stream()
                .collect(Collectors.toMap(PassGenerationJob::getJobId, Function.identity()));

        List<ClaimedJob> claimed = new ArrayList<>(won.size());
        for (String jobId : won) {
            claimed.add(jobStore.toClaimedJob(byId.get(jobId)));
        }
        claimedCounter.increment(claimed.size());
        return claimed;
    }

    /**
     * Releases PROCESSING jobs claimed longer ago than {@code app.worker.stale-processing-after}.
     *
     * <p>The lost attempt counts as a failed one: the job goes back to PENDING, or to FAILED when its retries
     * are exhausted. The release is conditional on the claim token observed here, so a worker that finishes at
     * the same moment wins or loses cleanly.</p>
     *
     * @return number of jobs released
     */
    @Transactional
    public int recoverStaleJobs() {
        AppProperties.Worker worker = properties.getWorker();
        Duration staleAfter = worker.getStaleProcessingAfter();
        Instant staleBefore = clock.instant().minus(staleAfter);

        List<PassGenerationJob> stale = jobRepository.findStarted(
                PassJobStatus.PROCESSING, staleBefore, PageRequest.of(0, worker.getStaleBatchSize()));

        int released = 0;
        for (PassGenerationJob job : stale) {
            RetryDecision decision = retryPolicy.decide(job.getRetryCount(), job.getMaxRetries(), FailureKind.RETRYABLE);
            String error = "Processing lease expired after " + staleAfter + " (claimed at " + job.getStartedAt() + ")";
            if (jobStore.applyFailure(job.getJobId(), job.getClaimToken(), decision, error)) {
                released++;
                recoveredCounter.increment();
                log.warn("Released stale job {} (attempt {}, {})", job.getJobId(), decision.retryCount(),
                        decision.deadLetter() ? "dead-lettered" : "re-queued");
            }
        }
        return released;
    }
}
