package com.github.dimitryivaniuta.outreach.passes.service;

import com.github.dimitryivaniuta.outreach.passes.config.AppProperties;
import com.github.dimitryivaniuta.outreach.passes.domain.Attendee;
import com.github.dimitryivaniuta.outreach.passes.domain.PassGenerationJob;
import com.github.dimitryivaniuta.outreach.passes.domain.PassJobStatus;
import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;
import com.github.dimitryivaniuta.outreach.passes.repo.AttendeeRepository;
import com.github.dimitryivaniuta.outreach.passes.repo.PassGenerationJobRepository;
import com.github.dimitryivaniuta.outreach.passes.service.dto.ClaimedJob;
import com.github.dimitryivaniuta.outreach.passes.service.dto.EnqueueResult;
import com.github.dimitryivaniuta.outreach.passes.service.dto.IssuanceOutcome;
import com.github.dimitryivaniuta.outreach.passes.service.dto.IssuanceProgress;
import com.github.dimitryivaniuta.outreach.passes.service.dto.JobMetadata;
import com.github.dimitryivaniuta.outreach.passes.service.dto.RetryDecision;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.ErrorResponseException;

/**
 * Job Store: the only shared mutable state of the issuance system.
 *
 * <p>Supports insert-if-absent per attendee, progress checkpoints and per-job terminal/retry write-back. Every
 * write after insert is conditional on the expected prior status and the claim token; a {@code false} return
 * means another invocation moved the job first and the caller must not assume its write happened.</p>
 */
@Service
public class PassJobStore {

    private static final Logger log = LoggerFactory.getLogger(PassJobStore.class);

    private static final Set<PassJobStatus> ACTIVE = EnumSet.of(PassJobStatus.PENDING, PassJobStatus.PROCESSING);

    private final PassGenerationJobRepository jobRepository;
    private final AttendeeRepository attendeeRepository;
    private final JobMetadataCodec codec;
    private final AppProperties properties;
    private final Clock clock;

    public PassJobStore(
            PassGenerationJobRepository jobRepository,
            AttendeeRepository attendeeRepository,
            JobMetadataCodec codec,
            AppProperties properties,
            Clock clock
    ) {
        this.jobRepository = jobRepository;
        this.attendeeRepository = attendeeRepository;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Requests issuance for an attendee.
     *
     * <ul>
     *   <li>Attendee already holds a card: returns its latest COMPLETED job, or records a COMPLETED job for the
     *   existing card.</li>
     *   <li>A PENDING/PROCESSING job exists: returns it (no-op).</li>
     *   <li>Otherwise inserts a PENDING job.</li>
     * </ul>
     *
     * @param attendeeId attendee
     * @param tenantId tenant the caller acts for; must own the attendee
     * @param platforms requested wallet platforms
     * @param source trigger name stored in metadata (may be null)
     * @return job and whether it was created
     */
    @Transactional
    public EnqueueResult enqueue(String attendeeId, String tenantId, List<WalletPlatform> platforms, String source) {
        Attendee attendee = attendeeRepository.findById(attendeeId)
                .filter(a -> a.getTenantId().equals(tenantId))
                .orElseThrow(() -> notFound("Attendee '" + attendeeId + "' not found"));

        String metadataJson = codec.writeMetadata(new JobMetadata(platforms, source));
        int maxRetries = properties.getRetry().getMaxRetries();
        Instant now = clock.instant();

        if (attendee.getCardId() != null) {
            // concurrent requests would each record an audit job
            attendeeRepository.findByIdForUpdate(attendeeId);
            Optional<PassGenerationJob> done = jobRepository
                    .findFirstByAttendeeIdAndStatusOrderByCreatedAtDesc(attendeeId, PassJobStatus.COMPLETED);
            if (done.isPresent()) {
                return new EnqueueResult(done.get(), false);
            }
            PassGenerationJob audit = PassGenerationJob.completedForExistingCard(
                    attendeeId, tenantId, attendee.getCardId(), maxRetries, metadataJson, now);
            jobRepository.save(audit);
            log.info("Attendee {} already holds card {}; recorded completed job {}", attendeeId, attendee.getCardId(), audit.getJobId());
            return new EnqueueResult(audit, true);
        }

        PassGenerationJob candidate = PassGenerationJob.pending(attendeeId, tenantId, maxRetries, metadataJson, now);
        int inserted = jobRepository.insertIfNoActiveJob(
                candidate.getJobId(), attendeeId, tenantId, maxRetries, now, metadataJson);

        if (inserted == 1) {
            log.info("Queued pass generation job {} for attendee {} tenant {}", candidate.getJobId(), attendeeId, tenantId);
            return new EnqueueResult(jobRepository.findById(candidate.getJobId()).orElseThrow(), true);
        }

        PassGenerationJob active = jobRepository.findByAttendeeAndStatuses(attendeeId, ACTIVE).stream()
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Active job for attendee " + attendeeId + " vanished during enqueue"));
        log.debug("Attendee {} already has active job {}", attendeeId, active.getJobId());
        return new EnqueueResult(active, false);
    }

    /**
     * Write-once checkpoint of the outputs produced so far.
     *
     * @param job claimed job
     * @param progress outputs
     * @return false if the claim was superseded
     */
    @Transactional
    public boolean recordProgress(ClaimedJob job, IssuanceProgress progress) {
        return jobRepository.recordProgress(
                job.jobId(),
                job.claimToken(),
                progress.cardId(),
                progress.qrUrl(),
                codec.writePlatformMap(progress.walletPassUrls()),
                codec.writePlatformMap(progress.walletPassErrors()),
                PassJobStatus.PROCESSING
        ) == 1;
    }

    /**
     * Marks the job COMPLETED and links the card to the attendee in the same transaction.
     *
     * @param job claimed job
     * @param outcome successful outcome
     * @return false if the claim was superseded
     */
    @Transactional
    public boolean complete(ClaimedJob job, IssuanceOutcome outcome) {
        IssuanceProgress progress = outcome.progress();
        int updated = jobRepository.complete(
                job.jobId(),
                job.claimToken(),
                progress.cardId(),
                progress.qrUrl(),
                codec.writePlatformMap(progress.walletPassUrls()),
                codec.writePlatformMap(progress.walletPassErrors()),
                Failures.truncate(outcome.notificationError()),
                clock.instant(),
                PassJobStatus.PROCESSING,
                PassJobStatus.COMPLETED
        );
        if (updated != 1) {
            return false;
        }
        if (progress.cardId() != null && attendeeRepository.linkCardIfAbsent(job.attendeeId(), progress.cardId()) == 0) {
            log.debug("Attendee {} already linked to a card; kept existing link", job.attendeeId());
        }
        return true;
    }

    /**
     * Applies a retry decision to a claimed job: back to PENDING, or FAILED.
     *
     * @param jobId job
     * @param claimToken token of the claim that failed
     * @param decision retry decision
     * @param errorMessage failure reason
     * @return false if the claim was superseded
     */
    @Transactional
    public boolean applyFailure(String jobId, String claimToken, RetryDecision decision, String errorMessage) {
        String error = Failures.truncate(errorMessage);
        int updated = decision.deadLetter()
                ? jobRepository.deadLetter(jobId, claimToken, decision.retryCount(), error, clock.instant(),
                        PassJobStatus.PROCESSING, PassJobStatus.FAILED)
                : jobRepository.reschedule(jobId, claimToken, decision.retryCount(), error, decision.notBefore(),
                        PassJobStatus.PROCESSING, PassJobStatus.PENDING);
        return updated == 1;
    }

    @Transactional(readOnly = true)
    public Optional<PassGenerationJob> findJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    /**
     * Jobs in a status, oldest first, optionally limited to one tenant.
     *
     * @param status status
     * @param tenantId tenant, or null for all tenants
     * @return jobs
     */
    @Transactional(readOnly = true)
    public List<PassGenerationJob> listJobs(PassJobStatus status, String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return jobRepository.findByStatusOrderByCreatedAtAsc(status);
        }
        return jobRepository.findByStatusAndTenantIdOrderByCreatedAtAsc(status, tenantId);
    }

    /**
     * Snapshot of a freshly claimed job.
     *
     * @param job job entity as stored after the claim
     * @return claimed job
     */
    public ClaimedJob toClaimedJob(PassGenerationJob job) {
        IssuanceProgress progress = new IssuanceProgress(
                job.getCardId(),
                job.getQrUrl(),
                codec.readPlatformMap(job.getWalletPassUrl()),
                codec.readPlatformMap(job.getWalletPassErrors())
        );
        return new ClaimedJob(
                job.getJobId(),
                job.getAttendeeId(),
                job.getTenantId(),
                job.getClaimToken(),
                job.getRetryCount(),
                job.getMaxRetries(),
                job.getStartedAt(),
                progress,
                codec.readMetadata(job.getMetadataJson())
        );
    }

    private ErrorResponseException notFound(String detail) {
        return new ErrorResponseException(HttpStatus.NOT_FOUND,
                ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, detail), null);
    }
}
