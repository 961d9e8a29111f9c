package com.github.dimitryivaniuta.outreach.passes.repo;

import com.github.dimitryivaniuta.outreach.passes.domain.PassGenerationJob;
import com.github.dimitryivaniuta.outreach.passes.domain.PassJobStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link PassGenerationJob}.
 *
 * <p>Every state transition is a single-row conditional update keyed by job id plus the expected prior status
 * (and, once claimed, the claim token). An update returning 0 rows means another worker moved the job first.</p>
 */
public interface PassGenerationJobRepository extends JpaRepository<PassGenerationJob, String> {

    /**
     * Inserts a PENDING job unless the attendee already has a PENDING or PROCESSING one.
     *
     * <p>Relies on the partial unique index {@code uq_pass_jobs_active_attendee} (see {@code db/pass-generation-jobs.sql}),
     * so concurrent enrollments for the same attendee cannot both insert.</p>
     *
     * @return 1 if inserted, 0 if an active job already existed
     */
    @Modifying
    @Query(value = """
            insert into pass_generation_jobs
                (job_id, attendee_id, tenant_id, status, retry_count, max_retries, created_at, metadata_json)
            values
                (:jobId, :attendeeId, :tenantId, 'PENDING', 0, :maxRetries, :createdAt, :metadataJson)
            on conflict (attendee_id) where status in ('PENDING', 'PROCESSING') do nothing
            """, nativeQuery = true)
    int insertIfNoActiveJob(
            @Param("jobId") String jobId,
            @Param("attendeeId") String attendeeId,
            @Param("tenantId") String tenantId,
            @Param("maxRetries") int maxRetries,
            @Param("createdAt") Instant createdAt,
            @Param("metadataJson") String metadataJson
    );

    @Query("select j from PassGenerationJob j where j.attendeeId = :attendeeId and j.status in :statuses order by j.createdAt desc")
    List<PassGenerationJob> findByAttendeeAndStatuses(
            @Param("attendeeId") String attendeeId,
            @Param("statuses") Collection<PassJobStatus> statuses
    );

    Optional<PassGenerationJob> findFirstByAttendeeIdAndStatusOrderByCreatedAtDesc(String attendeeId, PassJobStatus status);

    List<PassGenerationJob> findByStatusOrderByCreatedAtAsc(PassJobStatus status);

    List<PassGenerationJob> findByStatusAndTenantIdOrderByCreatedAtAsc(PassJobStatus status, String tenantId);

    long countByStatus(PassJobStatus status);

    /**
     * Ids of claimable jobs, oldest first.
     */
    @Query("""
            select j.jobId from PassGenerationJob j
            where j.status = :status
              and (j.notBefore is null or j.notBefore <= :now)
            order by j.createdAt asc, j.jobId asc
            """)
    List<String> findEligibleIds(@Param("status") PassJobStatus status, @Param("now") Instant now, Pageable page);

    /**
     * PROCESSING jobs claimed before {@code staleBefore}, oldest claim first.
     */
    @Query("""
            select j from PassGenerationJob j
            where j.status = :status
              and j.startedAt < :staleBefore
            order by j.startedAt asc
            """)
    List<PassGenerationJob> findStarted(@Param("status") PassJobStatus status, @Param("staleBefore") Instant staleBefore, Pageable page);

    /**
     * Claims one job if it is still PENDING and eligible.
     *
     * @return 1 when this caller won the claim
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update PassGenerationJob j
               set j.status = :to, j.startedAt = :now, j.claimToken = :claimToken
             where j.jobId = :jobId
               and j.status = :from
               and (j.notBefore is null or j.notBefore <= :now)
            """)
    int claim(
            @Param("jobId") String jobId,
            @Param("claimToken") String claimToken,
            @Param("now") Instant now,
            @Param("from") PassJobStatus from,
            @Param("to") PassJobStatus to
    );

    /**
     * Write-once progress checkpoint for a claimed job.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update PassGenerationJob j
               set j.cardId = coalesce(j.cardId, :cardId),
                   j.qrUrl = coalesce(j.qrUrl, :qrUrl),
                   j.walletPassUrl = :walletPassUrl,
                   j.walletPassErrors = :walletPassErrors
             where j.jobId = :jobId
               and j.status = :expected
               and j.claimToken = :claimToken
            """)
    int recordProgress(
            @Param("jobId") String jobId,
            @Param("claimToken") String claimToken,
            @Param("cardId") String cardId,
            @Param("qrUrl") String qrUrl,
            @Param("walletPassUrl") String walletPassUrl,
            @Param("walletPassErrors") String walletPassErrors,
            @Param("expected") PassJobStatus expected
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update PassGenerationJob j
               set j.status = :to,
                   j.cardId = coalesce(j.cardId, :cardId),
                   j.qrUrl = coalesce(j.qrUrl, :qrUrl),
                   j.walletPassUrl = :walletPassUrl,
                   j.walletPassErrors = :walletPassErrors,
                   j.notificationError = :notificationError,
                   j.errorMessage = null,
                   j.claimToken = null,
                   j.notBefore = null,
                   j.completedAt = :now
             where j.jobId = :jobId
               and j.status = :from
               and j.claimToken = :claimToken
            """)
    int complete(
            @Param("jobId") String jobId,
            @Param("claimToken") String claimToken,
            @Param("cardId") String cardId,
            @Param("qrUrl") String qrUrl,
            @Param("walletPassUrl") String walletPassUrl,
            @Param("walletPassErrors") String walletPassErrors,
            @Param("notificationError") String notificationError,
            @Param("now") Instant now,
            @Param("from") PassJobStatus from,
            @Param("to") PassJobStatus to
    );

    /**
     * Puts a claimed job back to PENDING after a failed attempt.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update PassGenerationJob j
               set j.status = :to,
                   j.retryCount = :retryCount,
                   j.errorMessage = :errorMessage,
                   j.notBefore = :notBefore,
                   j.claimToken = null
             where j.jobId = :jobId
               and j.status = :from
               and j.claimToken = :claimToken
            """)
    int reschedule(
            @Param("jobId") String jobId,
            @Param("claimToken") String claimToken,
            @Param("retryCount") int retryCount,
            @Param("errorMessage") String errorMessage,
            @Param("notBefore") Instant notBefore,
            @Param("from") PassJobStatus from,
            @Param("to") PassJobStatus to
    );

    /**
     * Moves a claimed job to its terminal failed state.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update PassGenerationJob j
               set j.status = :to,
                   j.retryCount = :retryCount,
                   j.errorMessage = :errorMessage,
                   j.notBefore = null,
                   j.claimToken = null,
                   j.completedAt = :now
             where j.jobId = :jobId
               and j.status = :from
               and j.claimToken = :claimToken
            """)
    int deadLetter(
            @Param("jobId") String jobId,
            @Param("claimToken") String claimToken,
            @Param("retryCount") int retryCount,
            @Param("errorMessage") String errorMessage,
            @Param("now") Instant now,
            @Param("from") PassJobStatus from,
            @Param("to") PassJobStatus to
    );
}
