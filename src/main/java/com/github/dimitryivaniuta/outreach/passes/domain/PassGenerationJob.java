package com.github.dimitryivaniuta.outreach.passes.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One unit of work: "issue a card, QR code and wallet passes for this attendee".
 *
 * <p>State changes after insert are performed with conditional bulk updates in
 * {@link com.github.dimitryivaniuta.outreach.passes.repo.PassGenerationJobRepository}, never by saving a loaded
 * entity, so two workers can never overwrite each other's transition.</p>
 *
 * <p>Output fields ({@code cardId}, {@code qrUrl}, per-platform entries of {@code walletPassUrl}) are write-once;
 * a retry inspects them to resume from the first incomplete step.</p>
 */
@Entity
@Table(
        name = "pass_generation_jobs",
        indexes = {
                @Index(name = "idx_pass_jobs_attendee", columnList = "attendee_id"),
                @Index(name = "idx_pass_jobs_tenant_status", columnList = "tenant_id,status"),
                @Index(name = "idx_pass_jobs_status_started", columnList = "status,started_at")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class PassGenerationJob {

    @Id
    @Column(name = "job_id", nullable = false, updatable = false, length = 36)
    private String jobId;

    @Column(name = "attendee_id", nullable = false, updatable = false, length = 36)
    private String attendeeId;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 36)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PassJobStatus status;

    @Column(name = "card_id", nullable = true, length = 36)
    private String cardId;

    @Column(name = "qr_url", nullable = true, columnDefinition = "text")
    private String qrUrl;

    /**
     * JSON object: platform key to pass URL.
     */
    @Column(name = "wallet_pass_url", nullable = true, columnDefinition = "text")
    private String walletPassUrl;

    /**
     * JSON object: platform key to last failure reason.
     */
    @Column(name = "wallet_pass_errors", nullable = true, columnDefinition = "text")
    private String walletPassErrors;

    @Column(name = "notification_error", nullable = true, columnDefinition = "text")
    private String notificationError;

    @Column(name = "error_message", nullable = true, columnDefinition = "text")
    private String errorMessage;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Column(name = "claim_token", nullable = true, length = 36)
    private String claimToken;

    @Column(name = "not_before", nullable = true)
    private Instant notBefore;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at", nullable = true)
    private Instant startedAt;

    @Column(name = "completed_at", nullable = true)
    private Instant completedAt;

    @Column(name = "metadata_json", nullable = false, columnDefinition = "text")
    private String metadataJson;

    /**
     * Creates a new PENDING job.
     *
     * @param attendeeId attendee
     * @param tenantId tenant owning the attendee
     * @param maxRetries failed attempts allowed before dead-letter
     * @param metadataJson job metadata JSON
     * @param now creation time
     * @return job
     */
    public static PassGenerationJob pending(String attendeeId, String tenantId, int maxRetries, String metadataJson, Instant now) {
        Objects.requireNonNull(attendeeId, "attendeeId");
        Objects.requireNonNull(tenantId, "tenantId");

        PassGenerationJob j = new PassGenerationJob();
        j.jobId = UUID.randomUUID().toString();
        j.attendeeId = attendeeId;
        j.tenantId = tenantId;
        j.status = PassJobStatus.PENDING;
        j.retryCount = 0;
        j.maxRetries = maxRetries;
        j.metadataJson = metadataJson == null ? "{}" : metadataJson;
        j.createdAt = now;
        return j;
    }

    /**
     * Creates an already COMPLETED job recording a card the attendee holds from before.
     *
     * <p>Used for audit when issuance is requested for an attendee that already has a card.</p>
     *
     * @param attendeeId attendee
     * @param tenantId tenant
     * @param cardId existing card
     * @param maxRetries configured max retries
     * @param metadataJson job metadata JSON
     * @param now creation time
     * @return job
     */
    public static PassGenerationJob completedForExistingCard(String attendeeId, String tenantId, String cardId,
                                                             int maxRetries, String metadataJson, Instant now) {
        PassGenerationJob j = pending(attendeeId, tenantId, maxRetries, metadataJson, now);
        j.status = PassJobStatus.COMPLETED;
        j.cardId = cardId;
        j.startedAt = now;
        j.completedAt = now;
        return j;
    }
}
