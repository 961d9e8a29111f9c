package com.github.dimitryivaniuta.outreach.passes.service;

import com.github.dimitryivaniuta.outreach.passes.config.AppProperties;
import com.github.dimitryivaniuta.outreach.passes.domain.Attendee;
import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;
import com.github.dimitryivaniuta.outreach.passes.repo.AttendeeRepository;
import com.github.dimitryivaniuta.outreach.passes.service.dto.ClaimedJob;
import com.github.dimitryivaniuta.outreach.passes.service.dto.FailureKind;
import com.github.dimitryivaniuta.outreach.passes.service.dto.IssuanceOutcome;
import com.github.dimitryivaniuta.outreach.passes.service.dto.IssuanceProgress;
import com.github.dimitryivaniuta.outreach.passes.service.dto.TenantIssuanceSettings;
import com.github.dimitryivaniuta.outreach.passes.service.events.PassIssuedNotification;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.CardIssuer;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.IssuanceException;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.NonRetryableIssuanceException;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.PassNotifier;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.QrCodeGenerator;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.QrCodeRequest;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.WalletPassBuilder;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.WalletPassGenerationException;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.WalletPassRequest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the issuance steps for one claimed job: card, QR code, wallet passes, notification.
 *
 * <p>Steps whose output is already recorded on the job are skipped, and each new output is checkpointed before
 * moving on, so a retry resumes at the first missing output and never creates a second card. Card or QR failures
 * fail the attempt; wallet and notification failures are recorded on the job and do not.</p>
 *
 * <p>Never throws: every failure is returned as an {@link IssuanceOutcome}.</p>
 */
@Service
public class IssuancePipeline {

    private static final Logger log = LoggerFactory.getLogger(IssuancePipeline.class);

    /** Version of the {@link PassIssuedNotification} payload. */
    public static final String NOTIFICATION_SCHEMA_VERSION = "1";

    private final AttendeeRepository attendeeRepository;
    private final TenantIssuanceSettingsService settingsService;
    private final CardIssuer cardIssuer;
    private final QrCodeGenerator qrCodeGenerator;
    private final List<WalletPassBuilder> walletPassBuilders;
    private final PassNotifier passNotifier;
    private final PassJobStore jobStore;
    private final AppProperties properties;
    private final Clock clock;

    private final Counter walletFailedCounter;
    private final Counter notificationFailedCounter;

    public IssuancePipeline(
            AttendeeRepository attendeeRepository,
            TenantIssuanceSettingsService settingsService,
            CardIssuer cardIssuer,
            QrCodeGenerator qrCodeGenerator,
            List<WalletPassBuilder> walletPassBuilders,
            PassNotifier passNotifier,
            PassJobStore jobStore,
            AppProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.attendeeRepository = attendeeRepository;
        this.settingsService = settingsService;
        this.cardIssuer = cardIssuer;
        this.qrCodeGenerator = qrCodeGenerator;
        this.walletPassBuilders = List.copyOf(walletPassBuilders);
        this.passNotifier = passNotifier;
        this.jobStore = jobStore;
        this.properties = properties;
        this.clock = clock;

        this.walletFailedCounter = Counter.builder("passes.wallet.failed").register(meterRegistry);
        this.notificationFailedCounter = Counter.builder("passes.notifications.failed").register(meterRegistry);
    }

    /**
     * @param job claimed job
     * @return outcome of the attempt
     */
    public IssuanceOutcome run(ClaimedJob job) {
        IssuanceProgress progress = job.progress();
        try {
            Attendee attendee = loadAttendee(job);
            TenantIssuanceSettings settings = settingsService.settingsFor(job.tenantId());

            progress = ensureCard(job, attendee, progress);
            String cardUrl = cardUrl(progress.cardId());
            progress = ensureQrCode(job, progress, cardUrl);
            progress = issueWalletPasses(job, attendee, settings, progress, cardUrl);

            String notificationError = sendNotification(job, attendee, settings, progress, cardUrl);
            return IssuanceOutcome.completed(progress, notificationError);
        } catch (NonRetryableIssuanceException ex) {
            log.warn("Job {} cannot be issued: {}", job.jobId(), ex.getMessage());
            return IssuanceOutcome.failed(progress, FailureKind.NON_RETRYABLE, Failures.describe(ex));
        } catch (ClaimLostException ex) {
            log.warn(ex.getMessage());
            return IssuanceOutcome.failed(progress, FailureKind.RETRYABLE, Failures.describe(ex));
        } catch (Exception ex) {
            log.warn("Issuance attempt for job {} failed", job.jobId(), ex);
            return IssuanceOutcome.failed(progress, FailureKind.RETRYABLE, Failures.describe(ex));
        }
    }

    /**
     * Public URL of a card.
     *
     * @param cardId card
     * @return URL encoded in the QR code and on wallet passes
     */
    public String cardUrl(String cardId) {
        return properties.getIssuance().getPublicBaseUrl() + "/c/" + cardId;
    }

    private Attendee loadAttendee(ClaimedJob job) {
        Attendee attendee = attendeeRepository.findById(job.attendeeId())
                .orElseThrow(() -> new NonRetryableIssuanceException("Attendee " + job.attendeeId() + " not found"));
        if (!attendee.getTenantId().equals(job.tenantId())) {
            throw new NonRetryableIssuanceException(
                    "Attendee " + job.attendeeId() + " does not belong to tenant " + job.tenantId());
        }
        return attendee;
    }

    private IssuanceProgress ensureCard(ClaimedJob job, Attendee attendee, IssuanceProgress progress) {
        if (progress.cardId() != null) {
            log.debug("Job {} resumes with card {}", job.jobId(), progress.cardId());
            return progress;
        }
        String cardId = attendee.getCardId() != null ? attendee.getCardId() : cardIssuer.createCard(attendee);
        if (cardId == null || cardId.isBlank()) {
            throw new IssuanceException("Card issuer returned no card for attendee " + attendee.getAttendeeId());
        }
        IssuanceProgress next = progress.withCardId(cardId);
        checkpoint(job, next);
        return next;
    }

    private IssuanceProgress ensureQrCode(ClaimedJob job, IssuanceProgress progress, String cardUrl) {
        if (progress.qrUrl() != null) {
            return progress;
        }
        String qrUrl = qrCodeGenerator.generate(
                new QrCodeRequest(job.tenantId(), job.attendeeId(), progress.cardId(), cardUrl));
        if (qrUrl == null || qrUrl.isBlank()) {
            throw new IssuanceException("QR generation returned no location for card " + progress.cardId());
        }
        IssuanceProgress next = progress.withQrUrl(qrUrl);
        checkpoint(job, next);
        return next;
    }

    private IssuanceProgress issueWalletPasses(
            ClaimedJob job,
            Attendee attendee,
            TenantIssuanceSettings settings,
            IssuanceProgress progress,
            String cardUrl
    ) {
        IssuanceProgress next = progress;
        boolean changed = false;

        for (WalletPlatform platform : job.metadata().requestedPlatforms()) {
            if (!settings.walletEnabled(platform)) {
                log.info("Skipping {} pass for job {}: disabled for tenant {}", platform.key(), job.jobId(), job.tenantId());
                continue;
            }
            if (next.walletPassUrls().containsKey(platform)) {
                continue;
            }

            WalletPassRequest request = new WalletPassRequest(
                    platform,
                    job.tenantId(),
                    attendee.getEventId(),
                    attendee.getAttendeeId(),
                    next.cardId(),
                    attendee.displayName(),
                    attendee.getOrgName(),
                    attendee.getTitle(),
                    cardUrl
            );
            try {
                String url = builderFor(platform).build(request);
                if (url == null || url.isBlank()) {
                    throw new WalletPassGenerationException(platform, "builder returned no URL", null);
                }
                next = next.withWalletPass(platform, url);
            } catch (Exception ex) {
                walletFailedCounter.increment();
                log.warn("{} pass for job {} failed: {}", platform.key(), job.jobId(), ex.getMessage());
                next = next.withWalletError(platform, Failures.describe(ex));
            }
            changed = true;
        }

        if (changed) {
            checkpoint(job, next);
        }
        return next;
    }

    private WalletPassBuilder builderFor(WalletPlatform platform) {
        return walletPassBuilders.stream()
                .filter(b -> b.supports(platform))
                .findFirst()
                .orElseThrow(() -> new WalletPassGenerationException(platform, "no builder registered", null));
    }

    /**
     * @return null when sent or skipped, otherwise the failure reason
     */
    private String sendNotification(
            ClaimedJob job,
            Attendee attendee,
            TenantIssuanceSettings settings,
            IssuanceProgress progress,
            String cardUrl
    ) {
        if (!settings.notificationsEnabled()) {
            log.info("Pass notification for job {} skipped: disabled for tenant {}", job.jobId(), job.tenantId());
            return null;
        }
        if (!attendee.hasEmail()) {
            log.info("Pass notification for job {} skipped: attendee {} has no email", job.jobId(), attendee.getAttendeeId());
            return null;
        }

        Map<String, String> walletPasses = new LinkedHashMap<>();
        progress.walletPassUrls().forEach((platform, url) -> walletPasses.put(platform.key(), url));

        PassIssuedNotification notification = new PassIssuedNotification(
                NOTIFICATION_SCHEMA_VERSION,
                UUID.randomUUID().toString(),
                clock.instant(),
                job.jobId(),
                job.tenantId(),
                attendee.getEventId(),
                attendee.getAttendeeId(),
                attendee.getEmail(),
                attendee.displayName(),
                progress.cardId(),
                cardUrl,
                cardUrl + "/vcard",
                progress.qrUrl(),
                walletPasses
        );
        try {
            passNotifier.sendPassNotification(notification);
            return null;
        } catch (Exception ex) {
            notificationFailedCounter.increment();
            log.warn("Pass notification for job {} failed: {}", job.jobId(), ex.getMessage());
            return Failures.describe(ex);
        }
    }

    private void checkpoint(ClaimedJob job, IssuanceProgress progress) {
        if (!jobStore.recordProgress(job, progress)) {
            throw new ClaimLostException(job.jobId());
        }
    }
}
