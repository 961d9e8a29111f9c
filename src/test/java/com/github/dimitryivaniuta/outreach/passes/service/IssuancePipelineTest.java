package com.github.dimitryivaniuta.outreach.passes.service;

import com.github.dimitryivaniuta.outreach.passes.config.AppProperties;
import com.github.dimitryivaniuta.outreach.passes.domain.Attendee;
import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;
import com.github.dimitryivaniuta.outreach.passes.repo.AttendeeRepository;
import com.github.dimitryivaniuta.outreach.passes.service.dto.ClaimedJob;
import com.github.dimitryivaniuta.outreach.passes.service.dto.FailureKind;
import com.github.dimitryivaniuta.outreach.passes.service.dto.IssuanceOutcome;
import com.github.dimitryivaniuta.outreach.passes.service.dto.IssuanceProgress;
import com.github.dimitryivaniuta.outreach.passes.service.dto.JobMetadata;
import com.github.dimitryivaniuta.outreach.passes.service.dto.TenantIssuanceSettings;
import com.github.dimitryivaniuta.outreach.passes.service.events.PassIssuedNotification;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.CardIssuer;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.IssuanceException;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.NotificationException;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.PassNotifier;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.QrCodeGenerator;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.QrCodeRequest;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.WalletPassBuilder;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.WalletPassGenerationException;
import com.github.dimitryivaniuta.outreach.passes.service.issuance.WalletPassRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

/**
 * Step ordering, resumption and failure containment of the issuance pipeline.
 */
class IssuancePipelineTest {

    private static final String TENANT = "tenant-1";
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final AttendeeRepository attendeeRepository = Mockito.mock(AttendeeRepository.class);
    private final TenantIssuanceSettingsService settingsService = Mockito.mock(TenantIssuanceSettingsService.class);
    private final CardIssuer cardIssuer = Mockito.mock(CardIssuer.class);
    private final QrCodeGenerator qrCodeGenerator = Mockito.mock(QrCodeGenerator.class);
    private final WalletPassBuilder walletPassBuilder = Mockito.mock(WalletPassBuilder.class);
    private final PassNotifier passNotifier = Mockito.mock(PassNotifier.class);
    private final PassJobStore jobStore = Mockito.mock(PassJobStore.class);

    private SimpleMeterRegistry meterRegistry;
    private IssuancePipeline pipeline;
    private Attendee attendee;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getIssuance().setPublicBaseUrl("https://cards.test");
        meterRegistry = new SimpleMeterRegistry();

        pipeline = new IssuancePipeline(
                attendeeRepository,
                settingsService,
                cardIssuer,
                qrCodeGenerator,
                List.of(walletPassBuilder),
                passNotifier,
                jobStore,
                properties,
                Clock.fixed(NOW, ZoneOffset.UTC),
                meterRegistry
        );

        attendee = Attendee.newAttendee(TENANT, "event-1", "Ada", "Lovelace", "ada@example.com");
        Mockito.when(attendeeRepository.findById(attendee.getAttendeeId())).thenReturn(Optional.of(attendee));
        Mockito.when(settingsService.settingsFor(TENANT)).thenReturn(new TenantIssuanceSettings(TENANT, true, true, true));
        Mockito.when(cardIssuer.createCard(attendee)).thenReturn("card-1");
        Mockito.when(qrCodeGenerator.generate(Mockito.any())).thenReturn("https://assets.test/qr/tenant-1/card-1.png");
        Mockito.when(walletPassBuilder.supports(Mockito.any())).thenReturn(true);
        Mockito.when(walletPassBuilder.build(Mockito.any()))
                .thenAnswer(inv -> "https://passes.test/" + inv.getArgument(0, WalletPassRequest.class).platform().key());
        Mockito.when(jobStore.recordProgress(Mockito.any(), Mockito.any())).thenReturn(true);
    }

    @Test
    void freshJobIssuesCardQrPassesAndNotifies() {
        IssuanceOutcome outcome = pipeline.run(job(IssuanceProgress.none(), WalletPlatform.APPLE, WalletPlatform.GOOGLE));

        Assertions.assertTrue(outcome.success());
        Assertions.assertEquals("card-1", outcome.progress().cardId());
        Assertions.assertEquals("https://assets.test/qr/tenant-1/card-1.png", outcome.progress().qrUrl());
        Assertions.assertEquals(Map.of(
                WalletPlatform.APPLE, "https://passes.test/apple",
                WalletPlatform.GOOGLE, "https://passes.test/google"), outcome.progress().walletPassUrls());
        Assertions.assertNull(outcome.notificationError());

        ArgumentCaptor<QrCodeRequest> qr = ArgumentCaptor.forClass(QrCodeRequest.class);
        Mockito.verify(qrCodeGenerator).generate(qr.capture());
        Assertions.assertEquals("https://cards.test/c/card-1", qr.getValue().cardUrl());

        ArgumentCaptor<PassIssuedNotification> sent = ArgumentCaptor.forClass(PassIssuedNotification.class);
        Mockito.verify(passNotifier).sendPassNotification(sent.capture());
        PassIssuedNotification n = sent.getValue();
        Assertions.assertEquals("ada@example.com", n.recipientEmail());
        Assertions.assertEquals("Ada Lovelace", n.displayName());
        Assertions.assertEquals("https://cards.test/c/card-1/vcard", n.vcardUrl());
        Assertions.assertEquals("https://passes.test/google", n.walletPasses().get("google"));
        Assertions.assertEquals(NOW, n.occurredAt());

        // card, QR, wallet passes
        Mockito.verify(jobStore, Mockito.times(3)).recordProgress(Mockito.any(), Mockito.any());
    }

    @Test
    void retryResumesAfterLastRecordedOutput() {
        IssuanceProgress earlier = IssuanceProgress.none()
                .withCardId("card-1")
                .withQrUrl("https://assets.test/qr/tenant-1/card-1.png")
                .withWalletPass(WalletPlatform.APPLE, "https://passes.test/apple");

        IssuanceOutcome outcome = pipeline.run(job(earlier, WalletPlatform.APPLE, WalletPlatform.GOOGLE));

        Assertions.assertTrue(outcome.success());
        Mockito.verifyNoInteractions(cardIssuer, qrCodeGenerator);
        ArgumentCaptor<WalletPassRequest> built = ArgumentCaptor.forClass(WalletPassRequest.class);
        Mockito.verify(walletPassBuilder).build(built.capture());
        Assertions.assertEquals(WalletPlatform.GOOGLE, built.getValue().platform());
        Assertions.assertEquals(2, outcome.progress().walletPassUrls().size());
    }

    @Test
    void cardAlreadyLinkedToAttendeeIsReused() {
        attendee.setCardId("card-existing");

        IssuanceOutcome outcome = pipeline.run(job(IssuanceProgress.none()));

        Assertions.assertTrue(outcome.success());
        Assertions.assertEquals("card-existing", outcome.progress().cardId());
        Mockito.verifyNoInteractions(cardIssuer);
    }

    @Test
    void walletFailureIsRecordedWithoutFailingTheJob() {
        Mockito.doThrow(new WalletPassGenerationException(WalletPlatform.APPLE, "signing certificate expired", null))
                .when(walletPassBuilder).build(Mockito.argThat(r -> r != null && r.platform() == WalletPlatform.APPLE));

        IssuanceOutcome outcome = pipeline.run(job(IssuanceProgress.none(), WalletPlatform.APPLE, WalletPlatform.GOOGLE));

        Assertions.assertTrue(outcome.success());
        Assertions.assertEquals(Map.of(WalletPlatform.GOOGLE, "https://passes.test/google"), outcome.progress().walletPassUrls());
        Assertions.assertTrue(outcome.progress().walletPassErrors().get(WalletPlatform.APPLE).contains("signing certificate expired"));
        Assertions.assertEquals(1.0, meterRegistry.counter("passes.wallet.failed").count());
    }

    @Test
    void platformsDisabledForTenantAreSkipped() {
        Mockito.when(settingsService.settingsFor(TENANT)).thenReturn(new TenantIssuanceSettings(TENANT, false, true, true));

        IssuanceOutcome outcome = pipeline.run(job(IssuanceProgress.none(), WalletPlatform.APPLE, WalletPlatform.GOOGLE));

        Assertions.assertTrue(outcome.success());
        Assertions.assertEquals(List.of(WalletPlatform.GOOGLE), List.copyOf(outcome.progress().walletPassUrls().keySet()));
        Assertions.assertTrue(outcome.progress().walletPassErrors().isEmpty());
    }

    @Test
    void notificationFailureIsRecordedWithoutFailingTheJob() {
        Mockito.doThrow(new NotificationException("broker unavailable", null))
                .when(passNotifier).sendPassNotification(Mockito.any());

        IssuanceOutcome outcome = pipeline.run(job(IssuanceProgress.none()));

        Assertions.assertTrue(outcome.success());
        Assertions.assertEquals("broker unavailable", outcome.notificationError());
        Assertions.assertEquals(1.0, meterRegistry.counter("passes.notifications.failed").count());
    }

    @Test
    void notificationSkippedWithoutEmailOrWhenTenantDisabledIt() {
        attendee.setEmail(null);
        Assertions.assertTrue(pipeline.run(job(IssuanceProgress.none())).success());

        attendee.setEmail("ada@example.com");
        Mockito.when(settingsService.settingsFor(TENANT)).thenReturn(new TenantIssuanceSettings(TENANT, true, true, false));
        IssuanceOutcome outcome = pipeline.run(job(IssuanceProgress.none()));

        Assertions.assertTrue(outcome.success());
        Assertions.assertNull(outcome.notificationError());
        Mockito.verifyNoInteractions(passNotifier);
    }

    @Test
    void qrFailureFailsTheAttemptButKeepsTheCard() {
        Mockito.when(qrCodeGenerator.generate(Mockito.any())).thenThrow(new IssuanceException("storage timeout"));

        IssuanceOutcome outcome = pipeline.run(job(IssuanceProgress.none(), WalletPlatform.APPLE));

        Assertions.assertFalse(outcome.success());
        Assertions.assertEquals(FailureKind.RETRYABLE, outcome.failureKind());
        Assertions.assertEquals("storage timeout", outcome.errorMessage());
        Assertions.assertEquals("card-1", outcome.progress().cardId());
        Assertions.assertNull(outcome.progress().qrUrl());
        Mockito.verifyNoInteractions(walletPassBuilder, passNotifier);
    }

    @Test
    void missingAttendeeOrForeignTenantIsNonRetryable() {
        Mockito.when(attendeeRepository.findById(attendee.getAttendeeId())).thenReturn(Optional.empty());
        IssuanceOutcome missing = pipeline.run(job(IssuanceProgress.none()));
        Assertions.assertFalse(missing.success());
        Assertions.assertEquals(FailureKind.NON_RETRYABLE, missing.failureKind());

        Attendee foreign = Attendee.newAttendee("tenant-2", "event-9", "Eve", null, "eve@example.com");
        foreign.setAttendeeId(attendee.getAttendeeId());
        Mockito.when(attendeeRepository.findById(attendee.getAttendeeId())).thenReturn(Optional.of(foreign));
        IssuanceOutcome mismatch = pipeline.run(job(IssuanceProgress.none()));
        Assertions.assertEquals(FailureKind.NON_RETRYABLE, mismatch.failureKind());

        Mockito.verifyNoInteractions(cardIssuer);
    }

    @Test
    void rejectedCheckpointStopsThePipeline() {
        Mockito.when(jobStore.recordProgress(Mockito.any(), Mockito.any())).thenReturn(false);

        IssuanceOutcome outcome = pipeline.run(job(IssuanceProgress.none(), WalletPlatform.APPLE));

        Assertions.assertFalse(outcome.success());
        Assertions.assertEquals(FailureKind.RETRYABLE, outcome.failureKind());
        Mockito.verifyNoInteractions(qrCodeGenerator, walletPassBuilder, passNotifier);
    }

    private ClaimedJob job(IssuanceProgress progress, WalletPlatform... platforms) {
        return new ClaimedJob(
                "job-1",
                attendee.getAttendeeId(),
                TENANT,
                "token-1",
                0,
                3,
                NOW,
                progress,
                new JobMetadata(List.of(platforms), "test")
        );
    }
}
