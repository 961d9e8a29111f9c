package com.github.dimitryivaniuta.outreach.passes.web.dto;

import com.github.dimitryivaniuta.outreach.passes.domain.PassGenerationJob;
import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Pass generation job as returned by the API.
 */
public record PassJobResponse(
        String jobId,
        String attendeeId,
        String tenantId,
        String status,
        String progressMessage,
        String cardId,
        String qrUrl,
        Map<String, String> walletPassUrls,
        Map<String, String> walletPassErrors,
        String notificationError,
        String errorMessage,
        int retryCount,
        int maxRetries,
        Instant notBefore,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {

    /**
     * Maps a job to an API response.
     *
     * @param job job entity
     * @param walletPassUrls parsed {@code wallet_pass_url}
     * @param walletPassErrors parsed {@code wallet_pass_errors}
     * @return response
     */
    public static PassJobResponse from(
            PassGenerationJob job,
            Map<WalletPlatform, String> walletPassUrls,
            Map<WalletPlatform, String> walletPassErrors
    ) {
        return new PassJobResponse(
                job.getJobId(),
                job.getAttendeeId(),
                job.getTenantId(),
                job.getStatus().name().toLowerCase(Locale.ROOT),
                progressMessage(job),
                job.getCardId(),
                job.getQrUrl(),
                byKey(walletPassUrls),
                byKey(walletPassErrors),
                job.getNotificationError(),
                job.getErrorMessage(),
                job.getRetryCount(),
                job.getMaxRetries(),
                job.getNotBefore(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt()
        );
    }

    private static String progressMessage(PassGenerationJob job) {
        return switch (job.getStatus()) {
            case PENDING -> job.getRetryCount() == 0
                    ? "Pass generation queued"
                    : "Pass generation queued for retry (" + job.getRetryCount() + " of " + job.getMaxRetries() + " attempts failed)";
            case PROCESSING -> "Generating pass";
            case COMPLETED -> "Pass generated";
            case FAILED -> "Pass generation failed: " + job.getErrorMessage();
        };
    }

    private static Map<String, String> byKey(Map<WalletPlatform, String> byPlatform) {
        Map<String, String> out = new LinkedHashMap<>();
        byPlatform.forEach((platform, value) -> out.put(platform.key(), value));
        return out;
    }
}
