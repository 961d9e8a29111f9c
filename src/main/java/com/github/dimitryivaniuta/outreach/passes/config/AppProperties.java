package com.github.dimitryivaniuta.outreach.passes.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration properties.
 *
 * <p>Grouped by concern: the worker pass itself, retry/dead-letter policy, issuance defaults and the
 * notification channel.</p>
 */
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private final Worker worker = new Worker();
    private final Retry retry = new Retry();
    private final Issuance issuance = new Issuance();
    private final Notification notification = new Notification();

    @Getter
    @Setter
    public static class Worker {
        /**
         * Max number of jobs claimed per invocation.
         */
        private int batchSize = 20;

        /**
         * Number of jobs of one batch processed concurrently.
         */
        private int parallelism = 4;

        /**
         * Max time a single job may spend in the issuance pipeline before it is cancelled.
         */
        private Duration jobTimeout = Duration.ofMinutes(2);

        /**
         * A PROCESSING job whose {@code started_at} is older than this is considered abandoned.
         */
        private Duration staleProcessingAfter = Duration.ofMinutes(15);

        /**
         * Max number of stale jobs released per invocation.
         */
        private int staleBatchSize = 100;

        /**
         * Enables the in-process scheduled trigger. Off by default: invocations normally come from an
         * external scheduler through the HTTP trigger.
         */
        private boolean schedulerEnabled = false;

        /**
         * Fixed delay between scheduled invocations in milliseconds.
         */
        private long intervalMs = 10_000L;

        /**
         * Longest an invocation may wait for a batch of {@code jobs}: one job timeout per wave of
         * {@code parallelism} jobs.
         *
         * @param jobs number of claimed jobs
         * @return wait budget
         */
        public Duration maxBatchDuration(int jobs) {
            int threads = Math.max(1, parallelism);
            int waves = Math.max(1, (jobs + threads - 1) / threads);
            return jobTimeout.multipliedBy(waves);
        }
    }

    @Getter
    @Setter
    public static class Retry {
        /**
         * Max number of failed attempts before a job is dead-lettered.
         */
        private int maxRetries = 3;

        /**
         * Base backoff used for retries (exponential). Zero means "next invocation".
         */
        private Duration baseBackoff = Duration.ofSeconds(30);

        /**
         * Maximum backoff cap.
         */
        private Duration maxBackoff = Duration.ofMinutes(10);

        /**
         * Applies a random factor in [0.5, 1.5) to the computed backoff.
         */
        private boolean jitter = true;

        /**
         * Dead-letter non-retryable failures (missing attendee, tenant mismatch) on the first attempt.
         */
        private boolean deadLetterNonRetryable = false;
    }

    @Getter
    @Setter
    public static class Issuance {
        /**
         * Public base URL of the card viewer; card URLs are {@code {base}/c/{cardId}}.
         */
        private String publicBaseUrl = "https://app.outreachpass.example.com";

        /**
         * Base location where QR images are stored.
         */
        private String qrStorageBaseUrl = "https://assets.outreachpass.example.com";

        /**
         * Base URL of generated wallet passes.
         */
        private String walletPassBaseUrl = "https://passes.outreachpass.example.com";

        /**
         * Default for tenants without an {@code apple_wallet} flag.
         */
        private boolean appleWalletEnabled = true;

        /**
         * Default for tenants without a {@code google_wallet} flag.
         */
        private boolean googleWalletEnabled = true;

        /**
         * Default for tenants without a {@code pass_email} flag.
         */
        private boolean notificationsEnabled = true;

        /**
         * TTL of cached tenant issuance settings.
         */
        private Duration tenantSettingsTtl = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Notification {
        /**
         * Kafka topic consumed by the email sender.
         */
        private String topic = "pass-notifications";

        /**
         * Partitions of the notification topic when it is created by the application.
         */
        private int topicPartitions = 6;

        /**
         * Replication factor of the notification topic when it is created by the application.
         */
        private int topicReplicas = 1;

        /**
         * Kafka send acknowledgment timeout.
         */
        private Duration sendTimeout = Duration.ofSeconds(5);
    }
}
