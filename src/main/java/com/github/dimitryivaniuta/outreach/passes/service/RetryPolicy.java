package com.github.dimitryivaniuta.outreach.passes.service;

import com.github.dimitryivaniuta.outreach.passes.config.AppProperties;
import com.github.dimitryivaniuta.outreach.passes.service.dto.FailureKind;
import com.github.dimitryivaniuta.outreach.passes.service.dto.RetryDecision;
import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.stereotype.Component;

/**
 * Retry / dead-letter policy for failed issuance attempts.
 *
 * <p>Every failed attempt increments the retry count. A job is re-queued with an exponential backoff while
 * {@code retryCount < maxRetries}; once the limit is reached it is dead-lettered. Non-retryable failures are
 * dead-lettered immediately only when {@code app.retry.dead-letter-non-retryable} is set.</p>
 */
@Component
public class RetryPolicy {

    private final AppProperties properties;
    private final Clock clock;

    public RetryPolicy(AppProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param retryCount failed attempts before this one
     * @param maxRetries failed attempts allowed
     * @param kind failure classification
     * @return decision for the failed attempt
     */
    public RetryDecision decide(int retryCount, int maxRetries, FailureKind kind) {
        int attempts = retryCount + 1;
        boolean giveUp = attempts >= maxRetries
                || (kind == FailureKind.NON_RETRYABLE && properties.getRetry().isDeadLetterNonRetryable());
        if (giveUp) {
            return RetryDecision.deadLetter(attempts);
        }
        // Stored with microsecond precision; truncate so the row never becomes eligible later than computed.
        return RetryDecision.retryAt(attempts, clock.instant().plus(backoff(attempts)).truncatedTo(ChronoUnit.MICROS));
    }

    /**
     * Exponential backoff: {@code base * 2^(attempt-1)}, capped, with optional jitter in [0.5, 1.5).
     *
     * @param attempt failed attempts so far (1-based)
     * @return delay before the next claim
     */
    public Duration backoff(int attempt) {
        AppProperties.Retry retry = properties.getRetry();
        long baseMs = retry.getBaseBackoff().toMillis();
        long maxMs = retry.getMaxBackoff().toMillis();
        if (baseMs <= 0) {
            return Duration.ZERO;
        }

        double exp = Math.pow(2.0, Math.max(0, attempt - 1));
        long capped = (long) Math.min(baseMs * exp, maxMs);
        if (!retry.isJitter()) {
            return Duration.ofMillis(capped);
        }

        double jitter = 0.5 + ThreadLocalRandom.current().nextDouble();
        long withJitter = (long) (capped * jitter);
        return Duration.ofMillis(Math.max(baseMs, Math.min(withJitter, maxMs)));
    }
}
