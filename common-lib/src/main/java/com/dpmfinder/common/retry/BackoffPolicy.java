package com.dpmfinder.common.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Bounded exponential backoff.
 *
 * <p>{@link #delayFor(int)} is a pure function of the retry number:
 * <pre>
 *   retry 1 → base
 *   retry 2 → base × 2
 *   retry n → min(base × 2^(n-1), maxDelay)
 * </pre>
 * {@link #retrySpec} turns it into a Reactor {@link Retry} so the same policy drives
 * both per-request retries and cycle-level retries.
 *
 * @param maxAttempts total attempts including the first call, at least 1
 * @param baseDelay   delay before the first retry
 * @param maxDelay    upper bound for any single delay
 */
public record BackoffPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    private static final Logger log = LoggerFactory.getLogger(BackoffPolicy.class);

    public BackoffPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        maxDelay = maxDelay == null || maxDelay.compareTo(baseDelay) < 0 ? baseDelay : maxDelay;
    }

    public static BackoffPolicy noRetry() {
        return new BackoffPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    public Duration delayFor(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry number starts at 1, got " + retry);
        }
        // beyond 2^30 the cap has long been reached
        int shift = Math.min(retry - 1, 30);
        try {
            Duration delay = baseDelay.multipliedBy(1L << shift);
            return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
        } catch (ArithmeticException overflow) {
            return maxDelay;
        }
    }

    /**
     * Builds a {@link Retry} that retries failures accepted by {@code retryable} until
     * {@link #maxAttempts} is reached. When it gives up, for either reason, the error
     * is passed through {@code onGiveUp} together with the number of attempts made.
     */
    public Retry retrySpec(String operation,
                           Predicate<? super Throwable> retryable,
                           BiFunction<Throwable, Integer, ? extends Throwable> onGiveUp) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            int attempts = (int) signal.totalRetries() + 1;
            if (!retryable.test(failure)) {
                return Mono.error(onGiveUp.apply(failure, attempts));
            }
            if (attempts >= maxAttempts) {
                log.warn("RETRY_EXHAUSTED operation={} attempts={} error={}",
                         operation, attempts, failure.toString());
                return Mono.error(onGiveUp.apply(failure, attempts));
            }
            Duration delay = delayFor(attempts);
            log.warn("RETRY_SCHEDULED operation={} attempt={}/{} delayMs={} error={}",
                     operation, attempts, maxAttempts, delay.toMillis(), failure.toString());
            return Mono.delay(delay).thenReturn(attempts);
        }));
    }
}
