package com.herzen.quiz.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Bounded retry with exponential backoff. The delay before retry {@code n} (1-based) is
 * {@code baseDelay * 2^(n-1)}.
 */
public final class RetryPolicy {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration baseDelay;

    public RetryPolicy(int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO);
    }

    public Duration delayAfter(int failedAttempt) {
        return baseDelay.multipliedBy(1L << Math.max(0, failedAttempt - 1));
    }

    public <T> T execute(String operation, Attempt<T> attempt) throws InterruptedException {
        Exception last = null;
        for (int n = 1; n <= maxAttempts; n++) {
            try {
                return attempt.run(n);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                last = e;
                if (n < maxAttempts) {
                    Duration delay = delayAfter(n);
                    LOGGER.warn("{} failed on attempt {}/{}, retrying in {} ms: {}",
                            operation, n, maxAttempts, delay.toMillis(), e.getMessage());
                    sleep(delay);
                } else {
                    LOGGER.error("{} failed after {} attempts: {}", operation, maxAttempts, e.getMessage());
                }
            }
        }
        throw new RetryExhaustedException(operation, maxAttempts, last);
    }

    public static void sleep(Duration delay) throws InterruptedException {
        if (!delay.isZero() && !delay.isNegative()) {
            TimeUnit.MILLISECONDS.sleep(delay.toMillis());
        }
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attemptNumber) throws Exception;
    }
}
