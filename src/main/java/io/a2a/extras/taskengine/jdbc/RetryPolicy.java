package io.a2a.extras.taskengine.jdbc;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Exponential backoff for transient storage failures. Immutable.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class RetryPolicy {

    public static final RetryPolicy DEFAULT = RetryPolicy.builder().build();

    public static final RetryPolicy NO_RETRY = RetryPolicy.builder()
            .maxRetries(0)
            .build();

    /**
     * Retries after the first attempt.
     */
    @Builder.Default
    private final int maxRetries = 3;

    @Builder.Default
    private final Duration initialDelay = Duration.ofMillis(200);

    @Builder.Default
    private final double backoffMultiplier = 2.0;

    @Builder.Default
    private final Duration maxDelay = Duration.ofSeconds(5);

    /**
     * @param retryNumber the retry about to be made (1-based)
     */
    public boolean shouldRetry(int retryNumber) {
        return retryNumber <= maxRetries;
    }

    /**
     * {@code initialDelay * backoffMultiplier^(retryNumber - 1)}, capped at {@code maxDelay}.
     *
     * @param retryNumber the retry about to be made (1-based)
     */
    public Duration calculateDelay(int retryNumber) {
        if (retryNumber <= 1) {
            return min(initialDelay, maxDelay);
        }
        double delayMs = initialDelay.toMillis() * Math.pow(backoffMultiplier, retryNumber - 1);
        return Duration.ofMillis((long) Math.min(delayMs, maxDelay.toMillis()));
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
