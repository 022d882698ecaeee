package com.medimax.assistant.resilience;

import lombok.Data;

import java.time.Duration;
import java.util.Random;

/**
 * Retry, backoff and timeout settings for one class of outbound call.
 *
 * <p>Bound from {@code app.resilience.policies.<name>}; see
 * {@link com.medimax.assistant.config.ResilienceConfig}.
 *
 * @since 1.0.0
 */
@Data
public class RetryPolicy {

    /**
     * Total attempts including the first one.
     */
    private int maxAttempts = 3;

    private Duration baseDelay = Duration.ofMillis(200);

    private Duration maxDelay = Duration.ofSeconds(5);

    /**
     * Fraction of the computed delay added or removed at random, 0.0 - 1.0.
     */
    private double jitter = 0.2;

    private Duration timeoutPerAttempt = Duration.ofSeconds(10);

    /**
     * Fixes the jitter sequence when set. Left empty in production.
     */
    private Long seed;

    public static RetryPolicy defaults() {
        return new RetryPolicy();
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay, Duration maxDelay,
                                 double jitter, Duration timeoutPerAttempt, Long seed) {
        RetryPolicy policy = new RetryPolicy();
        policy.setMaxAttempts(maxAttempts);
        policy.setBaseDelay(baseDelay);
        policy.setMaxDelay(maxDelay);
        policy.setJitter(jitter);
        policy.setTimeoutPerAttempt(timeoutPerAttempt);
        policy.setSeed(seed);
        return policy;
    }

    /**
     * Delay before the attempt following failed attempt {@code attempt} (1-based):
     * {@code min(maxDelay, baseDelay * 2^(attempt-1))}, shifted by up to
     * {@code jitter} of itself in either direction.
     */
    public Duration backoffFor(int attempt, Random random) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long exponential = baseDelay.toMillis() * (1L << exponent);
        long capped = Math.min(maxDelay.toMillis(), exponential);
        if (jitter <= 0.0 || capped == 0) {
            return Duration.ofMillis(capped);
        }
        double offset = (random.nextDouble() * 2.0 - 1.0) * Math.min(jitter, 1.0) * capped;
        return Duration.ofMillis(Math.max(0L, Math.round(capped + offset)));
    }

    /**
     * Longest time one {@code withRetry} call under this policy can take: every
     * attempt timing out, with maximal jitter on each backoff.
     */
    public Duration worstCase() {
        Duration total = timeoutPerAttempt.multipliedBy(maxAttempts);
        double stretch = 1.0 + Math.max(0.0, Math.min(jitter, 1.0));
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            long capped = Math.min(maxDelay.toMillis(), baseDelay.toMillis() * (1L << Math.min(attempt - 1, 30)));
            total = total.plusMillis((long) Math.ceil(capped * stretch));
        }
        return total;
    }

    public Random newRandom() {
        return seed != null ? new Random(seed) : new Random();
    }
}
