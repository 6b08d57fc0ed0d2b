package com.sailfish.cloudrpc.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * A backoff policy implementing exponential growth capped at a maximum delay, with optional jitter.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(100);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);
    public static final double DEFAULT_JITTER = 0.2;

    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final double jitter;

    /**
     * Creates a default ExponentialBackoffPolicy.
     * Initial Delay: 100 milliseconds
     * Multiplier: 2.0
     * Max Delay: 10 seconds
     * Jitter: 0.2
     */
    public ExponentialBackoffPolicy() {
        this(DEFAULT_INITIAL_DELAY, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY, DEFAULT_JITTER);
    }

    /**
     * Creates a configurable ExponentialBackoffPolicy.
     *
     * @param initialDelay Delay after the first failed attempt.
     * @param multiplier Factor by which the delay grows for each subsequent attempt.
     * @param maxDelay Upper bound for every returned delay.
     * @param jitter Fraction in [0, 1] by which a delay may be randomly shortened. 0 disables jitter.
     */
    public ExponentialBackoffPolicy(Duration initialDelay, double multiplier, Duration maxDelay, double jitter) {
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) throw new IllegalArgumentException("initialDelay must be positive");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be at least 1.0");
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) throw new IllegalArgumentException("maxDelay must not be shorter than initialDelay");
        if (jitter < 0.0 || jitter > 1.0) throw new IllegalArgumentException("jitter must be between 0 and 1");

        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
    }

    @Override
    public Duration nextDelay(int attempt, Random random) {
        if (attempt < 1) throw new IllegalArgumentException("attempt must be at least 1");
        Objects.requireNonNull(random, "random cannot be null");

        double delayNanos = saturatedNanos(initialDelay) * Math.pow(multiplier, attempt - 1);
        delayNanos = Math.min(delayNanos, saturatedNanos(maxDelay));

        // Jitter only shortens the delay, keeping it within [0, maxDelay]
        if (jitter > 0.0) {
            delayNanos = delayNanos * (1.0 - jitter * random.nextDouble());
        }
        return Duration.ofNanos(Math.max(0L, (long) delayNanos));
    }

    // Durations beyond ~292 years do not fit in a long of nanoseconds
    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    // --- Getters for configuration ---
    public Duration getInitialDelay() { return initialDelay; }
    public double getMultiplier() { return multiplier; }
    public Duration getMaxDelay() { return maxDelay; }
    public double getJitter() { return jitter; }

    @Override
    public String toString() {
        return "ExponentialBackoffPolicy{initialDelay=" + initialDelay + ", multiplier=" + multiplier
                + ", maxDelay=" + maxDelay + ", jitter=" + jitter + '}';
    }
}
