package com.sailfish.cloudrpc.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Computes the delay before the next attempt.
 * Implementations hold no mutable state; randomness comes from the stream owned by the calling retry loop.
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param attempt The number of the attempt that just failed, starting at 1.
     * @param random The pseudo-random stream owned by the call being retried.
     * @return A non-negative delay.
     */
    Duration nextDelay(int attempt, Random random);

    /**
     * A policy returning the same delay for every attempt.
     */
    static BackoffPolicy fixed(Duration delay) {
        Objects.requireNonNull(delay, "delay cannot be null");
        if (delay.isNegative()) throw new IllegalArgumentException("delay cannot be negative");
        return (attempt, random) -> delay;
    }
}
