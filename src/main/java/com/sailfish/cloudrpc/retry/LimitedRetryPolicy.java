package com.sailfish.cloudrpc.retry;

import com.sailfish.cloudrpc.model.StatusCode;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A retry policy bounded by both an attempt count and an elapsed time ceiling.
 * Only the configured transient codes are retried; every other code is permanent.
 */
public final class LimitedRetryPolicy implements RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_MAX_ELAPSED = Duration.ofSeconds(60);
    public static final Set<StatusCode> DEFAULT_TRANSIENT_CODES = Collections.unmodifiableSet(EnumSet.of(
            StatusCode.UNAVAILABLE,
            StatusCode.DEADLINE_EXCEEDED,
            StatusCode.RESOURCE_EXHAUSTED,
            StatusCode.INTERNAL));

    private final int maxAttempts;
    private final Duration maxElapsed;
    private final Set<StatusCode> transientCodes;

    /**
     * Creates a default LimitedRetryPolicy.
     * Max Attempts: 5
     * Max Elapsed: 60 seconds
     * Transient codes: UNAVAILABLE, DEADLINE_EXCEEDED, RESOURCE_EXHAUSTED, INTERNAL
     */
    public LimitedRetryPolicy() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_MAX_ELAPSED, DEFAULT_TRANSIENT_CODES);
    }

    public LimitedRetryPolicy(int maxAttempts, Duration maxElapsed) {
        this(maxAttempts, maxElapsed, DEFAULT_TRANSIENT_CODES);
    }

    /**
     * Creates a configurable LimitedRetryPolicy.
     *
     * @param maxAttempts Total number of attempts, including the first one.
     * @param maxElapsed No retry is granted once this much time has passed since the first attempt.
     * @param transientCodes Status codes that are retried.
     */
    public LimitedRetryPolicy(int maxAttempts, Duration maxElapsed, Set<StatusCode> transientCodes) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        if (maxElapsed == null || maxElapsed.isNegative() || maxElapsed.isZero()) throw new IllegalArgumentException("maxElapsed must be positive");
        Objects.requireNonNull(transientCodes, "transientCodes cannot be null");
        if (transientCodes.contains(StatusCode.OK)) throw new IllegalArgumentException("OK cannot be a transient error code");

        this.maxAttempts = maxAttempts;
        this.maxElapsed = maxElapsed;
        this.transientCodes = transientCodes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(transientCodes));
    }

    @Override
    public RetryVerdict decide(StatusCode code, int attempt, Duration elapsed) {
        Objects.requireNonNull(code, "code cannot be null");
        Objects.requireNonNull(elapsed, "elapsed cannot be null");
        if (code.isOk()) throw new IllegalArgumentException("OK is not an error");
        if (attempt < 1) throw new IllegalArgumentException("attempt must be at least 1");

        if (!isTransient(code)) {
            return RetryVerdict.STOP_PERMANENT;
        }
        if (attempt >= maxAttempts || elapsed.compareTo(maxElapsed) >= 0) {
            return RetryVerdict.STOP_EXHAUSTED;
        }
        return RetryVerdict.RETRY;
    }

    public boolean isTransient(StatusCode code) {
        return transientCodes.contains(code);
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getMaxElapsed() { return maxElapsed; }
    public Set<StatusCode> getTransientCodes() { return transientCodes; }

    @Override
    public String toString() {
        return "LimitedRetryPolicy{maxAttempts=" + maxAttempts + ", maxElapsed=" + maxElapsed + ", transientCodes=" + transientCodes + '}';
    }
}
