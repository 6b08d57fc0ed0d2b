package com.sailfish.cloudrpc.retry;

import com.sailfish.cloudrpc.model.StatusCode;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * The step a retrying call takes after a failed attempt: retry after a delay, or stop.
 * Computed fresh for every failed attempt.
 */
public final class RetryDecision {

    private static final RetryDecision PERMANENT_FAILURE = new RetryDecision(RetryVerdict.STOP_PERMANENT, Duration.ZERO);
    private static final RetryDecision EXHAUSTED = new RetryDecision(RetryVerdict.STOP_EXHAUSTED, Duration.ZERO);

    private final RetryVerdict verdict;
    private final Duration delay;

    private RetryDecision(RetryVerdict verdict, Duration delay) {
        this.verdict = verdict;
        this.delay = delay;
    }

    public static RetryDecision retryAfter(Duration delay) {
        Objects.requireNonNull(delay, "delay cannot be null");
        if (delay.isNegative()) throw new IllegalArgumentException("delay cannot be negative");
        return new RetryDecision(RetryVerdict.RETRY, delay);
    }

    public static RetryDecision permanentFailure() {
        return PERMANENT_FAILURE;
    }

    public static RetryDecision exhausted() {
        return EXHAUSTED;
    }

    /**
     * Combines the verdict of a retry policy with the delay of a backoff policy.
     */
    public static RetryDecision of(RetryPolicy retryPolicy, BackoffPolicy backoffPolicy,
                                   StatusCode code, int attempt, Duration elapsed, Random random) {
        RetryVerdict verdict = Objects.requireNonNull(retryPolicy.decide(code, attempt, elapsed), "retry policy returned null");
        switch (verdict) {
            case RETRY:
                return retryAfter(backoffPolicy.nextDelay(attempt, random));
            case STOP_PERMANENT:
                return permanentFailure();
            default:
                return exhausted();
        }
    }

    public RetryVerdict getVerdict() {
        return verdict;
    }

    public Duration getDelay() {
        return delay;
    }

    public boolean isRetry() {
        return verdict == RetryVerdict.RETRY;
    }

    @Override
    public String toString() {
        return verdict == RetryVerdict.RETRY ? "RetryAfter{" + delay + "}" : verdict.toString();
    }
}
