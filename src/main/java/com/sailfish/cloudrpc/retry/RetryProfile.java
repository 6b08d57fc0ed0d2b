package com.sailfish.cloudrpc.retry;

import java.util.Objects;

/**
 * A retry policy paired with the backoff policy used between its attempts.
 */
public final class RetryProfile {

    private final RetryPolicy retryPolicy;
    private final BackoffPolicy backoffPolicy;

    public RetryProfile(RetryPolicy retryPolicy, BackoffPolicy backoffPolicy) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy cannot be null");
    }

    /**
     * Profile built from {@link LimitedRetryPolicy} and {@link ExponentialBackoffPolicy} defaults.
     */
    public static RetryProfile defaults() {
        return new RetryProfile(new LimitedRetryPolicy(), new ExponentialBackoffPolicy());
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public BackoffPolicy getBackoffPolicy() {
        return backoffPolicy;
    }

    @Override
    public String toString() {
        return "RetryProfile{retryPolicy=" + retryPolicy + ", backoffPolicy=" + backoffPolicy + '}';
    }
}
