package com.sailfish.cloudrpc.retry;

/**
 * What a {@link RetryPolicy} decides for a failed attempt.
 */
public enum RetryVerdict {
    RETRY,
    STOP_PERMANENT,
    STOP_EXHAUSTED
}
