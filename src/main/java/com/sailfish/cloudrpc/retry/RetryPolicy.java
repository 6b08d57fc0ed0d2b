package com.sailfish.cloudrpc.retry;

import com.sailfish.cloudrpc.model.StatusCode;

import java.time.Duration;

/**
 * Decides whether a failed attempt is retried.
 * Implementations must be stateless so one instance can be shared by concurrent calls without locking.
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Decides what happens after a failed attempt.
     *
     * @param code The status code of the error returned by the attempt.
     * @param attempt The number of attempts made so far, starting at 1.
     * @param elapsed The time since the first attempt was scheduled.
     * @return The verdict for this failure.
     */
    RetryVerdict decide(StatusCode code, int attempt, Duration elapsed);

    /**
     * A policy that never retries: transient errors exhaust immediately, everything else is permanent.
     */
    static RetryPolicy noRetry() {
        return (code, attempt, elapsed) -> LimitedRetryPolicy.DEFAULT_TRANSIENT_CODES.contains(code)
                ? RetryVerdict.STOP_EXHAUSTED
                : RetryVerdict.STOP_PERMANENT;
    }
}
