package com.sailfish.cloudrpc.error;

import java.time.Duration;

/**
 * The call never succeeded before the retry policy ran out of attempts or time.
 * The status code and cause are those of the last transient error observed.
 */
public class RetriesExhaustedException extends RpcException {

    private static final long serialVersionUID = 1L;

    private final int attempts;
    private final Duration elapsed;

    public RetriesExhaustedException(int attempts, Duration elapsed, RpcException lastError) {
        super(lastError.getStatusCode(),
                "Retries exhausted after " + attempts + " attempt(s) over " + elapsed + ": " + lastError.getMessage(),
                lastError);
        this.attempts = attempts;
        this.elapsed = elapsed;
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getElapsed() {
        return elapsed;
    }
}
