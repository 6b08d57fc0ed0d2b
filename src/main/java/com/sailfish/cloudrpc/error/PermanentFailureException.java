package com.sailfish.cloudrpc.error;

/**
 * The service rejected the call with an error that is not retried.
 */
public class PermanentFailureException extends RpcException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public PermanentFailureException(int attempts, RpcException cause) {
        super(cause.getStatusCode(), "Call failed permanently after " + attempts + " attempt(s): " + cause.getMessage(), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
