package com.sailfish.cloudrpc.model;

/**
 * Represents the lifecycle states of a retrying call.
 */
public enum CallState {
    /**
     * Call has been created but no attempt has been scheduled yet.
     */
    IDLE(false),
    /**
     * An attempt is in flight or the call is waiting out the backoff before the next attempt.
     */
    ATTEMPTING(false),
    /**
     * An attempt returned a successful response.
     */
    SUCCEEDED(true),
    /**
     * An attempt returned an error the retry policy does not retry.
     */
    PERMANENTLY_FAILED(true),
    /**
     * The retry policy ran out of attempts or time before any attempt succeeded.
     */
    EXHAUSTED(true),
    /**
     * The caller cancelled the call.
     */
    CANCELLED(true);

    private final boolean terminal;

    CallState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
