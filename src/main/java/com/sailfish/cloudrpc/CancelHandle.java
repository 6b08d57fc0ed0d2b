package com.sailfish.cloudrpc;

/**
 * Requests cancellation of a submitted call. Best effort: the call's continuation still fires exactly once,
 * and the remote side effect may already have happened.
 */
@FunctionalInterface
public interface CancelHandle {

    /**
     * Requests cancellation. Calling it more than once has the same effect as calling it once.
     */
    void cancel();
}
