package com.sailfish.cloudrpc;

import com.sailfish.cloudrpc.model.Result;
import com.sailfish.cloudrpc.service.CompletionQueue;

/**
 * Receives the outcome of an operation. Invoked exactly once, on a thread running
 * {@link CompletionQueue#run()}, except for a retrying call cancelled before it was started:
 * that call delivers its cancellation on the thread calling cancel. Implementations must not block.
 *
 * @param <T> The type of the result payload.
 */
@FunctionalInterface
public interface Continuation<T> {

    void onCompletion(CompletionQueue queue, Result<T> result);
}
