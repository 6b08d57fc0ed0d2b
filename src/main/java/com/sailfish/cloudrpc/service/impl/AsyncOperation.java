package com.sailfish.cloudrpc.service.impl;

import com.sailfish.cloudrpc.RemoteCall;
import com.sailfish.cloudrpc.model.PendingOperation;
import com.sailfish.cloudrpc.model.Result;

import java.util.Objects;
import java.util.concurrent.Future;

/**
 * Bridges one remote call to the bookkeeping of a {@link DefaultCompletionQueue}.
 * The record is registered before the call starts, so the call cannot complete before the queue knows about it.
 */
final class AsyncOperation<T> {

    private final DefaultCompletionQueue queue;
    private final PendingOperation<T> operation;

    AsyncOperation(DefaultCompletionQueue queue, PendingOperation<T> operation) {
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.operation = Objects.requireNonNull(operation, "operation cannot be null");
    }

    /**
     * Starts the call. The callback handed to it posts the result back to the queue.
     */
    void start(RemoteCall<T> call) {
        Future<?> handle = call.start(this::onResult);
        operation.attachHandle(handle);
    }

    private void onResult(Result<T> result) {
        if (result == null) {
            throw new IllegalArgumentException("Remote call for " + operation.getId() + " completed with a null result");
        }
        queue.complete(operation, result);
    }
}
