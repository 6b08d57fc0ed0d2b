package com.sailfish.cloudrpc.model;

import com.sailfish.cloudrpc.Continuation;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Future;

/**
 * Represents the in-flight state of one operation owned by a completion queue.
 * The record is removed from the registry when its completion is delivered, so at most one delivery happens per record.
 *
 * @param <T> The type of the result payload.
 */
public final class PendingOperation<T> {

    private final OperationId id;
    private final Continuation<T> continuation;
    private final Instant createdAt;

    private volatile boolean cancelled;
    private volatile Future<?> handle; // Remote call or timer handle, opaque to the queue

    public PendingOperation(OperationId id, Continuation<T> continuation) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.continuation = Objects.requireNonNull(continuation, "continuation cannot be null");
        this.createdAt = Instant.now();
    }

    /**
     * Stores the handle returned by the underlying call. If the operation was cancelled while the call
     * was starting, the handle is cancelled right away.
     */
    public void attachHandle(Future<?> handle) {
        this.handle = handle;
        if (cancelled && handle != null) {
            handle.cancel(true);
        }
    }

    /**
     * Flags the operation as cancelled and aborts the underlying call if a handle is attached.
     */
    public void markCancelled() {
        cancelled = true;
        Future<?> current = handle;
        if (current != null) {
            current.cancel(true);
        }
    }

    public OperationId getId() {
        return id;
    }

    public Continuation<T> getContinuation() {
        return continuation;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "PendingOperation{" +
                "id=" + id +
                ", cancelled=" + cancelled +
                ", createdAt=" + createdAt +
                '}';
    }
}
