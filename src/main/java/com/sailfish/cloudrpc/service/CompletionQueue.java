package com.sailfish.cloudrpc.service;

import com.sailfish.cloudrpc.Continuation;
import com.sailfish.cloudrpc.RemoteCall;
import com.sailfish.cloudrpc.model.OperationId;

import java.time.Duration;

/**
 * Event loop that owns in-flight operations and delivers their completions.
 * Operations are accepted from any thread; completions are delivered on the threads calling {@link #run()}.
 */
public interface CompletionQueue {

    /**
     * Processes completions on the calling thread until {@link #shutdown()} has been called and no
     * operations remain outstanding. Several threads may run the loop at once; each completion is
     * delivered on exactly one of them.
     */
    void run();

    /**
     * Starts a remote call. Returns without waiting for the response. The continuation is invoked exactly once,
     * with the call's result or with a cancellation error.
     *
     * @param call The remote call to start.
     * @param continuation Receives the result.
     * @param <T> The type of the response payload.
     * @return The ID of the new operation.
     * @throws com.sailfish.cloudrpc.error.QueueShutdownException if the queue has been shut down.
     */
    <T> OperationId schedule(RemoteCall<T> call, Continuation<T> continuation);

    /**
     * Schedules a wake-up after the delay. The continuation receives a successful result when the timer fires,
     * or a cancellation error if the timer is cancelled first.
     *
     * @throws com.sailfish.cloudrpc.error.QueueShutdownException if the queue has been shut down.
     */
    OperationId makeRelativeTimer(Duration delay, Continuation<Void> continuation);

    /**
     * Requests cancellation of an in-flight operation. If cancellation wins the race with the natural completion,
     * the continuation receives a cancellation error; otherwise it receives the natural result.
     *
     * @return true if the operation was still pending and is now cancelled, false otherwise.
     */
    boolean cancel(OperationId id);

    /**
     * Stops accepting new operations. Outstanding operations are not aborted; {@link #run()} returns
     * once they have all been delivered. Calling it again has no effect.
     */
    void shutdown();

    boolean isShutdown();
}
