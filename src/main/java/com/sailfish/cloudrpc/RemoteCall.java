package com.sailfish.cloudrpc;

import com.sailfish.cloudrpc.model.Result;

import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Describes one remote call that can be started asynchronously.
 * Implementations wrap the transport specific stub invocation.
 *
 * @param <T> The type of the response payload.
 */
@FunctionalInterface
public interface RemoteCall<T> {

    /**
     * Starts the remote call and returns without waiting for the response.
     * The callback must be invoked exactly once, from any thread, with the response or the error.
     *
     * @param callback Receives the outcome of the call.
     * @return A handle used to abort the call when it is cancelled, or null if the call cannot be aborted.
     */
    Future<?> start(Consumer<Result<T>> callback);
}
