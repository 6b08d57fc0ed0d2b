package com.sailfish.cloudrpc.service;

import com.sailfish.cloudrpc.CancelHandle;
import com.sailfish.cloudrpc.Continuation;
import com.sailfish.cloudrpc.RemoteCall;
import com.sailfish.cloudrpc.model.Result;
import com.sailfish.cloudrpc.retry.BackoffPolicy;
import com.sailfish.cloudrpc.retry.RetryPolicy;

import java.util.function.Function;

/**
 * Service interface for submitting remote calls that are retried until they succeed,
 * fail permanently, run out of retries, or are cancelled.
 */
public interface RpcExecutionService {

    /**
     * Submits a call with explicit policies. Transient errors are retried internally; the continuation receives
     * exactly one terminal result.
     *
     * @param call The remote call to attempt.
     * @param retryPolicy Decides whether a failed attempt is retried.
     * @param backoffPolicy Computes the delay between attempts.
     * @param continuation Receives the terminal result.
     * @param <T> The type of the response payload.
     * @return A handle to cancel the call.
     * @throws NullPointerException if any argument is null.
     * @throws com.sailfish.cloudrpc.error.QueueShutdownException if the completion queue has been shut down.
     */
    <T> CancelHandle submitRetrying(RemoteCall<T> call, RetryPolicy retryPolicy, BackoffPolicy backoffPolicy,
                                    Continuation<T> continuation);

    /**
     * Submits a call using the default retry profile.
     */
    <T> CancelHandle submitRetrying(RemoteCall<T> call, Continuation<T> continuation);

    /**
     * Submits a call using the retry profile registered under the given name.
     *
     * @throws IllegalArgumentException if no profile is registered under that name.
     */
    <T> CancelHandle submitRetrying(String profileName, RemoteCall<T> call, Continuation<T> continuation);

    /**
     * Blocks the calling thread until the submitted call delivers its terminal result.
     * Must not be called from a thread running the completion queue.
     * If the waiting thread is interrupted, the call is cancelled and a cancellation failure is returned.
     *
     * @param submission Submits the call, wiring the given continuation, and returns its cancel handle.
     */
    <T> Result<T> await(Function<Continuation<T>, CancelHandle> submission);

    /**
     * Synchronous form of {@link #submitRetrying(RemoteCall, Continuation)}.
     *
     * @return The response payload.
     * @throws com.sailfish.cloudrpc.error.RpcException describing the terminal failure.
     */
    <T> T invoke(RemoteCall<T> call);
}
