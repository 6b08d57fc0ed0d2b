package com.sailfish.cloudrpc.service.impl;

import com.sailfish.cloudrpc.CancelHandle;
import com.sailfish.cloudrpc.Continuation;
import com.sailfish.cloudrpc.RemoteCall;
import com.sailfish.cloudrpc.error.CallCancelledException;
import com.sailfish.cloudrpc.factory.RetryProfileFactory;
import com.sailfish.cloudrpc.model.Result;
import com.sailfish.cloudrpc.retry.BackoffPolicy;
import com.sailfish.cloudrpc.retry.RetryPolicy;
import com.sailfish.cloudrpc.retry.RetryProfile;
import com.sailfish.cloudrpc.service.CompletionQueue;
import com.sailfish.cloudrpc.service.RpcExecutionService;
import com.sailfish.cloudrpc.time.TimeService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Default implementation of the RpcExecutionService.
 * Creates one {@link RetryingAsyncCall} per submission on the shared completion queue.
 *
 * Assumes dependency injection for the queue, time service, default profile and profile factory.
 */
public class RpcExecutionServiceImpl implements RpcExecutionService {

    private static final Logger log = LoggerFactory.getLogger(RpcExecutionServiceImpl.class);

    private final CompletionQueue queue;
    private final TimeService timeService;
    private final RetryProfile defaultProfile;
    private final RetryProfileFactory profileFactory;
    private final AtomicLong callCounter = new AtomicLong();

    public RpcExecutionServiceImpl(CompletionQueue queue,
                                   TimeService timeService,
                                   RetryProfile defaultProfile,
                                   RetryProfileFactory profileFactory) {
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.timeService = Objects.requireNonNull(timeService, "timeService cannot be null");
        this.defaultProfile = Objects.requireNonNull(defaultProfile, "defaultProfile cannot be null");
        this.profileFactory = Objects.requireNonNull(profileFactory, "profileFactory cannot be null");
        log.info("RpcExecutionService initialized with default profile {}", defaultProfile);
    }

    @PostConstruct
    public void start() {
        log.info("RpcExecutionService started and ready to accept calls.");
        if (queue.isShutdown()) {
            log.error("FATAL: Completion queue is already shut down on startup!");
        }
    }

    @Override
    public <T> CancelHandle submitRetrying(RemoteCall<T> call, RetryPolicy retryPolicy, BackoffPolicy backoffPolicy,
                                           Continuation<T> continuation) {
        String name = "call-" + callCounter.incrementAndGet();
        RetryingAsyncCall<T> retryingCall = new RetryingAsyncCall<>(
                name, queue, call, retryPolicy, backoffPolicy, timeService, continuation);
        log.debug("Submitting {}", name);
        return retryingCall.start();
    }

    @Override
    public <T> CancelHandle submitRetrying(RemoteCall<T> call, Continuation<T> continuation) {
        return submitRetrying(call, defaultProfile.getRetryPolicy(), defaultProfile.getBackoffPolicy(), continuation);
    }

    @Override
    public <T> CancelHandle submitRetrying(String profileName, RemoteCall<T> call, Continuation<T> continuation) {
        RetryProfile profile = profileFactory.getProfile(profileName)
                .orElseThrow(() -> new IllegalArgumentException("No retry profile registered under name: " + profileName));
        return submitRetrying(call, profile.getRetryPolicy(), profile.getBackoffPolicy(), continuation);
    }

    @Override
    public <T> Result<T> await(Function<Continuation<T>, CancelHandle> submission) {
        Objects.requireNonNull(submission, "submission cannot be null");
        CompletableFuture<Result<T>> signal = new CompletableFuture<>();
        CancelHandle handle = submission.apply((completionQueue, result) -> signal.complete(result));
        try {
            return signal.get();
        } catch (InterruptedException e) {
            log.warn("Interrupted while awaiting a call. Cancelling it.");
            if (handle != null) {
                handle.cancel();
            }
            Thread.currentThread().interrupt();
            return Result.failure(new CallCancelledException("Interrupted while awaiting the call"));
        } catch (ExecutionException e) {
            // The signal is only ever completed normally
            throw new IllegalStateException("Unexpected failure awaiting the call", e.getCause());
        }
    }

    @Override
    public <T> T invoke(RemoteCall<T> call) {
        Result<T> result = await(continuation -> submitRetrying(call, continuation));
        return result.getOrThrow();
    }
}
