package com.sailfish.cloudrpc.service.impl;

import com.sailfish.cloudrpc.CancelHandle;
import com.sailfish.cloudrpc.Continuation;
import com.sailfish.cloudrpc.RemoteCall;
import com.sailfish.cloudrpc.error.CallCancelledException;
import com.sailfish.cloudrpc.error.PermanentFailureException;
import com.sailfish.cloudrpc.error.QueueShutdownException;
import com.sailfish.cloudrpc.error.RetriesExhaustedException;
import com.sailfish.cloudrpc.error.RpcException;
import com.sailfish.cloudrpc.model.CallState;
import com.sailfish.cloudrpc.model.OperationId;
import com.sailfish.cloudrpc.model.Result;
import com.sailfish.cloudrpc.model.StatusCode;
import com.sailfish.cloudrpc.retry.BackoffPolicy;
import com.sailfish.cloudrpc.retry.RetryDecision;
import com.sailfish.cloudrpc.retry.RetryPolicy;
import com.sailfish.cloudrpc.service.CompletionQueue;
import com.sailfish.cloudrpc.time.TimeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one logical call through as many attempts as the retry policy allows and delivers exactly one
 * terminal result to the caller's continuation.
 *
 * Attempts are strictly sequential: the next attempt is scheduled from the completion of the previous one,
 * after a backoff timer on the same completion queue. No thread is blocked while waiting.
 *
 * @param <T> The type of the response payload.
 */
public final class RetryingAsyncCall<T> implements CancelHandle {

    private static final Logger log = LoggerFactory.getLogger(RetryingAsyncCall.class);

    private final String name;
    private final CompletionQueue queue;
    private final RemoteCall<T> call;
    private final RetryPolicy retryPolicy;
    private final BackoffPolicy backoffPolicy;
    private final TimeService timeService;
    private final Continuation<T> continuation;
    private final Random random = new Random(); // Independently seeded per call

    private final AtomicReference<CallState> state = new AtomicReference<>(CallState.IDLE);
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final AtomicReference<OperationId> inFlight = new AtomicReference<>();

    // Attempt state, only touched by the thread handling the latest completion of this call
    private int attempts;
    private long startNanos;

    public RetryingAsyncCall(String name,
                             CompletionQueue queue,
                             RemoteCall<T> call,
                             RetryPolicy retryPolicy,
                             BackoffPolicy backoffPolicy,
                             TimeService timeService,
                             Continuation<T> continuation) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.call = Objects.requireNonNull(call, "call cannot be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy cannot be null");
        this.timeService = Objects.requireNonNull(timeService, "timeService cannot be null");
        this.continuation = Objects.requireNonNull(continuation, "continuation cannot be null");
    }

    /**
     * Schedules the first attempt. If it cannot be scheduled the exception propagates to the caller
     * and the continuation is never invoked.
     *
     * @return this call, usable as its cancel handle.
     * @throws IllegalStateException if the call was already started.
     */
    public RetryingAsyncCall<T> start() {
        if (!state.compareAndSet(CallState.IDLE, CallState.ATTEMPTING)) {
            throw new IllegalStateException("Call " + name + " was already started (state " + state.get() + ")");
        }
        startNanos = timeService.nanoTime();
        try {
            scheduleAttempt();
        } catch (RuntimeException e) {
            state.set(CallState.PERMANENTLY_FAILED);
            throw e;
        }
        return this;
    }

    @Override
    public void cancel() {
        if (!cancelRequested.compareAndSet(false, true)) {
            return;
        }
        log.debug("Cancellation requested for call {} in state {}", name, state.get());
        if (state.compareAndSet(CallState.IDLE, CallState.CANCELLED)) {
            continuation.onCompletion(queue, Result.failure(new CallCancelledException("Call " + name + " was cancelled before it started")));
            return;
        }
        OperationId current = inFlight.get();
        if (current != null && !state.get().isTerminal()) {
            queue.cancel(current);
        }
    }

    public CallState getState() {
        return state.get();
    }

    /**
     * @return The number of attempts scheduled so far. Only stable once the call is terminal.
     */
    public int getAttempts() {
        return attempts;
    }

    public String getName() {
        return name;
    }

    private void scheduleAttempt() {
        attempts++;
        log.debug("Call {} scheduling attempt {}", name, attempts);
        track(queue.schedule(call, this::onAttemptComplete));
    }

    private void onAttemptComplete(CompletionQueue completionQueue, Result<T> result) {
        if (result.isSuccess()) {
            log.debug("Call {} succeeded on attempt {}", name, attempts);
            finish(CallState.SUCCEEDED, result);
            return;
        }
        RpcException error = result.getError();
        if (cancelRequested.get()) {
            finishCancelled();
            return;
        }

        Duration elapsed = Duration.ofNanos(timeService.nanoTime() - startNanos);
        RetryDecision decision;
        try {
            decision = decide(error.getStatusCode(), elapsed);
        } catch (RuntimeException e) {
            log.error("Call {} could not decide on a retry after attempt {}: {}", name, attempts, e.getMessage(), e);
            finishFailed(internalError("Retry decision failed after attempt " + attempts, e));
            return;
        }
        switch (decision.getVerdict()) {
            case RETRY:
                log.warn("Call {} attempt {} failed with {}: {}. Retrying in {}.",
                        name, attempts, error.getStatusCode(), error.getMessage(), decision.getDelay());
                scheduleBackoff(decision.getDelay());
                break;
            case STOP_PERMANENT:
                log.error("Call {} attempt {} failed permanently with {}: {}",
                        name, attempts, error.getStatusCode(), error.getMessage());
                finishFailed(error);
                break;
            case STOP_EXHAUSTED:
                log.error("Call {} exhausted its retries after {} attempts over {}. Last error {}: {}",
                        name, attempts, elapsed, error.getStatusCode(), error.getMessage());
                finish(CallState.EXHAUSTED, Result.failure(new RetriesExhaustedException(attempts, elapsed, error)));
                break;
            default:
                throw new IllegalStateException("Unexpected verdict " + decision.getVerdict());
        }
    }

    private RetryDecision decide(StatusCode code, Duration elapsed) {
        return RetryDecision.of(retryPolicy, backoffPolicy, code, attempts, elapsed, random);
    }

    private void scheduleBackoff(Duration delay) {
        try {
            track(queue.makeRelativeTimer(delay, this::onBackoffElapsed));
        } catch (QueueShutdownException e) {
            finishRejected(e);
        } catch (RuntimeException e) {
            log.error("Call {} could not wait {} before attempt {}: {}", name, delay, attempts + 1, e.getMessage(), e);
            finishFailed(internalError("Backoff timer could not be scheduled after attempt " + attempts, e));
        }
    }

    private void onBackoffElapsed(CompletionQueue completionQueue, Result<Void> result) {
        if (!result.isSuccess() || cancelRequested.get()) {
            finishCancelled();
            return;
        }
        try {
            scheduleAttempt();
        } catch (QueueShutdownException e) {
            finishRejected(e);
        } catch (RuntimeException e) {
            log.error("Call {} could not start attempt {}: {}", name, attempts, e.getMessage(), e);
            finishFailed(internalError("Attempt " + attempts + " failed to start", e));
        }
    }

    /**
     * Remembers the operation currently in flight. Queue IDs grow over time, so a stale ID never replaces a newer one.
     * A cancel that raced with the scheduling is re-applied to the new operation.
     */
    private void track(OperationId id) {
        inFlight.accumulateAndGet(id, (current, candidate) ->
                current == null || candidate.compareTo(current) > 0 ? candidate : current);
        if (cancelRequested.get()) {
            queue.cancel(id);
        }
    }

    private void finishCancelled() {
        finish(CallState.CANCELLED, Result.failure(
                new CallCancelledException("Call " + name + " was cancelled after " + attempts + " attempt(s)")));
    }

    private static RpcException internalError(String message, RuntimeException e) {
        return e instanceof RpcException
                ? (RpcException) e
                : new RpcException(StatusCode.INTERNAL, message + ": " + e.getMessage(), e);
    }

    private void finishFailed(RpcException error) {
        finish(CallState.PERMANENTLY_FAILED, Result.failure(new PermanentFailureException(attempts, error)));
    }

    private void finishRejected(QueueShutdownException e) {
        log.error("Call {} stopped after {} attempt(s): {}", name, attempts, e.getMessage());
        finishFailed(e);
    }

    private void finish(CallState terminal, Result<T> result) {
        CallState previous = state.getAndUpdate(current -> current.isTerminal() ? current : terminal);
        if (previous.isTerminal()) {
            log.debug("Call {} already finished as {}, dropping {}", name, previous, terminal);
            return;
        }
        inFlight.set(null);
        continuation.onCompletion(queue, result);
    }
}
