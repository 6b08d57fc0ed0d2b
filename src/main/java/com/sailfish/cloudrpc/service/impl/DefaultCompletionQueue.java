package com.sailfish.cloudrpc.service.impl;

import com.sailfish.cloudrpc.Continuation;
import com.sailfish.cloudrpc.RemoteCall;
import com.sailfish.cloudrpc.error.CallCancelledException;
import com.sailfish.cloudrpc.error.QueueShutdownException;
import com.sailfish.cloudrpc.model.OperationId;
import com.sailfish.cloudrpc.model.PendingOperation;
import com.sailfish.cloudrpc.model.Result;
import com.sailfish.cloudrpc.repository.InMemoryPendingOperationRegistry;
import com.sailfish.cloudrpc.repository.PendingOperationRegistry;
import com.sailfish.cloudrpc.service.CompletionQueue;
import com.sailfish.cloudrpc.time.SystemTimeService;
import com.sailfish.cloudrpc.time.TimeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default implementation of the CompletionQueue.
 * Remote calls and timers post their results as delivery messages; the threads running {@link #run()}
 * consume those messages and invoke the continuations.
 *
 * A result is turned into a delivery only by whoever removes the record from the registry first, either the
 * natural completion or {@link #cancel(OperationId)}, so each continuation fires exactly once.
 */
public class DefaultCompletionQueue implements CompletionQueue {

    private static final Logger log = LoggerFactory.getLogger(DefaultCompletionQueue.class);

    private final PendingOperationRegistry registry;
    private final TimeService timeService;
    private final SystemTimeService ownedTimeService; // Closed once the queue has drained; null if injected
    private final AtomicLong lastId = new AtomicLong();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    private final Deque<Runnable> deliveries = new ArrayDeque<>();
    private int outstanding;      // Accepted operations whose continuation has not returned yet
    private boolean shutdown;
    private boolean terminated;

    /**
     * Creates a queue with its own timer thread, released once the queue has shut down and drained.
     */
    public DefaultCompletionQueue() {
        this(new InMemoryPendingOperationRegistry(), new SystemTimeService(), true);
    }

    public DefaultCompletionQueue(TimeService timeService) {
        this(new InMemoryPendingOperationRegistry(), timeService, false);
    }

    public DefaultCompletionQueue(PendingOperationRegistry registry, TimeService timeService) {
        this(registry, timeService, false);
    }

    private DefaultCompletionQueue(PendingOperationRegistry registry, TimeService timeService, boolean ownsTimeService) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.timeService = Objects.requireNonNull(timeService, "timeService cannot be null");
        this.ownedTimeService = ownsTimeService ? (SystemTimeService) timeService : null;
        log.info("Completion queue initialized.");
    }

    @Override
    public void run() {
        String worker = Thread.currentThread().getName();
        log.debug("Worker {} entered the completion loop.", worker);
        while (true) {
            Runnable delivery;
            boolean releaseTimer = false;
            lock.lock();
            try {
                while (deliveries.isEmpty() && !(shutdown && outstanding == 0)) {
                    try {
                        wakeUp.await();
                    } catch (InterruptedException e) {
                        log.warn("Worker {} interrupted. Leaving the completion loop with {} operations outstanding.", worker, outstanding);
                        Thread.currentThread().interrupt();
                        return;
                    }
                }
                delivery = deliveries.pollFirst();
                if (delivery == null && !terminated) {
                    terminated = true;
                    releaseTimer = ownedTimeService != null;
                }
            } finally {
                lock.unlock();
            }

            if (delivery == null) {
                if (releaseTimer) {
                    ownedTimeService.close();
                }
                log.debug("Worker {} left the completion loop. Queue is shut down and drained.", worker);
                return;
            }
            deliver(delivery);
        }
    }

    @Override
    public <T> OperationId schedule(RemoteCall<T> call, Continuation<T> continuation) {
        Objects.requireNonNull(call, "call cannot be null");
        PendingOperation<T> operation = admit(continuation);
        AsyncOperation<T> asyncOperation = new AsyncOperation<>(this, operation);
        try {
            asyncOperation.start(call);
        } catch (RuntimeException e) {
            log.error("Remote call for operation {} failed to start: {}", operation.getId(), e.getMessage(), e);
            abandon(operation);
            throw e;
        }
        log.debug("Scheduled operation {}", operation.getId());
        return operation.getId();
    }

    @Override
    public OperationId makeRelativeTimer(Duration delay, Continuation<Void> continuation) {
        Objects.requireNonNull(delay, "delay cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be negative");
        }
        PendingOperation<Void> operation = admit(continuation);
        try {
            operation.attachHandle(timeService.schedule(() -> complete(operation, Result.success(null)), delay));
        } catch (RuntimeException e) {
            log.error("Timer for operation {} could not be scheduled: {}", operation.getId(), e.getMessage(), e);
            abandon(operation);
            throw e;
        }
        log.debug("Scheduled timer {} to fire in {}", operation.getId(), delay);
        return operation.getId();
    }

    @Override
    public boolean cancel(OperationId id) {
        Objects.requireNonNull(id, "id cannot be null");
        Optional<PendingOperation<?>> removed = registry.remove(id);
        if (removed.isEmpty()) {
            log.debug("Cancel for operation {} ignored, it has already completed.", id);
            return false;
        }
        PendingOperation<?> operation = removed.get();
        operation.markCancelled();
        enqueueCancellation(operation);
        log.debug("Cancelled operation {}", id);
        return true;
    }

    @Override
    public void shutdown() {
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            log.info("Shutting down completion queue. {} operations outstanding.", outstanding);
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
        logPendingOperations();
    }

    @Override
    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The number of accepted operations whose continuation has not yet returned.
     */
    public int getOutstandingCount() {
        lock.lock();
        try {
            return outstanding;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Posts the natural result of an operation, unless it was already completed or cancelled.
     */
    <T> void complete(PendingOperation<T> operation, Result<T> result) {
        if (registry.remove(operation.getId()).isEmpty()) {
            log.debug("Dropping result for operation {}, it was already cancelled.", operation.getId());
            return;
        }
        enqueue(() -> operation.getContinuation().onCompletion(this, result));
    }

    private void logPendingOperations() {
        Instant now = Instant.now();
        for (OperationId id : registry.findAllIds()) {
            registry.findById(id).ifPresent(operation -> log.info("Operation {} still pending at shutdown, age {}",
                    id, Duration.between(operation.getCreatedAt(), now)));
        }
    }

    private <T> PendingOperation<T> admit(Continuation<T> continuation) {
        Objects.requireNonNull(continuation, "continuation cannot be null");
        lock.lock();
        try {
            if (shutdown) {
                throw new QueueShutdownException("Completion queue is shut down");
            }
            PendingOperation<T> operation = new PendingOperation<>(new OperationId(lastId.incrementAndGet()), continuation);
            registry.register(operation);
            outstanding++;
            return operation;
        } finally {
            lock.unlock();
        }
    }

    private <T> void enqueueCancellation(PendingOperation<T> operation) {
        Result<T> cancelled = Result.failure(new CallCancelledException("Operation " + operation.getId() + " was cancelled"));
        enqueue(() -> operation.getContinuation().onCompletion(this, cancelled));
    }

    private void enqueue(Runnable delivery) {
        lock.lock();
        try {
            deliveries.addLast(delivery);
            wakeUp.signal();
        } finally {
            lock.unlock();
        }
    }

    // Used when an operation was admitted but never started
    private void abandon(PendingOperation<?> operation) {
        if (registry.remove(operation.getId()).isPresent()) {
            release();
        }
    }

    private void deliver(Runnable delivery) {
        try {
            delivery.run();
        } catch (RuntimeException e) {
            log.error("Continuation failed: {}", e.getMessage(), e);
        } finally {
            release();
        }
    }

    private void release() {
        lock.lock();
        try {
            outstanding--;
            if (shutdown && outstanding == 0) {
                wakeUp.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }
}
