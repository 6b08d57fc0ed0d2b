package com.sailfish.cloudrpc.service.impl;

import com.sailfish.cloudrpc.service.CompletionQueue;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the worker threads that run a {@link CompletionQueue}'s loop.
 * Stopping the pool shuts the queue down and waits for outstanding operations to drain.
 */
public class CompletionQueueThreadPool {

    private static final Logger log = LoggerFactory.getLogger(CompletionQueueThreadPool.class);

    public static final int DEFAULT_WORKER_COUNT = 2;
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(30);

    private final CompletionQueue queue;
    private final int workerCount;
    private ExecutorService workers;

    public CompletionQueueThreadPool(CompletionQueue queue) {
        this(queue, DEFAULT_WORKER_COUNT);
    }

    public CompletionQueueThreadPool(CompletionQueue queue, int workerCount) {
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive");
        }
        this.workerCount = workerCount;
        log.info("CompletionQueueThreadPool initialized with workerCount={}", workerCount);
    }

    @PostConstruct
    public synchronized void start() {
        if (workers != null) {
            log.warn("CompletionQueueThreadPool already started.");
            return;
        }
        if (queue.isShutdown()) {
            throw new IllegalStateException("Cannot start workers: completion queue is shut down");
        }
        AtomicInteger threadNumber = new AtomicInteger();
        workers = Executors.newFixedThreadPool(workerCount, runnable -> {
            Thread thread = new Thread(runnable, "cloudrpc-cq-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        for (int i = 0; i < workerCount; i++) {
            workers.execute(queue::run);
        }
        log.info("CompletionQueueThreadPool started {} workers.", workerCount);
    }

    @PreDestroy
    public void stop() {
        stop(DEFAULT_STOP_TIMEOUT.getSeconds());
    }

    /**
     * Shuts the queue down and waits for the workers to drain it. Workers still running after the timeout
     * are interrupted.
     *
     * @param timeoutSeconds Time to wait for outstanding operations before forcing the workers to stop.
     * @return true if the workers finished within the timeout.
     */
    public synchronized boolean stop(long timeoutSeconds) {
        log.info("Stopping CompletionQueueThreadPool...");
        queue.shutdown();
        if (workers == null) {
            return true;
        }
        workers.shutdown();
        try {
            if (workers.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.info("CompletionQueueThreadPool workers terminated gracefully.");
                return true;
            }
            log.warn("CompletionQueueThreadPool workers did not terminate in {} seconds.", timeoutSeconds);
            List<Runnable> dropped = workers.shutdownNow();
            log.warn("Forcefully stopping workers. {} queued workers were dropped.", dropped.size());
            if (!workers.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.error("CompletionQueueThreadPool workers did not terminate even after forceful shutdown.");
            }
            return false;
        } catch (InterruptedException ie) {
            log.warn("CompletionQueueThreadPool stop interrupted. Forcing shutdown now.");
            workers.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public int getWorkerCount() { return workerCount; }
}
