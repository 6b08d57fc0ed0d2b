package com.sailfish.cloudrpc.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link TimeService} backed by {@link System#nanoTime()} and a single daemon timer thread.
 */
public class SystemTimeService implements TimeService, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SystemTimeService.class);

    private final ScheduledExecutorService timerExecutor;

    public SystemTimeService() {
        this.timerExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cloudrpc-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    @Override
    public Future<?> schedule(Runnable task, Duration delay) {
        Objects.requireNonNull(task, "task cannot be null");
        Objects.requireNonNull(delay, "delay cannot be null");
        long delayNanos = Math.max(0L, delay.toNanos());
        return timerExecutor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Stops the timer thread. Wake-ups that have not fired are dropped.
     */
    @Override
    public void close() {
        int dropped = timerExecutor.shutdownNow().size();
        log.debug("Timer service closed. {} pending wake-ups were dropped.", dropped);
    }
}
