package com.sailfish.cloudrpc.time;

import java.time.Duration;
import java.util.concurrent.Future;

/**
 * Source of elapsed time and delayed wake-ups. Substituted with a manual implementation in tests.
 */
public interface TimeService {

    /**
     * @return A monotonic timestamp in nanoseconds, only meaningful relative to other values from the same service.
     */
    long nanoTime();

    /**
     * Runs the task once after the delay. The task must be short; it is run on a thread owned by the service.
     *
     * @return A handle that cancels the wake-up if it has not fired yet.
     * @throws java.util.concurrent.RejectedExecutionException if the service has been closed.
     */
    Future<?> schedule(Runnable task, Duration delay);
}
