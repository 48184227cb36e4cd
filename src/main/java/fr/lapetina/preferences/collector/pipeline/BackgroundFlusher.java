package fr.lapetina.preferences.collector.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Timer-driven worker that drains a collector's queue every flush interval.
 *
 * One daemon thread per collector. Stopping cancels the pending delayed run,
 * so no flush starts after the stop signal, and waits for a flush already in
 * progress to finish. The final drain is the caller's job.
 */
public final class BackgroundFlusher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackgroundFlusher.class);

    private final Runnable flushTask;
    private final Duration interval;
    private final Duration shutdownTimeout;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public BackgroundFlusher(Runnable flushTask, Duration interval, Duration shutdownTimeout, String threadName) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Flush interval must be positive");
        }
        this.flushTask = flushTask;
        this.interval = interval;
        this.shutdownTimeout = shutdownTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic flushing. The first run happens one interval from now.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runFlush,
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Background flusher started with interval: {}", interval);
        }
    }

    private void runFlush() {
        // An exception escaping here would cancel all future runs
        try {
            flushTask.run();
        } catch (RuntimeException e) {
            log.error("Background flush failed", e);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops the worker and waits for an in-progress flush to finish.
     */
    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Background flusher did not stop within {}, interrupting", shutdownTimeout);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Background flusher stopped");
    }
}
