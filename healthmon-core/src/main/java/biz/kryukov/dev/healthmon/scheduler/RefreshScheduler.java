package biz.kryukov.dev.healthmon.scheduler;

import biz.kryukov.dev.healthmon.RefreshInterruptedException;
import biz.kryukov.dev.healthmon.ResultBatch;
import biz.kryukov.dev.healthmon.cache.ResultCache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Background cache warmer: sleeps for the check interval, then forces a refresh of the
 * {@link ResultCache}, forever.
 *
 * <p>Runs on one daemon thread. {@link #stop()} interrupts a refresh in progress and does not
 * wait for it; the cache either installs a complete batch or keeps the previous one.
 */
public final class RefreshScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(RefreshScheduler.class);

    private final ResultCache cache;
    private final Duration interval;
    private final Logger logger;

    private ScheduledThreadPoolExecutor executor;
    private ScheduledFuture<?> future;
    private volatile boolean started;
    private volatile boolean stopped;

    public RefreshScheduler(ResultCache cache, Duration interval) {
        this(cache, interval, LOG);
    }

    public RefreshScheduler(ResultCache cache, Duration interval, Logger logger) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.logger = Objects.requireNonNull(logger, "logger");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive, got " + interval);
        }
    }

    /**
     * Starts the refresh loop. The first refresh happens one interval after start.
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Scheduler already started");
        }
        if (stopped) {
            throw new IllegalStateException("Scheduler already stopped");
        }
        started = true;

        executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "healthmon-scheduler");
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);

        long intervalNs = interval.toNanos();
        future = executor.scheduleWithFixedDelay(this::runCycle,
                intervalNs, intervalNs, TimeUnit.NANOSECONDS);

        logger.info("healthmon: scheduler started, {} services, interval {}",
                cache.registry().size(), interval);
    }

    /**
     * Stops the refresh loop. Idempotent; does not block on an in-flight refresh.
     */
    public synchronized void stop() {
        if (!started || stopped) {
            return;
        }
        stopped = true;

        if (future != null) {
            future.cancel(true);
        }
        if (executor != null) {
            executor.shutdownNow();
        }

        logger.info("healthmon: scheduler stopped");
    }

    /** Returns whether the loop is running. */
    public boolean isRunning() {
        return started && !stopped;
    }

    /** Returns the pause between refreshes. */
    public Duration interval() {
        return interval;
    }

    void runCycle() {
        try {
            ResultBatch batch = cache.getResults(true);
            logger.debug("healthmon: scheduled refresh done, {}/{} healthy",
                    batch.healthyCount(), batch.total());
        } catch (RefreshInterruptedException e) {
            logger.debug("healthmon: scheduled refresh interrupted");
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            // An exception escaping here would cancel the periodic task.
            logger.error("healthmon: scheduled refresh failed", e);
        }
    }
}
