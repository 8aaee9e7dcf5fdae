package biz.kryukov.dev.healthmon.cache;

import biz.kryukov.dev.healthmon.BatchListener;
import biz.kryukov.dev.healthmon.CheckOutcome;
import biz.kryukov.dev.healthmon.HealthMonitorException;
import biz.kryukov.dev.healthmon.RefreshInterruptedException;
import biz.kryukov.dev.healthmon.ResultBatch;
import biz.kryukov.dev.healthmon.ServiceRegistry;
import biz.kryukov.dev.healthmon.checks.FanOutExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds the latest {@link ResultBatch} and refreshes it on demand.
 *
 * <p>Refreshes are single-flight: while one fan-out run is in progress, every caller that
 * needs a refresh (forced or not) attaches to it and receives its batch. The
 * "check freshness, decide to refresh, install" sequence runs under one lock, and the batch
 * is swapped as a whole, so readers never see a partial result. Installed batches have
 * non-decreasing {@code producedAt}.
 *
 * <p>Listeners are called one batch at a time, in installation order. A batch superseded
 * before its listeners ran is skipped.
 */
public final class ResultCache {

    private static final Logger LOG = LoggerFactory.getLogger(ResultCache.class);

    private final ServiceRegistry registry;
    private final FanOutExecutor fanOut;
    private final Duration freshnessWindow;
    private final Clock clock;
    private final List<BatchListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong refreshCount = new AtomicLong();

    private final Object lock = new Object();
    // guarded by lock
    private ResultBatch current;
    // guarded by lock; non-null while a fan-out run is in progress
    private CompletableFuture<ResultBatch> inFlight;
    // guarded by lock
    private long generation;

    private final Object publishLock = new Object();
    // guarded by publishLock
    private long publishedGeneration;

    public ResultCache(ServiceRegistry registry, FanOutExecutor fanOut, Duration freshnessWindow) {
        this(registry, fanOut, freshnessWindow, Clock.systemUTC());
    }

    public ResultCache(ServiceRegistry registry, FanOutExecutor fanOut, Duration freshnessWindow,
                       Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
        this.freshnessWindow = Objects.requireNonNull(freshnessWindow, "freshnessWindow");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the current results, refreshing them if needed.
     *
     * @param force {@code true} to refresh regardless of the age of the cached batch
     * @return the cached batch if fresh and not forced, otherwise the batch of the
     *         (possibly shared) refresh
     * @throws HealthMonitorException if the refresh this caller waited on was abandoned
     */
    public ResultBatch getResults(boolean force) {
        CompletableFuture<ResultBatch> refresh;
        boolean owner = false;
        synchronized (lock) {
            if (!force && current != null && isFresh(current)) {
                return current;
            }
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                owner = true;
            }
            refresh = inFlight;
        }
        if (owner) {
            return runRefresh(refresh);
        }
        return await(refresh);
    }

    /** Returns the cached batch without triggering a refresh. */
    public Optional<ResultBatch> current() {
        synchronized (lock) {
            return Optional.ofNullable(current);
        }
    }

    /** Returns whether a refresh is in progress right now. */
    public boolean refreshing() {
        synchronized (lock) {
            return inFlight != null;
        }
    }

    /** Returns the number of fan-out runs completed so far. */
    public long refreshCount() {
        return refreshCount.get();
    }

    /** Returns the registry this cache probes. */
    public ServiceRegistry registry() {
        return registry;
    }

    /** Registers a listener notified after every installed batch. */
    public void addListener(BatchListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private ResultBatch runRefresh(CompletableFuture<ResultBatch> refresh) {
        ResultBatch previous;
        ResultBatch installed;
        long installedGeneration;
        try {
            ResultBatch fresh = fanOut.executeAll(registry);
            synchronized (lock) {
                previous = current;
                installed = fresh.withProducedAt(stampAfter(previous));
                current = installed;
                installedGeneration = ++generation;
                inFlight = null;
            }
        } catch (RuntimeException | Error e) {
            synchronized (lock) {
                inFlight = null;
            }
            refresh.completeExceptionally(e);
            LOG.warn("healthmon: refresh abandoned: {}", e.getMessage());
            throw e;
        }
        refreshCount.incrementAndGet();
        refresh.complete(installed);
        publish(installedGeneration, previous, installed);
        return installed;
    }

    private void publish(long installedGeneration, ResultBatch previous, ResultBatch installed) {
        synchronized (publishLock) {
            if (installedGeneration <= publishedGeneration) {
                LOG.debug("healthmon: batch from {} superseded before publishing, skipped",
                        installed.producedAt());
                return;
            }
            publishedGeneration = installedGeneration;
            logTransitions(previous, installed);
            notifyListeners(installed);
        }
    }

    private ResultBatch await(CompletableFuture<ResultBatch> refresh) {
        try {
            return refresh.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RefreshInterruptedException rie) {
                throw new RefreshInterruptedException(rie.getMessage(), rie);
            }
            if (cause instanceof HealthMonitorException hme) {
                throw new HealthMonitorException(hme.getMessage(), hme);
            }
            throw new HealthMonitorException("healthmon: shared refresh failed", cause);
        }
    }

    private boolean isFresh(ResultBatch batch) {
        Duration age = Duration.between(batch.producedAt(), clock.instant());
        return age.compareTo(freshnessWindow) < 0;
    }

    /** Current time, never earlier than the previous batch. */
    private Instant stampAfter(ResultBatch previous) {
        Instant now = clock.instant();
        if (previous != null && now.isBefore(previous.producedAt())) {
            return previous.producedAt();
        }
        return now;
    }

    private void logTransitions(ResultBatch previous, ResultBatch installed) {
        if (previous == null) {
            LOG.info("healthmon: first check done, {}/{} services healthy",
                    installed.healthyCount(), installed.total());
            return;
        }
        Map<String, Boolean> before = new HashMap<>();
        for (CheckOutcome outcome : previous.results()) {
            before.put(outcome.serviceName(), outcome.healthy());
        }
        for (CheckOutcome outcome : installed.results()) {
            Boolean wasHealthy = before.get(outcome.serviceName());
            if (Boolean.TRUE.equals(wasHealthy) && !outcome.healthy()) {
                LOG.warn("healthmon: {} [{}] became unhealthy: {}", outcome.serviceName(),
                        outcome.url(), outcome.errorMessage() != null
                                ? outcome.errorMessage() : "status " + outcome.statusCode());
            } else if (Boolean.FALSE.equals(wasHealthy) && outcome.healthy()) {
                LOG.info("healthmon: {} [{}] recovered", outcome.serviceName(), outcome.url());
            }
        }
    }

    private void notifyListeners(ResultBatch batch) {
        for (BatchListener listener : listeners) {
            try {
                listener.onBatch(batch);
            } catch (RuntimeException e) {
                LOG.warn("healthmon: batch listener {} failed", listener, e);
            }
        }
    }
}
