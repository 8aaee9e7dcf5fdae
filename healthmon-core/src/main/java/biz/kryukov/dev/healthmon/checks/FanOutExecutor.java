package biz.kryukov.dev.healthmon.checks;

import biz.kryukov.dev.healthmon.CheckOutcome;
import biz.kryukov.dev.healthmon.ErrorClassifier;
import biz.kryukov.dev.healthmon.HealthMonitorException;
import biz.kryukov.dev.healthmon.Prober;
import biz.kryukov.dev.healthmon.RefreshInterruptedException;
import biz.kryukov.dev.healthmon.ResultBatch;
import biz.kryukov.dev.healthmon.ServiceEntry;
import biz.kryukov.dev.healthmon.ServiceRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Probes every registered service concurrently and joins the outcomes into one batch.
 *
 * <p>Each probe runs on its own pooled daemon thread. Results keep registry order regardless
 * of completion order. A probe still running {@link #DEFAULT_GRACE} after its timeout is
 * cancelled and reported as a timeout, so one hung target cannot hold the batch.
 */
public final class FanOutExecutor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FanOutExecutor.class);

    /** Extra time given to a prober beyond its own timeout before the batch stops waiting. */
    public static final Duration DEFAULT_GRACE = Duration.ofSeconds(1);

    private final Prober prober;
    private final Duration timeout;
    private final Duration grace;
    private final Clock clock;
    private final ExecutorService executor;

    public FanOutExecutor(Prober prober, Duration timeout) {
        this(prober, timeout, Clock.systemUTC());
    }

    public FanOutExecutor(Prober prober, Duration timeout, Clock clock) {
        this(prober, timeout, DEFAULT_GRACE, clock);
    }

    FanOutExecutor(Prober prober, Duration timeout, Duration grace, Clock clock) {
        this.prober = Objects.requireNonNull(prober, "prober");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.grace = Objects.requireNonNull(grace, "grace");
        this.clock = Objects.requireNonNull(clock, "clock");
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "healthmon-probe-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Returns the timeout applied to every probe. */
    public Duration timeout() {
        return timeout;
    }

    /**
     * Probes all services of the registry and waits for every outcome.
     *
     * @param registry services to probe
     * @return one outcome per service, in registry order
     * @throws RefreshInterruptedException if the calling thread is interrupted while waiting
     */
    public ResultBatch executeAll(ServiceRegistry registry) {
        if (registry.isEmpty()) {
            return ResultBatch.empty(clock.instant());
        }
        long startNs = System.nanoTime();
        List<ServiceEntry> entries = registry.entries();
        List<Future<CheckOutcome>> futures = new ArrayList<>(entries.size());
        try {
            for (ServiceEntry entry : entries) {
                futures.add(executor.submit(() -> safeProbe(entry)));
            }
        } catch (RejectedExecutionException e) {
            cancelAll(futures);
            throw new HealthMonitorException("healthmon: probe executor is shut down", e);
        }

        long deadlineNs = startNs + timeout.toNanos() + grace.toNanos();
        List<CheckOutcome> results = new ArrayList<>(entries.size());
        try {
            for (int i = 0; i < entries.size(); i++) {
                results.add(await(entries.get(i), futures.get(i), deadlineNs, startNs));
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new RefreshInterruptedException("healthmon: refresh interrupted", e);
        }

        ResultBatch batch = new ResultBatch(results, clock.instant());
        LOG.debug("healthmon: probed {} services in {} ms, {} healthy",
                batch.total(), HttpProber.elapsedMillis(startNs), batch.healthyCount());
        return batch;
    }

    private CheckOutcome await(ServiceEntry entry, Future<CheckOutcome> future,
                               long deadlineNs, long startNs) throws InterruptedException {
        try {
            long remainingNs = Math.max(0L, deadlineNs - System.nanoTime());
            return future.get(remainingNs, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("healthmon: {} [{}] probe did not finish within {}, abandoned",
                    entry.name(), entry.url(), timeout);
            return CheckOutcome.failed(entry.name(), entry.url(), ErrorClassifier.TIMEOUT_MESSAGE,
                    HttpProber.elapsedMillis(startNs), clock.instant());
        } catch (ExecutionException e) {
            // Only an Error escapes safeProbe.
            throw new HealthMonitorException(
                    "healthmon: probe of " + entry.name() + " crashed", e.getCause());
        }
    }

    private CheckOutcome safeProbe(ServiceEntry entry) {
        long startNs = System.nanoTime();
        try {
            CheckOutcome outcome = prober.probe(entry.name(), entry.url(), timeout);
            if (outcome == null) {
                throw new IllegalStateException("prober returned no outcome");
            }
            return outcome;
        } catch (RuntimeException e) {
            LOG.error("healthmon: prober failed for {} [{}]", entry.name(), entry.url(), e);
            return CheckOutcome.failed(entry.name(), entry.url(), ErrorClassifier.describe(e),
                    HttpProber.elapsedMillis(startNs), clock.instant());
        }
    }

    private static void cancelAll(List<Future<CheckOutcome>> futures) {
        for (Future<CheckOutcome> f : futures) {
            f.cancel(true);
        }
    }

    /** Stops the probe threads, interrupting probes still in progress. */
    @Override
    public void close() {
        executor.shutdownNow();
    }
}
