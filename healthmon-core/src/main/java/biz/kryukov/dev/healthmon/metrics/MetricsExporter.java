package biz.kryukov.dev.healthmon.metrics;

import biz.kryukov.dev.healthmon.BatchListener;
import biz.kryukov.dev.healthmon.CheckOutcome;
import biz.kryukov.dev.healthmon.ResultBatch;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Publishes every installed batch to a Micrometer MeterRegistry.
 *
 * <p>Metrics exported:
 * <ul>
 *   <li>{@code healthmon_service_up}: Gauge (0/1)</li>
 *   <li>{@code healthmon_service_response_time_ms}: Gauge</li>
 *   <li>{@code healthmon_refresh_total}: Counter of installed batches</li>
 * </ul>
 */
public final class MetricsExporter implements BatchListener {

    private static final String UP_METRIC = "healthmon_service_up";
    private static final String RESPONSE_TIME_METRIC = "healthmon_service_response_time_ms";
    private static final String REFRESH_METRIC = "healthmon_refresh_total";
    private static final String UP_DESCRIPTION =
            "Health status of a monitored service (1 = healthy, 0 = unhealthy)";
    private static final String RESPONSE_TIME_DESCRIPTION =
            "Response time of the last probe in milliseconds";
    private static final String REFRESH_DESCRIPTION =
            "Number of completed refreshes of all services";

    private final MeterRegistry registry;
    private final Counter refreshes;
    private final ConcurrentHashMap<String, AtomicReference<Double>> upValues =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicReference<Double>> responseTimes =
            new ConcurrentHashMap<>();

    public MetricsExporter(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.refreshes = Counter.builder(REFRESH_METRIC)
                .description(REFRESH_DESCRIPTION)
                .register(registry);
    }

    @Override
    public void onBatch(ResultBatch batch) {
        for (CheckOutcome outcome : batch.results()) {
            setUp(outcome.serviceName(), outcome.healthy() ? 1.0 : 0.0);
            setResponseTime(outcome.serviceName(), outcome.responseTimeMs());
        }
        refreshes.increment();
    }

    /**
     * Sets the up gauge of a service (0 or 1).
     */
    void setUp(String service, double value) {
        gauge(upValues, UP_METRIC, UP_DESCRIPTION, service).set(value);
    }

    /**
     * Sets the response time gauge of a service.
     */
    void setResponseTime(String service, double millis) {
        gauge(responseTimes, RESPONSE_TIME_METRIC, RESPONSE_TIME_DESCRIPTION, service).set(millis);
    }

    private AtomicReference<Double> gauge(ConcurrentHashMap<String, AtomicReference<Double>> values,
                                          String metric, String description, String service) {
        return values.computeIfAbsent(service, k -> {
            AtomicReference<Double> ref = new AtomicReference<>(0.0);
            Gauge.builder(metric, ref, AtomicReference::get)
                    .description(description)
                    .tags(Tags.of("service", service))
                    .register(registry);
            return ref;
        });
    }
}
