package biz.kryukov.dev.healthmon.metrics;

import biz.kryukov.dev.healthmon.CheckOutcome;
import biz.kryukov.dev.healthmon.ResultBatch;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricsExporterTest {

    private static final Instant NOW = Instant.parse("2026-01-31T18:30:00Z");

    private MeterRegistry registry;
    private MetricsExporter exporter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        exporter = new MetricsExporter(registry);
    }

    private static ResultBatch batch(CheckOutcome... outcomes) {
        return new ResultBatch(List.of(outcomes), NOW);
    }

    @Test
    void publishesUpAndResponseTime() {
        exporter.onBatch(batch(
                CheckOutcome.responded("github", "https://api.github.com", 200, 145.32, NOW),
                CheckOutcome.failed("bad", "https://nonexistent.invalid", "boom", 2.0, NOW)));

        Gauge up = registry.find("healthmon_service_up").tag("service", "github").gauge();
        Gauge down = registry.find("healthmon_service_up").tag("service", "bad").gauge();
        Gauge latency = registry.find("healthmon_service_response_time_ms")
                .tag("service", "github").gauge();

        assertNotNull(up);
        assertNotNull(down);
        assertNotNull(latency);
        assertEquals(1.0, up.value());
        assertEquals(0.0, down.value());
        assertEquals(145.32, latency.value(), 1e-9);
    }

    @Test
    void laterBatchUpdatesExistingGauges() {
        exporter.onBatch(batch(CheckOutcome.responded("api", "http://api.local", 200, 1.0, NOW)));
        exporter.onBatch(batch(CheckOutcome.responded("api", "http://api.local", 503, 9.5, NOW)));

        assertEquals(1, registry.find("healthmon_service_up").gauges().size());
        assertEquals(0.0, registry.get("healthmon_service_up").gauge().value());
        assertEquals(9.5, registry.get("healthmon_service_response_time_ms").gauge().value());
    }

    @Test
    void countsRefreshes() {
        exporter.onBatch(batch());
        exporter.onBatch(batch());

        Counter counter = registry.find("healthmon_refresh_total").counter();
        assertNotNull(counter);
        assertEquals(2.0, counter.count());
    }
}
