package biz.kryukov.dev.healthmon.spring;

import biz.kryukov.dev.healthmon.CheckOutcome;
import biz.kryukov.dev.healthmon.HealthMonitor;
import biz.kryukov.dev.healthmon.ResultBatch;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.Optional;

/**
 * Spring Boot Actuator HealthIndicator: reports the cached service states at /actuator/health.
 *
 * <p>Never triggers probing: before the first refresh the status is UNKNOWN.
 */
public class HealthMonitorIndicator implements HealthIndicator {

    private final HealthMonitor healthMonitor;

    /**
     * @param healthMonitor the monitor whose cached results are reported
     */
    public HealthMonitorIndicator(HealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    @Override
    public Health health() {
        Optional<ResultBatch> current = healthMonitor.current();
        if (current.isEmpty()) {
            return Health.unknown().build();
        }
        ResultBatch batch = current.get();

        boolean allHealthy = batch.healthyCount() == batch.total();
        Health.Builder builder = allHealthy ? Health.up() : Health.down();

        for (CheckOutcome outcome : batch.results()) {
            builder.withDetail(outcome.serviceName(), outcome.healthy() ? "UP" : "DOWN");
        }
        return builder.build();
    }
}
