package biz.kryukov.dev.healthmon.spring;

import biz.kryukov.dev.healthmon.CheckOutcome;
import biz.kryukov.dev.healthmon.HealthMonitor;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Actuator endpoint /actuator/services: service name → healthy, from the cached batch.
 */
@Endpoint(id = "services")
public class ServicesEndpoint {

    private final HealthMonitor healthMonitor;

    public ServicesEndpoint(HealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    @ReadOperation
    public Map<String, Boolean> services() {
        Map<String, Boolean> result = new LinkedHashMap<>();
        healthMonitor.current().ifPresent(batch -> {
            for (CheckOutcome outcome : batch.results()) {
                result.put(outcome.serviceName(), outcome.healthy());
            }
        });
        return result;
    }
}
