package biz.kryukov.dev.healthmon.service;

import biz.kryukov.dev.healthmon.HealthMonitor;
import biz.kryukov.dev.healthmon.metrics.ExpositionFormatter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Prometheus text exposition of the (possibly cached) results at {@code /metrics}.
 */
@RestController
public class MetricsController {

    private final HealthMonitor healthMonitor;

    public MetricsController(HealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    @GetMapping("/metrics")
    public ResponseEntity<String> metrics() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, ExpositionFormatter.CONTENT_TYPE)
                .body(healthMonitor.exposition());
    }
}
