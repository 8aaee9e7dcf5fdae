package biz.kryukov.dev.healthmon.service;

import biz.kryukov.dev.healthmon.CheckOutcome;
import biz.kryukov.dev.healthmon.HealthMonitor;
import biz.kryukov.dev.healthmon.ServicesSummary;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON view of the monitored services.
 *
 * <p>{@code GET /api/services} serves the cached results while they are fresh;
 * {@code POST /api/check} always runs a new check (or joins one already running).
 */
@RestController
@RequestMapping("/api")
public class ServicesController {

    private final HealthMonitor healthMonitor;

    public ServicesController(HealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    @GetMapping("/services")
    public Map<String, Object> services() {
        return toMap(healthMonitor.summary(false));
    }

    @PostMapping("/check")
    public Map<String, Object> check() {
        return toMap(healthMonitor.summary(true));
    }

    static Map<String, Object> toMap(ServicesSummary summary) {
        List<Map<String, Object>> services = new ArrayList<>(summary.services().size());
        for (CheckOutcome outcome : summary.services()) {
            services.add(toMap(outcome));
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("services", services);
        m.put("total", summary.total());
        m.put("healthy", summary.healthy());
        m.put("unhealthy", summary.unhealthy());
        return m;
    }

    private static Map<String, Object> toMap(CheckOutcome outcome) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("service_name", outcome.serviceName());
        m.put("url", outcome.url());
        m.put("is_healthy", outcome.healthy());
        m.put("status_code", outcome.statusCode());
        m.put("response_time_ms", outcome.responseTimeMs());
        m.put("error_message", outcome.errorMessage());
        m.put("checked_at", outcome.checkedAt().toString());
        return m;
    }
}
