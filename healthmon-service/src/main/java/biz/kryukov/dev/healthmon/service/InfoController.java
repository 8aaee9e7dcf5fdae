package biz.kryukov.dev.healthmon.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class InfoController {

    static final String VERSION = "0.1.0";

    private final String appName;
    private final Clock clock;

    @Autowired
    public InfoController(@Value("${healthmon.app-name:Service Health Monitor}") String appName) {
        this(appName, Clock.systemUTC());
    }

    InfoController(String appName, Clock clock) {
        this.appName = appName;
        this.clock = clock;
    }

    @GetMapping("/")
    public Map<String, String> info() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("name", appName);
        m.put("version", VERSION);
        m.put("docs", "/actuator");
        return m;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("status", "healthy");
        m.put("version", VERSION);
        m.put("timestamp", Instant.now(clock).toString());
        return m;
    }
}
