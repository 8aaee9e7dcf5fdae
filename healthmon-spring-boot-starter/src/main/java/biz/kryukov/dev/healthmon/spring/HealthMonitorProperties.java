package biz.kryukov.dev.healthmon.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for healthmon via application.yml / application.properties.
 *
 * <pre>
 * healthmon:
 *   app-name: Service Health Monitor
 *   request-timeout: 10s
 *   check-interval: 60s
 *   freshness-window: 5s
 *   services:
 *     github: https://api.github.com
 *     google: https://www.google.com
 * </pre>
 *
 * <p>Alternatively {@code healthmon.services-config: github=https://api.github.com,...}
 * (environment variable {@code HEALTHMON_SERVICES_CONFIG}); it is used when the
 * {@code services} map is empty.
 */
@ConfigurationProperties(prefix = "healthmon")
public class HealthMonitorProperties {

    private String appName = "Service Health Monitor";
    private Map<String, String> services = new LinkedHashMap<>();
    private String servicesConfig;
    private Duration requestTimeout;
    private Duration checkInterval;
    private Duration freshnessWindow;

    public String getAppName() {
        return appName;
    }

    public void setAppName(String appName) {
        this.appName = appName;
    }

    public Map<String, String> getServices() {
        return services;
    }

    public void setServices(Map<String, String> services) {
        this.services = services;
    }

    public String getServicesConfig() {
        return servicesConfig;
    }

    public void setServicesConfig(String servicesConfig) {
        this.servicesConfig = servicesConfig;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }

    public Duration getFreshnessWindow() {
        return freshnessWindow;
    }

    public void setFreshnessWindow(Duration freshnessWindow) {
        this.freshnessWindow = freshnessWindow;
    }
}
