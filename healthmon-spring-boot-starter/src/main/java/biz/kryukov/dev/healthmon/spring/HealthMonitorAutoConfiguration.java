package biz.kryukov.dev.healthmon.spring;

import biz.kryukov.dev.healthmon.HealthMonitor;
import biz.kryukov.dev.healthmon.parser.ServicesConfigParser;

import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.Map;

/**
 * Auto-configuration for healthmon: creates a HealthMonitor bean from application.yml properties.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
})
@ConditionalOnClass(HealthMonitor.class)
@EnableConfigurationProperties(HealthMonitorProperties.class)
public class HealthMonitorAutoConfiguration {

    /**
     * Creates a {@link HealthMonitor} bean configured from application properties.
     *
     * @param properties    healthmon configuration properties
     * @param meterRegistry Micrometer meter registry, if the application has one
     * @return configured HealthMonitor instance
     */
    @Bean
    @ConditionalOnMissingBean
    public HealthMonitor healthMonitor(HealthMonitorProperties properties,
                                       ObjectProvider<MeterRegistry> meterRegistry) {
        HealthMonitor.Builder builder = HealthMonitor.builder()
                .services(resolveServices(properties));

        if (properties.getRequestTimeout() != null) {
            builder.requestTimeout(properties.getRequestTimeout());
        }
        if (properties.getCheckInterval() != null) {
            builder.checkInterval(properties.getCheckInterval());
        }
        if (properties.getFreshnessWindow() != null) {
            builder.freshnessWindow(properties.getFreshnessWindow());
        }
        meterRegistry.ifAvailable(builder::meterRegistry);

        return builder.build();
    }

    /** Creates a lifecycle bean for automatic start/stop of the refresh loop. */
    @Bean
    @ConditionalOnMissingBean
    public HealthMonitorLifecycle healthMonitorLifecycle(HealthMonitor healthMonitor) {
        return new HealthMonitorLifecycle(healthMonitor);
    }

    /** Creates a Spring Boot Actuator HealthIndicator for the monitored services. */
    @Bean
    @ConditionalOnMissingBean
    public HealthMonitorIndicator healthMonitorIndicator(HealthMonitor healthMonitor) {
        return new HealthMonitorIndicator(healthMonitor);
    }

    /** Creates an Actuator endpoint exposing the cached results at {@code /actuator/services}. */
    @Bean
    @ConditionalOnMissingBean
    public ServicesEndpoint servicesEndpoint(HealthMonitor healthMonitor) {
        return new ServicesEndpoint(healthMonitor);
    }

    private static Map<String, String> resolveServices(HealthMonitorProperties properties) {
        Map<String, String> services = properties.getServices();
        if (services != null && !services.isEmpty()) {
            return services;
        }
        String raw = properties.getServicesConfig();
        if (raw != null && !raw.isBlank()) {
            return ServicesConfigParser.parseMap(raw);
        }
        return Map.of();
    }
}
