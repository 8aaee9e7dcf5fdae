package biz.kryukov.dev.healthmon.spring;

import biz.kryukov.dev.healthmon.ConfigurationException;
import biz.kryukov.dev.healthmon.HealthMonitor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HealthMonitorAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(HealthMonitorAutoConfiguration.class))
            .withBean(SimpleMeterRegistry.class);

    @Test
    void createsHealthMonitorBean() {
        contextRunner
                .withPropertyValues(
                        "healthmon.services.github=https://api.github.com",
                        "healthmon.services.google=https://www.google.com"
                )
                .run(context -> {
                    assertTrue(context.containsBean("healthMonitor"));
                    HealthMonitor monitor = context.getBean(HealthMonitor.class);
                    assertEquals(2, monitor.services().size());
                    assertEquals(List.of("github", "google"), monitor.services().entries()
                            .stream().map(e -> e.name()).toList());
                });
    }

    @Test
    void servicesConfigStringUsedWhenMapEmpty() {
        contextRunner
                .withPropertyValues(
                        "healthmon.services-config=github=https://api.github.com,local=http://localhost:8080"
                )
                .run(context -> {
                    HealthMonitor monitor = context.getBean(HealthMonitor.class);
                    assertEquals(2, monitor.services().size());
                    assertEquals("local", monitor.services().entries().get(1).name());
                });
    }

    @Test
    void timingProperties() {
        contextRunner
                .withPropertyValues(
                        "healthmon.services.api=http://localhost:8080",
                        "healthmon.request-timeout=3s",
                        "healthmon.check-interval=30s",
                        "healthmon.freshness-window=2s"
                )
                .run(context -> {
                    HealthMonitor monitor = context.getBean(HealthMonitor.class);
                    assertEquals(Duration.ofSeconds(3), monitor.config().requestTimeout());
                    assertEquals(Duration.ofSeconds(30), monitor.config().checkInterval());
                    assertEquals(Duration.ofSeconds(2), monitor.config().freshnessWindow());
                });
    }

    @Test
    void defaultsWithoutTimingProperties() {
        contextRunner
                .withPropertyValues("healthmon.services.api=http://localhost:8080")
                .run(context -> {
                    HealthMonitor monitor = context.getBean(HealthMonitor.class);
                    assertEquals(Duration.ofSeconds(10), monitor.config().requestTimeout());
                    assertEquals(Duration.ofSeconds(60), monitor.config().checkInterval());
                    assertEquals(Duration.ofSeconds(5), monitor.config().freshnessWindow());
                });
    }

    @Test
    void malformedServicesConfigFailsStartup() {
        contextRunner
                .withPropertyValues("healthmon.services-config=github")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(ConfigurationException.class);
                });
    }

    @Test
    void createsLifecycleIndicatorAndEndpointBeans() {
        contextRunner
                .withPropertyValues("healthmon.services.api=http://localhost:8080")
                .run(context -> {
                    assertTrue(context.containsBean("healthMonitorLifecycle"));
                    assertTrue(context.containsBean("healthMonitorIndicator"));
                    assertTrue(context.containsBean("servicesEndpoint"));
                    assertNotNull(context.getBean(HealthMonitorLifecycle.class));
                });
    }

    @Test
    void lifecycleStartsMonitor() {
        contextRunner
                .withPropertyValues("healthmon.services.api=http://localhost:8080")
                .run(context -> {
                    assertTrue(context.getBean(HealthMonitorLifecycle.class).isRunning());
                    assertTrue(context.getBean(HealthMonitor.class).isRunning());
                });
    }
}
