package biz.kryukov.dev.healthmon;

import biz.kryukov.dev.healthmon.cache.ResultCache;
import biz.kryukov.dev.healthmon.checks.FanOutExecutor;
import biz.kryukov.dev.healthmon.checks.HttpProber;
import biz.kryukov.dev.healthmon.metrics.ExpositionFormatter;
import biz.kryukov.dev.healthmon.metrics.MetricsExporter;
import biz.kryukov.dev.healthmon.parser.ServicesConfigParser;
import biz.kryukov.dev.healthmon.scheduler.RefreshScheduler;

import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Точка входа монитора: владеет кэшем результатов и фоновым планировщиком.
 *
 * <p>Использование:
 * <pre>{@code
 * HealthMonitor monitor = HealthMonitor.builder()
 *     .service("github", "https://api.github.com")
 *     .service("google", "https://www.google.com")
 *     .requestTimeout(Duration.ofSeconds(10))
 *     .checkInterval(Duration.ofSeconds(60))
 *     .meterRegistry(meterRegistry)
 *     .build();
 *
 * monitor.start();
 * ServicesSummary summary = monitor.summary(false);
 * // ...
 * monitor.stop();
 * }</pre>
 */
public final class HealthMonitor {

    private final ServiceRegistry registry;
    private final MonitorConfig config;
    private final FanOutExecutor fanOut;
    private final ResultCache cache;
    private final RefreshScheduler scheduler;

    private HealthMonitor(ServiceRegistry registry, MonitorConfig config, FanOutExecutor fanOut,
                          ResultCache cache, RefreshScheduler scheduler) {
        this.registry = registry;
        this.config = config;
        this.fanOut = fanOut;
        this.cache = cache;
        this.scheduler = scheduler;
    }

    /** Запускает фоновое обновление результатов. */
    public void start() {
        scheduler.start();
    }

    /** Останавливает фоновое обновление и потоки проверок. */
    public void stop() {
        scheduler.stop();
        fanOut.close();
    }

    /**
     * Returns the current batch, refreshing it when stale or when forced.
     *
     * @see ResultCache#getResults(boolean)
     */
    public ResultBatch results(boolean force) {
        return cache.getResults(force);
    }

    /** Returns the structured view of {@link #results(boolean)}. */
    public ServicesSummary summary(boolean force) {
        return ServicesSummary.of(results(force));
    }

    /** Returns the Prometheus text rendering of the (possibly cached) results. */
    public String exposition() {
        return ExpositionFormatter.format(results(false));
    }

    /** Returns the cached batch without triggering a refresh. */
    public Optional<ResultBatch> current() {
        return cache.current();
    }

    /** Returns the monitored services. */
    public ServiceRegistry services() {
        return registry;
    }

    /** Returns the timing configuration. */
    public MonitorConfig config() {
        return config;
    }

    /** Returns whether the background refresh loop is running. */
    public boolean isRunning() {
        return scheduler.isRunning();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link HealthMonitor}. */
    public static final class Builder {
        private final ServiceRegistry.Builder services = ServiceRegistry.builder();
        private final MonitorConfig.Builder config = MonitorConfig.builder();
        private Prober prober;
        private MeterRegistry meterRegistry;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /** Adds a service to monitor. */
        public Builder service(String name, String url) {
            services.service(name, url);
            return this;
        }

        /** Adds all services of the map, in its iteration order. */
        public Builder services(Map<String, String> nameToUrl) {
            nameToUrl.forEach(services::service);
            return this;
        }

        /** Adds services from a {@code name=url,name2=url2} string. */
        public Builder servicesConfig(String raw) {
            return services(ServicesConfigParser.parseMap(raw));
        }

        public Builder requestTimeout(Duration timeout) {
            config.requestTimeout(timeout);
            return this;
        }

        public Builder checkInterval(Duration interval) {
            config.checkInterval(interval);
            return this;
        }

        public Builder freshnessWindow(Duration window) {
            config.freshnessWindow(window);
            return this;
        }

        /** Replaces the HTTP prober (tests, custom transports). */
        public Builder prober(Prober prober) {
            this.prober = prober;
            return this;
        }

        /** Publishes results to the registry when set. */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public HealthMonitor build() {
            ServiceRegistry registry;
            MonitorConfig cfg;
            try {
                registry = services.build();
                cfg = config.build();
            } catch (ValidationException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }

            Prober p = prober != null ? prober : new HttpProber(clock);
            FanOutExecutor fanOut = new FanOutExecutor(p, cfg.requestTimeout(), clock);
            ResultCache cache = new ResultCache(registry, fanOut, cfg.freshnessWindow(), clock);
            if (meterRegistry != null) {
                cache.addListener(new MetricsExporter(meterRegistry));
            }
            RefreshScheduler scheduler = new RefreshScheduler(cache, cfg.checkInterval());
            return new HealthMonitor(registry, cfg, fanOut, cache, scheduler);
        }
    }
}
