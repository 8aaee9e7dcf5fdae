package biz.kryukov.dev.healthmon;

import java.time.Duration;
import java.util.Objects;

/**
 * Monitor timing configuration. Immutable, created via Builder.
 */
public final class MonitorConfig {

    /** Default per-probe timeout: 10 seconds. */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    /** Default background refresh interval: 60 seconds. */
    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(60);
    /** Default maximum age of a cached batch served without a refresh: 5 seconds. */
    public static final Duration DEFAULT_FRESHNESS_WINDOW = Duration.ofSeconds(5);

    private final Duration requestTimeout;
    private final Duration checkInterval;
    private final Duration freshnessWindow;

    private MonitorConfig(Builder builder) {
        this.requestTimeout = builder.requestTimeout;
        this.checkInterval = builder.checkInterval;
        this.freshnessWindow = builder.freshnessWindow;
    }

    /** Returns the timeout applied to every probe. */
    public Duration requestTimeout() {
        return requestTimeout;
    }

    /** Returns the pause between background refreshes. */
    public Duration checkInterval() {
        return checkInterval;
    }

    /** Returns the freshness window of the result cache. */
    public Duration freshnessWindow() {
        return freshnessWindow;
    }

    /** Creates a new builder with default values. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a configuration with all default values. */
    public static MonitorConfig defaults() {
        return builder().build();
    }

    @Override
    public String toString() {
        return "MonitorConfig{requestTimeout=" + requestTimeout
                + ", checkInterval=" + checkInterval
                + ", freshnessWindow=" + freshnessWindow + "}";
    }

    /** Builder for {@link MonitorConfig}. */
    public static final class Builder {
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration checkInterval = DEFAULT_CHECK_INTERVAL;
        private Duration freshnessWindow = DEFAULT_FRESHNESS_WINDOW;

        private Builder() {}

        /** Sets the per-probe timeout. */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /** Sets the background refresh interval. */
        public Builder checkInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
            return this;
        }

        /** Sets the cache freshness window ({@link Duration#ZERO} disables caching). */
        public Builder freshnessWindow(Duration freshnessWindow) {
            this.freshnessWindow = freshnessWindow;
            return this;
        }

        /** Builds and validates the configuration. */
        public MonitorConfig build() {
            validate();
            return new MonitorConfig(this);
        }

        private void validate() {
            Objects.requireNonNull(requestTimeout, "requestTimeout");
            Objects.requireNonNull(checkInterval, "checkInterval");
            Objects.requireNonNull(freshnessWindow, "freshnessWindow");
            if (requestTimeout.isNegative() || requestTimeout.isZero()) {
                throw new ValidationException(
                        "requestTimeout must be positive, got " + requestTimeout);
            }
            if (checkInterval.isNegative() || checkInterval.isZero()) {
                throw new ValidationException(
                        "checkInterval must be positive, got " + checkInterval);
            }
            if (freshnessWindow.isNegative()) {
                throw new ValidationException(
                        "freshnessWindow must not be negative, got " + freshnessWindow);
            }
        }
    }
}
