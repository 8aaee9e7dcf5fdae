package biz.kryukov.dev.healthmon.spring;

import biz.kryukov.dev.healthmon.HealthMonitor;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the background refresh loop with the application context and stops it on shutdown.
 *
 * <p>Runs in an early phase, so on shutdown the loop and the probe threads are released only
 * after the embedded web server has drained its requests.
 */
public class HealthMonitorLifecycle implements SmartLifecycle {

    /** Below the web server start/stop and graceful-shutdown phases. */
    public static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 4096;

    private final HealthMonitor healthMonitor;

    public HealthMonitorLifecycle(HealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    @Override
    public void start() {
        if (!healthMonitor.isRunning()) {
            healthMonitor.start();
        }
    }

    @Override
    public void stop() {
        healthMonitor.stop();
    }

    @Override
    public boolean isRunning() {
        return healthMonitor.isRunning();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
