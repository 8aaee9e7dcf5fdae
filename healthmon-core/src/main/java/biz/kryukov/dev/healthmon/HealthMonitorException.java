package biz.kryukov.dev.healthmon;

/**
 * Base exception for the health monitor.
 */
public class HealthMonitorException extends RuntimeException {

    public HealthMonitorException(String message) {
        super(message);
    }

    public HealthMonitorException(String message, Throwable cause) {
        super(message, cause);
    }
}
