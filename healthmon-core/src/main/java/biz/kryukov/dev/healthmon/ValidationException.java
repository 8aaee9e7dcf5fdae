package biz.kryukov.dev.healthmon;

/**
 * Parameter validation error.
 */
public class ValidationException extends HealthMonitorException {

    public ValidationException(String message) {
        super(message);
    }
}
