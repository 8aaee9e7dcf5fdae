package biz.kryukov.dev.healthmon;

/**
 * A refresh was abandoned because the refreshing thread was interrupted
 * (typically on shutdown). The cached batch is left untouched.
 */
public class RefreshInterruptedException extends HealthMonitorException {

    public RefreshInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
