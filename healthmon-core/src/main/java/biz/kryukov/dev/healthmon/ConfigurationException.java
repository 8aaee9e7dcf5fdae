package biz.kryukov.dev.healthmon;

/**
 * Ошибка конфигурации монитора (список сервисов, таймауты).
 */
public class ConfigurationException extends HealthMonitorException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
