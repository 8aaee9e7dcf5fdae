package biz.kryukov.dev.healthmon.parser;

import biz.kryukov.dev.healthmon.ConfigurationException;
import biz.kryukov.dev.healthmon.ServiceRegistry;
import biz.kryukov.dev.healthmon.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Парсер строки конфигурации сервисов вида {@code name=url,name2=url2}.
 *
 * <p>Пробелы вокруг имён и URL обрезаются. URL может содержать {@code =}
 * (разделяется только первый). Ошибки формата приводят к {@link ConfigurationException}.
 */
public final class ServicesConfigParser {

    private static final String ENTRY_SEPARATOR = ",";
    private static final String NAME_SEPARATOR = "=";

    private ServicesConfigParser() {}

    /**
     * Parses the services string into an ordered name → URL map.
     *
     * @param raw configuration string, e.g. {@code github=https://api.github.com}
     * @return ordered map of service names to URLs
     * @throws ConfigurationException if the string is blank or an entry is malformed
     */
    public static Map<String, String> parseMap(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("services config must not be empty");
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (String item : raw.split(ENTRY_SEPARATOR, -1)) {
            int eq = item.indexOf(NAME_SEPARATOR);
            if (eq < 0) {
                throw new ConfigurationException(
                        "Invalid format in services config: '" + item + "'. Expected 'name=url'");
            }
            String name = item.substring(0, eq).trim();
            String url = item.substring(eq + 1).trim();
            if (name.isEmpty() || url.isEmpty()) {
                throw new ConfigurationException("Empty name or URL in: '" + item + "'");
            }
            if (result.putIfAbsent(name, url) != null) {
                throw new ConfigurationException("Duplicate service name: '" + name + "'");
            }
        }
        return result;
    }

    /**
     * Parses the services string into a {@link ServiceRegistry}.
     *
     * @throws ConfigurationException if the string is malformed or a URL is invalid
     */
    public static ServiceRegistry parse(String raw) {
        return toRegistry(parseMap(raw));
    }

    /**
     * Validates a name → URL map and builds a registry from it.
     *
     * @throws ConfigurationException if a name or URL is invalid
     */
    public static ServiceRegistry toRegistry(Map<String, String> services) {
        try {
            return ServiceRegistry.of(services);
        } catch (ValidationException e) {
            throw new ConfigurationException("Invalid services config: " + e.getMessage(), e);
        }
    }
}
