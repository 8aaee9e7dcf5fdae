package biz.kryukov.dev.healthmon;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * Monitored service: name and target URL. Immutable.
 */
public record ServiceEntry(String name, String url) {

    public ServiceEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(url, "url");
        if (name.isBlank()) {
            throw new ValidationException("service name must not be blank");
        }
        validateUrl(name, url);
    }

    private static void validateUrl(String name, String url) {
        if (url.isBlank()) {
            throw new ValidationException("URL of service '" + name + "' must not be blank");
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new ValidationException(
                    "URL of service '" + name + "' is malformed: " + e.getMessage());
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new ValidationException(
                    "URL of service '" + name + "' must use http or https, got '" + url + "'");
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new ValidationException(
                    "URL of service '" + name + "' must have a host, got '" + url + "'");
        }
    }

    @Override
    public String toString() {
        return name + "=" + url;
    }
}
