package biz.kryukov.dev.healthmon;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of a single probe. Immutable.
 *
 * <p>Either a response was received ({@code statusCode} set, {@code errorMessage} null,
 * healthy iff status &lt; 400) or the probe failed ({@code statusCode} null,
 * {@code errorMessage} set, unhealthy).
 *
 * @param serviceName    service name
 * @param url            probed URL
 * @param healthy        {@code true} if a response with status &lt; 400 was received
 * @param statusCode     HTTP status, or {@code null} if no response was received
 * @param responseTimeMs elapsed time in milliseconds, rounded to 2 decimals
 * @param errorMessage   failure description, or {@code null} if a response was received
 * @param checkedAt      time the outcome was determined
 */
public record CheckOutcome(
        String serviceName,
        String url,
        boolean healthy,
        Integer statusCode,
        double responseTimeMs,
        String errorMessage,
        Instant checkedAt
) {

    /** Status codes from this value on are unhealthy. */
    public static final int UNHEALTHY_STATUS_FROM = 400;

    public CheckOutcome {
        Objects.requireNonNull(serviceName, "serviceName");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(checkedAt, "checkedAt");
        if (responseTimeMs < 0 || Double.isNaN(responseTimeMs)) {
            throw new ValidationException("responseTimeMs must be >= 0, got " + responseTimeMs);
        }
        if ((statusCode == null) == (errorMessage == null)) {
            throw new ValidationException(
                    "exactly one of statusCode and errorMessage must be set");
        }
        if (statusCode != null && healthy != (statusCode < UNHEALTHY_STATUS_FROM)) {
            throw new ValidationException(
                    "healthy must be true iff statusCode < " + UNHEALTHY_STATUS_FROM);
        }
        if (errorMessage != null && healthy) {
            throw new ValidationException("a failed probe cannot be healthy");
        }
    }

    /** Outcome of a probe that received an HTTP response. */
    public static CheckOutcome responded(String serviceName, String url, int statusCode,
                                         double responseTimeMs, Instant checkedAt) {
        return new CheckOutcome(serviceName, url, statusCode < UNHEALTHY_STATUS_FROM,
                statusCode, responseTimeMs, null, checkedAt);
    }

    /** Outcome of a probe that got no response (timeout, DNS, refused, TLS, ...). */
    public static CheckOutcome failed(String serviceName, String url, String errorMessage,
                                      double responseTimeMs, Instant checkedAt) {
        return new CheckOutcome(serviceName, url, false, null, responseTimeMs,
                Objects.requireNonNull(errorMessage, "errorMessage"), checkedAt);
    }
}
