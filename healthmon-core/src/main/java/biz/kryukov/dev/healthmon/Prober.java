package biz.kryukov.dev.healthmon;

import java.time.Duration;

/**
 * Performs one health probe against one target.
 *
 * <p>Implementations must be thread-safe and must never throw: every failure is
 * reported as a {@link CheckOutcome} with {@code healthy = false}.</p>
 */
@FunctionalInterface
public interface Prober {

    /**
     * Probes the target once.
     *
     * @param name    service name
     * @param url     target URL
     * @param timeout upper bound for the whole exchange
     * @return probe outcome, never {@code null}
     */
    CheckOutcome probe(String name, String url, Duration timeout);
}
