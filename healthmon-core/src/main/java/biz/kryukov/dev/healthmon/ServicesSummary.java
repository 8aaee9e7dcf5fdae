package biz.kryukov.dev.healthmon;

import java.util.List;

/**
 * Structured view of a batch: all outcomes plus healthy/unhealthy counts.
 *
 * @param services  outcomes in registry order
 * @param total     number of services
 * @param healthy   number of healthy services
 * @param unhealthy {@code total - healthy}
 */
public record ServicesSummary(List<CheckOutcome> services, int total, int healthy, int unhealthy) {

    public ServicesSummary {
        services = List.copyOf(services);
    }

    /** Builds the structured view of a batch. */
    public static ServicesSummary of(ResultBatch batch) {
        int total = batch.total();
        int healthy = batch.healthyCount();
        return new ServicesSummary(batch.results(), total, healthy, total - healthy);
    }
}
