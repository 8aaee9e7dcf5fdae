package biz.kryukov.dev.healthmon;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Outcomes of one refresh cycle, one per service in registry order. Immutable.
 *
 * @param results    outcomes in registry order
 * @param producedAt time the batch was produced
 */
public record ResultBatch(List<CheckOutcome> results, Instant producedAt) {

    public ResultBatch {
        results = List.copyOf(results);
        Objects.requireNonNull(producedAt, "producedAt");
        Set<String> names = new HashSet<>();
        for (CheckOutcome outcome : results) {
            if (!names.add(outcome.serviceName())) {
                throw new ValidationException(
                        "duplicate outcome for service " + outcome.serviceName());
            }
        }
    }

    /** Returns an empty batch. */
    public static ResultBatch empty(Instant producedAt) {
        return new ResultBatch(List.of(), producedAt);
    }

    /** Returns the same outcomes stamped with another production time. */
    public ResultBatch withProducedAt(Instant instant) {
        return new ResultBatch(results, instant);
    }

    public int total() {
        return results.size();
    }

    public int healthyCount() {
        int healthy = 0;
        for (CheckOutcome outcome : results) {
            if (outcome.healthy()) {
                healthy++;
            }
        }
        return healthy;
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
