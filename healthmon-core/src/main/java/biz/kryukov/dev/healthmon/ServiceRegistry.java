package biz.kryukov.dev.healthmon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, ordered set of monitored services. Iteration order is the configuration order.
 */
public final class ServiceRegistry implements Iterable<ServiceEntry> {

    private static final ServiceRegistry EMPTY = new ServiceRegistry(List.of());

    private final List<ServiceEntry> entries;

    private ServiceRegistry(List<ServiceEntry> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    /** Returns a registry with no services. */
    public static ServiceRegistry empty() {
        return EMPTY;
    }

    /**
     * Creates a registry from a name → URL map, preserving the map's iteration order.
     */
    public static ServiceRegistry of(Map<String, String> services) {
        Builder builder = builder();
        services.forEach(builder::service);
        return builder.build();
    }

    /** Creates a new builder. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the entries in registry order. */
    public List<ServiceEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Returns the services as an ordered, unmodifiable name → URL map. */
    public Map<String, String> asMap() {
        Map<String, String> result = new LinkedHashMap<>();
        for (ServiceEntry entry : entries) {
            result.put(entry.name(), entry.url());
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public Iterator<ServiceEntry> iterator() {
        return entries.iterator();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    /** Builder for {@link ServiceRegistry}. Rejects duplicate names. */
    public static final class Builder {
        private final List<ServiceEntry> entries = new ArrayList<>();
        private final Set<String> names = new HashSet<>();

        private Builder() {}

        /** Adds a service. */
        public Builder service(String name, String url) {
            return service(new ServiceEntry(name, url));
        }

        /** Adds a service entry. */
        public Builder service(ServiceEntry entry) {
            if (!names.add(entry.name())) {
                throw new ValidationException("duplicate service name: " + entry.name());
            }
            entries.add(entry);
            return this;
        }

        public ServiceRegistry build() {
            if (entries.isEmpty()) {
                return EMPTY;
            }
            return new ServiceRegistry(new ArrayList<>(entries));
        }
    }
}
