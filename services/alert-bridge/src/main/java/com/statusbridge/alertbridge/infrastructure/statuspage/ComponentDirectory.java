package com.statusbridge.alertbridge.infrastructure.statuspage;

import com.statusbridge.statuspage.StatusPageClient;
import com.statusbridge.statuspage.StatusPageComponent;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache of component display name to backend id.
 * <p>
 * A miss reloads the full component listing once; names still missing after that are
 * reported as unknown. Ids the backend no longer knows are evicted by the caller.
 * <p>
 * The cache is an immutable map swapped whole, so readers never see a listing half loaded.
 */
public class ComponentDirectory {

    private static final Logger log = LoggerFactory.getLogger(ComponentDirectory.class);

    private final StatusPageClient client;
    private volatile Map<String, Long> idsByName = Map.of();

    public ComponentDirectory(StatusPageClient client) {
        this.client = client;
    }

    /**
     * Resolves a component id, reloading the listing on a cache miss.
     *
     * @throws com.statusbridge.statuspage.StatusPageException if the listing fails
     */
    public Optional<Long> resolve(String componentName) {
        Long cached = idsByName.get(componentName);
        if (cached != null) {
            return Optional.of(cached);
        }
        load(client.listComponents());
        Optional<Long> resolved = Optional.ofNullable(idsByName.get(componentName));
        if (resolved.isEmpty()) {
            log.error("No status page component named \"{}\"", componentName);
        }
        return resolved;
    }

    /** Replaces the cache content with the given listing. */
    public void load(Collection<StatusPageComponent> components) {
        Map<String, Long> loaded = new HashMap<>();
        for (StatusPageComponent component : components) {
            Long previous = loaded.putIfAbsent(component.name(), component.id());
            if (previous != null && previous != component.id()) {
                log.warn("Duplicate component name \"{}\" (ids {} and {}), using {}",
                        component.name(), previous, component.id(), previous);
            }
        }
        synchronized (this) {
            idsByName = Map.copyOf(loaded);
        }
        log.debug("Loaded {} component ids", loaded.size());
    }

    public synchronized void evict(String componentName) {
        if (!idsByName.containsKey(componentName)) {
            return;
        }
        Map<String, Long> remaining = new HashMap<>(idsByName);
        remaining.remove(componentName);
        idsByName = Map.copyOf(remaining);
        log.info("Evicted component \"{}\" from directory", componentName);
    }

    public int size() {
        return idsByName.size();
    }
}
