package com.statusbridge.alertbridge.infrastructure.statuspage;

import com.statusbridge.alertbridge.domain.AlertProcessor;
import com.statusbridge.alertbridge.domain.ServiceAggregator;
import com.statusbridge.alertbridge.domain.TargetSnapshot;
import com.statusbridge.alertbridge.domain.TargetStateStore;
import com.statusbridge.statuspage.Incident;
import com.statusbridge.statuspage.StatusPageClient;
import com.statusbridge.statuspage.StatusPageComponent;
import com.statusbridge.statuspage.StatusPageException;
import com.statusbridge.statuspage.TargetComponentName;
import com.statusbridge.statuspage.TargetDescription;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds engine state from what the backend currently shows.
 * <p>
 * Each target component ({@code "<instance> | <services>"}) gives back one target's alerts
 * and critical flag from its description. Visible components of those services give back the
 * last published status, and the newest open incident attached to each gives back the open
 * incident id. Afterwards every service is recomputed and drift is pushed to the backend.
 * <p>
 * Webhooks may already be arriving while this runs. Targets and services that changed since
 * startup keep their live state and are not overwritten.
 */
public class StateRehydrator {

    private static final Logger log = LoggerFactory.getLogger(StateRehydrator.class);

    private final StatusPageClient client;
    private final ComponentDirectory directory;
    private final TargetStateStore store;
    private final ServiceAggregator aggregator;
    private final AlertProcessor processor;

    public StateRehydrator(
            StatusPageClient client,
            ComponentDirectory directory,
            TargetStateStore store,
            ServiceAggregator aggregator,
            AlertProcessor processor) {
        this.client = client;
        this.directory = directory;
        this.store = store;
        this.aggregator = aggregator;
        this.processor = processor;
    }

    /** Counts of what was restored. */
    public record Result(int targets, int services, int openIncidents) {}

    /**
     * Reads the backend and restores state. Failures are logged and leave the engine empty; it
     * then fills up from incoming alerts.
     */
    public Optional<Result> rehydrate() {
        List<StatusPageComponent> components;
        List<Incident> openIncidents;
        try {
            components = client.listComponents();
            openIncidents = client.listOpenIncidents();
        } catch (StatusPageException e) {
            log.warn("Could not read status page state, starting empty: {}", e.getMessage());
            return Optional.empty();
        }
        directory.load(components);

        Set<String> services = new LinkedHashSet<>();
        int targets = 0;
        for (StatusPageComponent component : components) {
            Optional<TargetComponentName> name = TargetComponentName.parse(component.name());
            if (name.isEmpty()) {
                continue;
            }
            TargetDescription description = TargetDescription.parse(component.description());
            TargetSnapshot snapshot = new TargetSnapshot(
                    name.get().instance(),
                    name.get().serviceNames(),
                    description.activeAlerts(),
                    description.critical(),
                    1);
            services.addAll(name.get().serviceNames());
            if (store.restore(snapshot, ComponentStatusMapper.toTargetHealth(component.status()))) {
                targets++;
            } else {
                log.info("Keeping live state of target {} over the status page copy", snapshot.key());
            }
        }

        Map<Long, Incident> newestIncidentByComponent = new HashMap<>();
        for (Incident incident : openIncidents) {
            if (incident.componentId() != null) {
                newestIncidentByComponent.merge(incident.componentId(), incident,
                        (a, b) -> a.id() >= b.id() ? a : b);
            }
        }

        int restoredServices = 0;
        int restoredIncidents = 0;
        for (StatusPageComponent component : components) {
            if (!services.contains(component.name())) {
                continue;
            }
            Incident incident = newestIncidentByComponent.get(component.id());
            boolean restored = aggregator.restore(component.name(),
                    ComponentStatusMapper.toServiceHealth(component.status()),
                    incident != null ? incident.id() : null);
            if (!restored) {
                log.info("Keeping live state of service {} over the status page copy", component.name());
                continue;
            }
            restoredServices++;
            if (incident != null) {
                restoredIncidents++;
            }
        }

        log.info("Rehydrated {} targets, {} services and {} open incidents from the status page",
                targets, restoredServices, restoredIncidents);
        processor.resyncAll();
        return Optional.of(new Result(targets, restoredServices, restoredIncidents));
    }
}
