package com.statusbridge.statuspage.testing;

import com.statusbridge.statuspage.ComponentGroup;
import com.statusbridge.statuspage.ComponentStatus;
import com.statusbridge.statuspage.ComponentUpdate;
import com.statusbridge.statuspage.Incident;
import com.statusbridge.statuspage.IncidentStatus;
import com.statusbridge.statuspage.NewComponent;
import com.statusbridge.statuspage.NewIncident;
import com.statusbridge.statuspage.PermanentStatusPageException;
import com.statusbridge.statuspage.StatusPageClient;
import com.statusbridge.statuspage.StatusPageComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A status page backend held in memory, for tests of everything that sits on top of
 * {@link StatusPageClient}.
 * <p>
 * Records every call by operation name and lets tests inject failures per operation.
 * Placed in {@code src/main/java} for cross-module test use.
 */
public final class InMemoryStatusPageClient implements StatusPageClient {

    /** An incident plus the update messages posted to it. */
    public record StoredIncident(Incident incident, String message, List<String> updates) {}

    private final Map<Long, StatusPageComponent> components = new LinkedHashMap<>();
    private final Map<Long, ComponentGroup> groups = new LinkedHashMap<>();
    private final Map<Long, StoredIncident> incidents = new LinkedHashMap<>();
    private final Map<String, Deque<RuntimeException>> pendingFailures = new HashMap<>();
    private final Map<String, RuntimeException> permanentFailures = new HashMap<>();
    private final List<String> calls = new ArrayList<>();
    private final AtomicLong componentIds = new AtomicLong(1);
    private final AtomicLong groupIds = new AtomicLong(1);
    private final AtomicLong incidentIds = new AtomicLong(1);

    // ---- test helpers ----

    public synchronized StatusPageComponent seedComponent(NewComponent component) {
        return store(component);
    }

    public synchronized Incident seedIncident(long componentId, IncidentStatus status) {
        Incident incident = new Incident(incidentIds.getAndIncrement(), "seeded", status, componentId);
        incidents.put(incident.id(), new StoredIncident(incident, "", new ArrayList<>()));
        return incident;
    }

    /** The next call of {@code operation} throws {@code failure}; queued failures fire in order. */
    public synchronized InMemoryStatusPageClient failNext(String operation, RuntimeException failure) {
        pendingFailures.computeIfAbsent(operation, k -> new ArrayDeque<>()).add(failure);
        return this;
    }

    /** Every call of {@code operation} throws {@code failure} until {@link #clearFailures()}. */
    public synchronized InMemoryStatusPageClient failAlways(String operation, RuntimeException failure) {
        permanentFailures.put(operation, failure);
        return this;
    }

    public synchronized void clearFailures() {
        pendingFailures.clear();
        permanentFailures.clear();
    }

    public synchronized Optional<StatusPageComponent> component(long id) {
        return Optional.ofNullable(components.get(id));
    }

    public synchronized Optional<StatusPageComponent> componentNamed(String name) {
        return components.values().stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public synchronized List<StatusPageComponent> components() {
        return List.copyOf(components.values());
    }

    public synchronized List<ComponentGroup> groups() {
        return List.copyOf(groups.values());
    }

    public synchronized List<StoredIncident> incidents() {
        return List.copyOf(incidents.values());
    }

    public synchronized List<StoredIncident> incidentsFor(long componentId) {
        return incidents.values().stream()
                .filter(i -> Long.valueOf(componentId).equals(i.incident().componentId()))
                .toList();
    }

    /** Operation names in call order, failed calls included. */
    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }

    public synchronized long callCount(String operation) {
        return calls.stream().filter(operation::equals).count();
    }

    public synchronized void resetCalls() {
        calls.clear();
    }

    // ---- StatusPageClient ----

    @Override
    public synchronized StatusPageComponent getComponent(long componentId) {
        record("getComponent");
        return requireComponent("getComponent", componentId);
    }

    @Override
    public synchronized List<StatusPageComponent> listComponents() {
        record("listComponents");
        return List.copyOf(components.values());
    }

    @Override
    public synchronized StatusPageComponent createComponent(NewComponent component) {
        record("createComponent");
        return store(component);
    }

    @Override
    public synchronized void updateComponentStatus(long componentId, ComponentStatus status) {
        record("updateComponentStatus");
        StatusPageComponent current = requireComponent("updateComponentStatus", componentId);
        components.put(componentId, new StatusPageComponent(current.id(), current.name(), status,
                current.enabled(), current.description(), current.groupId()));
    }

    @Override
    public synchronized void updateComponent(long componentId, ComponentUpdate update) {
        record("updateComponent");
        StatusPageComponent current = requireComponent("updateComponent", componentId);
        components.put(componentId, new StatusPageComponent(
                current.id(),
                current.name(),
                update.status() != null ? update.status() : current.status(),
                update.enabled() != null ? update.enabled() : current.enabled(),
                update.description() != null ? update.description() : current.description(),
                current.groupId()));
    }

    @Override
    public synchronized void deleteComponent(long componentId) {
        record("deleteComponent");
        requireComponent("deleteComponent", componentId);
        components.remove(componentId);
    }

    @Override
    public synchronized List<ComponentGroup> listComponentGroups() {
        record("listComponentGroups");
        return List.copyOf(groups.values());
    }

    @Override
    public synchronized ComponentGroup createComponentGroup(String name) {
        record("createComponentGroup");
        ComponentGroup group = new ComponentGroup(groupIds.getAndIncrement(), name);
        groups.put(group.id(), group);
        return group;
    }

    @Override
    public synchronized void deleteComponentGroup(long groupId) {
        record("deleteComponentGroup");
        if (groups.remove(groupId) == null) {
            throw notFound("deleteComponentGroup");
        }
    }

    @Override
    public synchronized Incident createIncident(NewIncident request) {
        record("createIncident");
        requireComponent("createIncident", request.componentId());
        Incident incident = new Incident(incidentIds.getAndIncrement(), request.name(), request.status(),
                request.componentId());
        incidents.put(incident.id(), new StoredIncident(incident, request.message(), new ArrayList<>()));
        if (request.componentStatus() != null) {
            StatusPageComponent current = components.get(request.componentId());
            components.put(current.id(), new StatusPageComponent(current.id(), current.name(),
                    request.componentStatus(), current.enabled(), current.description(), current.groupId()));
        }
        return incident;
    }

    @Override
    public synchronized void updateIncident(long incidentId, IncidentStatus status) {
        record("updateIncident");
        StoredIncident stored = requireIncident("updateIncident", incidentId);
        Incident old = stored.incident();
        incidents.put(incidentId, new StoredIncident(
                new Incident(old.id(), old.name(), status, old.componentId()), stored.message(), stored.updates()));
    }

    @Override
    public synchronized void createIncidentUpdate(long incidentId, IncidentStatus status, String message) {
        record("createIncidentUpdate");
        requireIncident("createIncidentUpdate", incidentId).updates().add(message);
    }

    @Override
    public synchronized List<Incident> listOpenIncidents() {
        record("listOpenIncidents");
        return incidents.values().stream()
                .map(StoredIncident::incident)
                .filter(i -> i.status().isOpen())
                .toList();
    }

    // ---- internals ----

    private void record(String operation) {
        calls.add(operation);
        Deque<RuntimeException> queued = pendingFailures.get(operation);
        if (queued != null && !queued.isEmpty()) {
            throw queued.poll();
        }
        RuntimeException always = permanentFailures.get(operation);
        if (always != null) {
            throw always;
        }
    }

    private StatusPageComponent store(NewComponent component) {
        StatusPageComponent stored = new StatusPageComponent(componentIds.getAndIncrement(), component.name(),
                component.status(), component.enabled(), component.description(), component.groupId());
        components.put(stored.id(), stored);
        return stored;
    }

    private StatusPageComponent requireComponent(String operation, long id) {
        StatusPageComponent component = components.get(id);
        if (component == null) {
            throw notFound(operation);
        }
        return component;
    }

    private StoredIncident requireIncident(String operation, long id) {
        StoredIncident incident = incidents.get(id);
        if (incident == null) {
            throw notFound(operation);
        }
        return incident;
    }

    private static PermanentStatusPageException notFound(String operation) {
        return new PermanentStatusPageException(operation, 404, "not found", null);
    }
}
