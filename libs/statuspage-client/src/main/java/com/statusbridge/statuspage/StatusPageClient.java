package com.statusbridge.statuspage;

import java.util.List;
import java.util.Optional;

/**
 * Typed access to the status page backend.
 * <p>
 * Every method either returns the backend-confirmed result or throws a
 * {@link StatusPageException}; implementations retry transient failures a bounded number of
 * times before throwing. None of the methods deduplicate: callers must not issue the same
 * create twice.
 */
public interface StatusPageClient {

    StatusPageComponent getComponent(long componentId);

    /** All components, across every page. */
    List<StatusPageComponent> listComponents();

    /**
     * Looks a component up by its exact display name.
     */
    default Optional<StatusPageComponent> findComponentByName(String name) {
        return listComponents().stream()
                .filter(c -> c.name().equals(name))
                .findFirst();
    }

    StatusPageComponent createComponent(NewComponent component);

    void updateComponentStatus(long componentId, ComponentStatus status);

    void updateComponent(long componentId, ComponentUpdate update);

    void deleteComponent(long componentId);

    List<ComponentGroup> listComponentGroups();

    ComponentGroup createComponentGroup(String name);

    void deleteComponentGroup(long groupId);

    Incident createIncident(NewIncident incident);

    void updateIncident(long incidentId, IncidentStatus status);

    /** Appends a visible update message to an incident's timeline. */
    void createIncidentUpdate(long incidentId, IncidentStatus status, String message);

    /** Incidents whose status is anything but {@link IncidentStatus#FIXED}. */
    List<Incident> listOpenIncidents();
}
