package com.statusbridge.statuspage;

/**
 * Request body for opening an incident against a component.
 *
 * @param componentId     affected component
 * @param name            incident title
 * @param message         first incident message
 * @param status          initial incident status
 * @param componentStatus status the backend should set on the component at the same time
 */
public record NewIncident(
        long componentId,
        String name,
        String message,
        IncidentStatus status,
        ComponentStatus componentStatus) {}
