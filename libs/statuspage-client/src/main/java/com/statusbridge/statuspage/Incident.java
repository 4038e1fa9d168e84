package com.statusbridge.statuspage;

/**
 * An incident as stored by the backend.
 *
 * @param id          backend identifier
 * @param name        incident title
 * @param status      current incident status
 * @param componentId component the incident is attached to (nullable)
 */
public record Incident(long id, String name, IncidentStatus status, Long componentId) {}
