package com.statusbridge.alertbridge.domain;

import java.util.List;

/**
 * Read-only view of a service.
 *
 * @param name            visible service name
 * @param aggregateHealth health computed from the member targets
 * @param publishedHealth health the backend component was last confirmed to show
 * @param openIncidentId  backend id of the open incident, null if none
 * @param memberTargets   keys of the member targets, {@code "<instance> | <services>"}
 */
public record ServiceSnapshot(
        String name,
        ServiceHealth aggregateHealth,
        ServiceHealth publishedHealth,
        Long openIncidentId,
        List<String> memberTargets) {}
