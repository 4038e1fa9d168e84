package com.statusbridge.alertbridge.domain.ports;

import com.statusbridge.alertbridge.domain.ServiceHealth;
import com.statusbridge.alertbridge.domain.TargetSnapshot;

/**
 * Outbound port to the status page. Components are addressed by display name; the adapter
 * resolves names to backend ids.
 * <p>
 * Every method either completes with the backend having accepted the change or throws
 * {@link GatewayException}. Implementations must not be called while a domain lock is held.
 */
public interface StatusPageGateway {

    /** Sets the status of the visible component of a service. */
    void publishServiceHealth(String serviceName, ServiceHealth health);

    /** Mirrors a target's state to its hidden component (status and description). */
    void publishTargetState(TargetSnapshot snapshot);

    /**
     * Opens an outage incident for a service, also marking its component as down.
     *
     * @return backend id of the new incident
     */
    long openIncident(String serviceName);

    /** Marks an incident as fixed. */
    void resolveIncident(String serviceName, long incidentId);
}
