package com.statusbridge.alertbridge.domain;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable per-service record. Every field is guarded by {@link #lock}.
 * <p>
 * {@code aggregateHealth} is only ever computed from the member targets, by
 * {@link ServiceAggregator#recompute(String)} or {@link ServiceAggregator#restore}.
 * {@code publishedHealth} and {@code openIncidentId} are written by
 * {@link IncidentLifecycleManager} after the backend confirmed a change, which also sets
 * {@code confirmed}; before that they may be seeded once from the backend on cold start.
 */
final class ServiceState {

    final ReentrantLock lock = new ReentrantLock();
    final String name;

    ServiceHealth aggregateHealth = ServiceHealth.HEALTHY;
    ServiceHealth publishedHealth = ServiceHealth.HEALTHY;
    Long openIncidentId;
    List<String> memberTargets = List.of();
    boolean syncing;
    boolean confirmed;

    ServiceState(String name) {
        this.name = name;
    }

    /** Whether the backend lags behind the aggregate. Caller holds the lock. */
    boolean hasPendingSync() {
        return aggregateHealth != publishedHealth
                || (aggregateHealth == ServiceHealth.DOWN && openIncidentId == null)
                || (aggregateHealth == ServiceHealth.HEALTHY && openIncidentId != null);
    }

    ServiceSnapshot snapshot() {
        return new ServiceSnapshot(name, aggregateHealth, publishedHealth, openIncidentId, memberTargets);
    }
}
