package com.statusbridge.alertbridge.domain;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the health of each visible service from its member targets.
 * <p>
 * The aggregate is a pure function of the member snapshots ({@link #aggregate(Collection)}),
 * so recomputing after a restart or a missed event converges on the same value. Recomputations
 * of one service are serialized by its lock; target snapshots are read without locking them.
 */
public final class ServiceAggregator {

    private static final Logger log = LoggerFactory.getLogger(ServiceAggregator.class);

    private final TargetStateStore targets;
    private final ConcurrentMap<String, ServiceState> services = new ConcurrentHashMap<>();

    public ServiceAggregator(TargetStateStore targets) {
        this.targets = targets;
    }

    /**
     * Aggregate health of a member set:
     * <ul>
     *   <li>any critical member down → {@link ServiceHealth#DOWN}</li>
     *   <li>no members, or all members healthy → {@link ServiceHealth#HEALTHY}</li>
     *   <li>all members down → {@link ServiceHealth#DOWN}</li>
     *   <li>otherwise → {@link ServiceHealth#PARTIAL}</li>
     * </ul>
     */
    public static ServiceHealth aggregate(Collection<TargetSnapshot> members) {
        boolean anyDown = false;
        boolean anyHealthy = false;
        for (TargetSnapshot member : members) {
            if (member.isDown()) {
                if (member.critical()) {
                    return ServiceHealth.DOWN;
                }
                anyDown = true;
            } else {
                anyHealthy = true;
            }
        }
        if (!anyDown) {
            return ServiceHealth.HEALTHY;
        }
        return anyHealthy ? ServiceHealth.PARTIAL : ServiceHealth.DOWN;
    }

    /**
     * Recomputes the aggregate of one service from the current member snapshots.
     */
    public ServiceTransition recompute(String serviceName) {
        ServiceState state = state(serviceName);
        ServiceTransition transition;
        state.lock.lock();
        try {
            List<TargetSnapshot> members = targets.membersOf(serviceName);
            ServiceHealth next = aggregate(members);
            transition = new ServiceTransition(serviceName, state.aggregateHealth, next);
            state.aggregateHealth = next;
            state.memberTargets = members.stream().map(TargetSnapshot::key).toList();
        } finally {
            state.lock.unlock();
        }
        if (transition.changed()) {
            log.info("Service {} aggregate health {} -> {}", serviceName, transition.previous(), transition.current());
        }
        return transition;
    }

    /**
     * Seeds what the backend currently shows for a service and recomputes its aggregate from
     * the member targets, which must be restored first. Skipped when the service already
     * recorded a backend-confirmed change or is being synced, since that state is newer.
     *
     * @return true if the backend view was installed
     */
    public boolean restore(String serviceName, ServiceHealth publishedHealth, Long openIncidentId) {
        ServiceState state = state(serviceName);
        state.lock.lock();
        try {
            if (state.confirmed || state.syncing) {
                return false;
            }
            state.publishedHealth = publishedHealth;
            state.openIncidentId = openIncidentId;
            List<TargetSnapshot> members = targets.membersOf(serviceName);
            state.aggregateHealth = aggregate(members);
            state.memberTargets = members.stream().map(TargetSnapshot::key).toList();
            return true;
        } finally {
            state.lock.unlock();
        }
    }

    public ServiceSnapshot snapshot(String serviceName) {
        ServiceState state = state(serviceName);
        state.lock.lock();
        try {
            return state.snapshot();
        } finally {
            state.lock.unlock();
        }
    }

    public List<ServiceSnapshot> snapshots() {
        return services.keySet().stream()
                .sorted(Comparator.naturalOrder())
                .map(this::snapshot)
                .toList();
    }

    ServiceState state(String serviceName) {
        return services.computeIfAbsent(serviceName, ServiceState::new);
    }
}
