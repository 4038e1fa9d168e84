package com.statusbridge.alertbridge.domain;

import com.statusbridge.alertbridge.domain.ports.GatewayException;
import com.statusbridge.alertbridge.domain.ports.StatusPageGateway;
import com.statusbridge.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the backend in line with each service's aggregate health: component status and at
 * most one open incident per service.
 * <p>
 * Rules, applied one step at a time until nothing is pending:
 * <ol>
 *   <li>aggregate DOWN and no confirmed incident: open one (this also marks the component down)</li>
 *   <li>aggregate HEALTHY and an incident is open: resolve it</li>
 *   <li>published status differs from the aggregate: publish the aggregate</li>
 * </ol>
 * PARTIAL never opens or resolves an incident, so DOWN → PARTIAL → DOWN keeps the same one.
 * <p>
 * Each step is planned under the service lock, executed without it, and recorded under the
 * lock only when the backend confirmed it. A failed step leaves the service pending; the next
 * trigger retries it. While one thread is syncing a service, other triggers return immediately
 * and the syncing thread picks up their changes when it re-plans.
 */
public final class IncidentLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(IncidentLifecycleManager.class);
    private static final Logger transitions = LoggerFactory.getLogger("statusbridge.transitions");

    private final ServiceAggregator aggregator;
    private final StatusPageGateway gateway;
    private final Counter opened;
    private final Counter resolved;

    public IncidentLifecycleManager(ServiceAggregator aggregator, StatusPageGateway gateway, MetricFactory metrics) {
        this.aggregator = aggregator;
        this.gateway = gateway;
        this.opened = metrics.counter("statusbridge.incidents.opened", "Incidents opened on the status page");
        this.resolved = metrics.counter("statusbridge.incidents.resolved", "Incidents resolved on the status page");
    }

    private enum Action { OPEN_INCIDENT, RESOLVE_INCIDENT, PUBLISH_STATUS }

    private record Step(Action action, ServiceHealth target, ServiceHealth published, Long incidentId) {}

    /**
     * Runs pending steps for a service until it is in sync or a step fails.
     *
     * @return true if the service ended in sync with the backend
     */
    public boolean reconcile(String serviceName) {
        ServiceState state = aggregator.state(serviceName);
        while (true) {
            Step step;
            state.lock.lock();
            try {
                if (state.syncing) {
                    return false;
                }
                step = plan(state);
                if (step == null) {
                    return true;
                }
                state.syncing = true;
            } finally {
                state.lock.unlock();
            }

            Long incidentId = null;
            boolean confirmed = false;
            try {
                incidentId = execute(serviceName, step);
                confirmed = true;
            } catch (GatewayException e) {
                if (e.isTransient()) {
                    log.warn("Could not {} for service {}, will retry on next event: {}",
                            describe(step.action()), serviceName, e.getMessage());
                } else {
                    log.error("Could not {} for service {}: {}", describe(step.action()), serviceName, e.getMessage());
                }
            } finally {
                state.lock.lock();
                try {
                    state.syncing = false;
                    if (confirmed) {
                        record(state, step, incidentId);
                    }
                } finally {
                    state.lock.unlock();
                }
            }
            if (!confirmed) {
                return false;
            }
        }
    }

    /** Whether the service has a difference with the backend still to push. */
    public boolean hasPendingSync(String serviceName) {
        ServiceState state = aggregator.state(serviceName);
        state.lock.lock();
        try {
            return state.hasPendingSync();
        } finally {
            state.lock.unlock();
        }
    }

    private static Step plan(ServiceState state) {
        if (state.aggregateHealth == ServiceHealth.DOWN && state.openIncidentId == null) {
            return new Step(Action.OPEN_INCIDENT, ServiceHealth.DOWN, state.publishedHealth, null);
        }
        if (state.aggregateHealth == ServiceHealth.HEALTHY && state.openIncidentId != null) {
            return new Step(Action.RESOLVE_INCIDENT, ServiceHealth.HEALTHY, state.publishedHealth, state.openIncidentId);
        }
        if (state.aggregateHealth != state.publishedHealth) {
            return new Step(Action.PUBLISH_STATUS, state.aggregateHealth, state.publishedHealth, null);
        }
        return null;
    }

    private Long execute(String serviceName, Step step) {
        return switch (step.action()) {
            case OPEN_INCIDENT -> gateway.openIncident(serviceName);
            case RESOLVE_INCIDENT -> {
                gateway.resolveIncident(serviceName, step.incidentId());
                yield null;
            }
            case PUBLISH_STATUS -> {
                gateway.publishServiceHealth(serviceName, step.target());
                yield null;
            }
        };
    }

    private void record(ServiceState state, Step step, Long incidentId) {
        state.confirmed = true;
        switch (step.action()) {
            case OPEN_INCIDENT -> {
                state.openIncidentId = incidentId;
                state.publishedHealth = ServiceHealth.DOWN;
                opened.increment();
                log.info("Opened incident {} for service {}", incidentId, state.name);
                logTransition(state.name, step.published(), ServiceHealth.DOWN);
            }
            case RESOLVE_INCIDENT -> {
                state.openIncidentId = null;
                resolved.increment();
                log.info("Resolved incident {} for service {}", step.incidentId(), state.name);
            }
            case PUBLISH_STATUS -> {
                state.publishedHealth = step.target();
                logTransition(state.name, step.published(), step.target());
            }
        }
    }

    private static void logTransition(String serviceName, ServiceHealth old, ServiceHealth current) {
        if (old != current) {
            transitions.info("component=\"{}\" kind=service old={} new={}", serviceName, old, current);
        }
    }

    private static String describe(Action action) {
        return switch (action) {
            case OPEN_INCIDENT -> "open incident";
            case RESOLVE_INCIDENT -> "resolve incident";
            case PUBLISH_STATUS -> "publish status";
        };
    }
}
