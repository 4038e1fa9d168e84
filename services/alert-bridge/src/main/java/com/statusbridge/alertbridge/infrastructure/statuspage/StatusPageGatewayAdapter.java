package com.statusbridge.alertbridge.infrastructure.statuspage;

import com.statusbridge.alertbridge.config.IncidentProperties;
import com.statusbridge.alertbridge.domain.ServiceHealth;
import com.statusbridge.alertbridge.domain.TargetSnapshot;
import com.statusbridge.alertbridge.domain.ports.GatewayException;
import com.statusbridge.alertbridge.domain.ports.StatusPageGateway;
import com.statusbridge.observability.MetricFactory;
import com.statusbridge.statuspage.ComponentStatus;
import com.statusbridge.statuspage.ComponentUpdate;
import com.statusbridge.statuspage.IncidentStatus;
import com.statusbridge.statuspage.NewIncident;
import com.statusbridge.statuspage.PermanentStatusPageException;
import com.statusbridge.statuspage.StatusPageClient;
import com.statusbridge.statuspage.StatusPageException;
import com.statusbridge.statuspage.TargetComponentName;
import com.statusbridge.statuspage.TargetDescription;
import java.util.function.LongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StatusPageGateway} on top of {@link StatusPageClient}.
 * <p>
 * Resolves components by display name through the {@link ComponentDirectory}, translates
 * client failures into {@link GatewayException} and counts them as
 * {@code statusbridge.statuspage.failures{operation,kind}}. A 404 on a component evicts its
 * cached id so the next attempt resolves the name again.
 */
public class StatusPageGatewayAdapter implements StatusPageGateway {

    private static final Logger log = LoggerFactory.getLogger(StatusPageGatewayAdapter.class);

    private final StatusPageClient client;
    private final ComponentDirectory directory;
    private final IncidentProperties incidents;
    private final MetricFactory metrics;

    public StatusPageGatewayAdapter(
            StatusPageClient client, ComponentDirectory directory, IncidentProperties incidents, MetricFactory metrics) {
        this.client = client;
        this.directory = directory;
        this.incidents = incidents;
        this.metrics = metrics;
    }

    @Override
    public void publishServiceHealth(String serviceName, ServiceHealth health) {
        ComponentStatus status = ComponentStatusMapper.toComponentStatus(health);
        onComponent("publishServiceHealth", serviceName, id -> {
            client.updateComponentStatus(id, status);
            return null;
        });
    }

    @Override
    public void publishTargetState(TargetSnapshot snapshot) {
        String name = new TargetComponentName(snapshot.targetInstance(), snapshot.serviceNames()).format();
        ComponentUpdate update = new ComponentUpdate(
                ComponentStatusMapper.toComponentStatus(snapshot.health()),
                new TargetDescription(snapshot.critical(), snapshot.activeAlerts()).format(),
                null);
        onComponent("publishTargetState", name, id -> {
            client.updateComponent(id, update);
            return null;
        });
    }

    @Override
    public long openIncident(String serviceName) {
        return onComponent("openIncident", serviceName, id -> client.createIncident(new NewIncident(
                id,
                incidents.incidentName(serviceName),
                incidents.message(),
                IncidentStatus.INVESTIGATING,
                ComponentStatus.MAJOR_OUTAGE)).id());
    }

    @Override
    public void resolveIncident(String serviceName, long incidentId) {
        try {
            client.createIncidentUpdate(incidentId, IncidentStatus.FIXED, incidents.resolvedMessage());
            client.updateIncident(incidentId, IncidentStatus.FIXED);
        } catch (PermanentStatusPageException e) {
            if (e.isNotFound()) {
                log.warn("Incident {} of service {} no longer exists, treating it as resolved", incidentId, serviceName);
                return;
            }
            throw failure("resolveIncident", e);
        } catch (StatusPageException e) {
            throw failure("resolveIncident", e);
        }
    }

    private <T> T onComponent(String operation, String componentName, LongFunction<T> call) {
        long id;
        try {
            id = directory.resolve(componentName).orElseThrow(() -> unknownComponent(operation, componentName));
        } catch (StatusPageException e) {
            throw failure(operation, e);
        }
        try {
            return call.apply(id);
        } catch (StatusPageException e) {
            if (e instanceof PermanentStatusPageException permanent && permanent.isNotFound()) {
                directory.evict(componentName);
            }
            throw failure(operation, e);
        }
    }

    private GatewayException unknownComponent(String operation, String componentName) {
        metrics.counter("statusbridge.statuspage.failures", "Failed status page calls",
                "operation", operation, "kind", "permanent").increment();
        return new GatewayException(operation, false, "No status page component named \"" + componentName + "\"", null);
    }

    private GatewayException failure(String operation, StatusPageException e) {
        String kind = e.isTransient() ? "transient" : "permanent";
        metrics.counter("statusbridge.statuspage.failures", "Failed status page calls",
                "operation", operation, "kind", kind).increment();
        return new GatewayException(operation, e.isTransient(), e.getMessage(), e);
    }
}
