package com.statusbridge.alertbridge.api;

import com.statusbridge.alertbridge.config.ServiceProperties;
import com.statusbridge.alertbridge.domain.ServiceAggregator;
import com.statusbridge.alertbridge.domain.ServiceSnapshot;
import com.statusbridge.alertbridge.domain.TargetHealth;
import com.statusbridge.alertbridge.domain.TargetSnapshot;
import com.statusbridge.alertbridge.domain.TargetStateStore;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the engine state, for operators.
 */
@RestController
@RequestMapping("/api/v1")
public class BridgeStateController {

    private final ServiceProperties properties;
    private final TargetStateStore targets;
    private final ServiceAggregator services;

    public BridgeStateController(ServiceProperties properties, TargetStateStore targets, ServiceAggregator services) {
        this.properties = properties;
        this.targets = targets;
        this.services = services;
    }

    /** Target as exposed by the API. */
    public record TargetView(
            String instance, List<String> services, Set<String> activeAlerts, boolean critical, TargetHealth health) {

        static TargetView of(TargetSnapshot snapshot) {
            return new TargetView(snapshot.targetInstance(), snapshot.serviceNames(), snapshot.activeAlerts(),
                    snapshot.critical(), snapshot.health());
        }
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description(),
                "status", "running",
                "targets", targets.snapshots().size(),
                "services", services.snapshots().size(),
                "timestamp", Instant.now().toString());
    }

    @GetMapping("/services")
    public List<ServiceSnapshot> services() {
        return services.snapshots();
    }

    @GetMapping("/targets")
    public List<TargetView> targets() {
        return targets.snapshots().stream().map(TargetView::of).toList();
    }
}
