package com.statusbridge.provisioner;

import com.statusbridge.statuspage.ComponentGroup;
import com.statusbridge.statuspage.NewComponent;
import com.statusbridge.statuspage.StatusPageClient;
import com.statusbridge.statuspage.StatusPageComponent;
import com.statusbridge.statuspage.StatusPageException;
import com.statusbridge.statuspage.TargetDescription;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the backend in line with a {@link ProvisioningPlan}.
 * <p>
 * Runs are idempotent: existing components and groups are matched by name and left alone, so
 * a second {@link ProvisioningMode#SYNC} run against the same plan creates nothing. A failed
 * create or delete is logged and recorded in the report and the run carries on; a failed
 * listing aborts the run with the {@link StatusPageException}.
 */
public class Provisioner {

    private static final Logger log = LoggerFactory.getLogger(Provisioner.class);

    private final StatusPageClient client;
    private final Duration delay;

    /**
     * @param delay pause after every create or delete call, for backends that rate-limit writes
     */
    public Provisioner(StatusPageClient client, Duration delay) {
        this.client = client;
        this.delay = delay == null ? Duration.ZERO : delay;
    }

    public ProvisioningReport run(ProvisioningPlan plan, ProvisioningMode mode) {
        ProvisioningReport report = new ProvisioningReport();
        if (mode == ProvisioningMode.DELETE_ALL) {
            deleteComponents(Set.of(), report);
            deleteGroups(Set.of(), report);
        } else if (mode == ProvisioningMode.RESET) {
            deleteComponents(plan.componentNames(), report);
            deleteGroups(plan.groups().keySet(), report);
        }
        if (mode.creates()) {
            createTargetComponents(plan, report);
            Map<String, Long> groupIds = createGroups(plan, report);
            createServiceComponents(plan, groupIds, report);
        }
        log.info("Provisioning ({}) finished: {}", mode, report);
        return report;
    }

    private void deleteComponents(Set<String> keep, ProvisioningReport report) {
        for (StatusPageComponent component : client.listComponents()) {
            if (keep.contains(component.name())) {
                continue;
            }
            try {
                client.deleteComponent(component.id());
                report.componentDeleted();
                log.info("Deleted component '{}' (id {})", component.name(), component.id());
            } catch (StatusPageException e) {
                report.failed("delete component " + component.name());
                log.error("Failed to delete component '{}' (id {}): {}", component.name(), component.id(),
                        e.getMessage());
            }
            pause();
        }
    }

    private void deleteGroups(Set<String> keep, ProvisioningReport report) {
        for (ComponentGroup group : client.listComponentGroups()) {
            if (keep.contains(group.name())) {
                continue;
            }
            try {
                client.deleteComponentGroup(group.id());
                report.groupDeleted();
                log.info("Deleted component group '{}' (id {})", group.name(), group.id());
            } catch (StatusPageException e) {
                report.failed("delete group " + group.name());
                log.error("Failed to delete component group '{}' (id {}): {}", group.name(), group.id(),
                        e.getMessage());
            }
            pause();
        }
    }

    private void createTargetComponents(ProvisioningPlan plan, ProvisioningReport report) {
        Map<String, StatusPageComponent> existing = componentsByName();
        for (MonitoredTarget target : plan.targets()) {
            String name = target.componentName().format();
            if (existing.containsKey(name)) {
                report.leftUnchanged();
                log.debug("Target component '{}' already exists", name);
                continue;
            }
            try {
                StatusPageComponent created = client.createComponent(
                        NewComponent.target(target.componentName(), TargetDescription.initial(target.critical())));
                report.targetComponentCreated();
                log.info("Created target component '{}'{} (id {})", name,
                        target.critical() ? " [critical]" : "", created.id());
            } catch (StatusPageException e) {
                report.failed("create target component " + name);
                log.error("Failed to create target component '{}': {}", name, e.getMessage());
            }
            pause();
        }
    }

    private Map<String, Long> createGroups(ProvisioningPlan plan, ProvisioningReport report) {
        Map<String, Long> groupIds = new HashMap<>();
        for (ComponentGroup group : client.listComponentGroups()) {
            groupIds.putIfAbsent(group.name(), group.id());
        }
        for (String groupName : plan.groups().keySet()) {
            if (groupIds.containsKey(groupName)) {
                report.leftUnchanged();
                continue;
            }
            try {
                ComponentGroup created = client.createComponentGroup(groupName);
                groupIds.put(groupName, created.id());
                report.groupCreated();
                log.info("Created component group '{}' (id {})", groupName, created.id());
            } catch (StatusPageException e) {
                report.failed("create group " + groupName);
                log.error("Failed to create component group '{}': {}", groupName, e.getMessage());
            }
            pause();
        }
        return groupIds;
    }

    private void createServiceComponents(ProvisioningPlan plan, Map<String, Long> groupIds,
                                         ProvisioningReport report) {
        for (String service : plan.unmappedServices()) {
            log.warn("Skipping service '{}': no group mapping", service);
        }
        Map<String, StatusPageComponent> existing = componentsByName();
        for (Map.Entry<String, SortedSet<String>> group : plan.groups().entrySet()) {
            Long groupId = groupIds.get(group.getKey());
            if (groupId == null) {
                log.warn("Skipping services {}: group '{}' was not created", group.getValue(), group.getKey());
                continue;
            }
            for (String service : group.getValue()) {
                StatusPageComponent current = existing.get(service);
                if (current != null) {
                    report.leftUnchanged();
                    if (!groupId.equals(current.groupId())) {
                        log.warn("Service component '{}' exists outside group '{}'; leaving it in place",
                                service, group.getKey());
                    }
                    continue;
                }
                try {
                    StatusPageComponent created = client.createComponent(NewComponent.visible(service, groupId));
                    report.serviceComponentCreated();
                    log.info("Created service component '{}' in '{}' (id {})", service, group.getKey(), created.id());
                } catch (StatusPageException e) {
                    report.failed("create service component " + service);
                    log.error("Failed to create service component '{}': {}", service, e.getMessage());
                }
                pause();
            }
        }
    }

    private Map<String, StatusPageComponent> componentsByName() {
        List<StatusPageComponent> components = client.listComponents();
        Map<String, StatusPageComponent> byName = new HashMap<>();
        components.forEach(c -> byName.putIfAbsent(c.name(), c));
        return byName;
    }

    private void pause() {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Provisioning interrupted", e);
        }
    }
}
