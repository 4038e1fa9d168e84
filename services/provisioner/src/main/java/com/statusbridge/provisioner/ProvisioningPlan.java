package com.statusbridge.provisioner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The backend layout a configuration asks for. Pure: building a plan makes no backend call.
 *
 * @param targets          one entry per distinct target component name; a target declared twice
 *                         is critical if either declaration is
 * @param groups           group name to the visible services it holds, both sorted
 * @param unmappedServices services fed by some target but absent from the group mapping
 */
public record ProvisioningPlan(
        List<MonitoredTarget> targets,
        SortedMap<String, SortedSet<String>> groups,
        SortedSet<String> unmappedServices) {

    public ProvisioningPlan {
        targets = List.copyOf(targets);
        groups = Collections.unmodifiableSortedMap(new TreeMap<>(groups));
        unmappedServices = Collections.unmodifiableSortedSet(new TreeSet<>(unmappedServices));
    }

    public static ProvisioningPlan of(List<MonitoredTarget> declared, Map<String, String> serviceToGroup) {
        Map<String, MonitoredTarget> byName = new LinkedHashMap<>();
        for (MonitoredTarget target : declared) {
            byName.merge(target.componentName().format(), target, (a, b) ->
                    new MonitoredTarget(a.job(), a.instance(), a.serviceNames(), a.critical() || b.critical()));
        }
        SortedMap<String, SortedSet<String>> groups = new TreeMap<>();
        SortedSet<String> unmapped = new TreeSet<>();
        for (MonitoredTarget target : byName.values()) {
            for (String service : target.serviceNames()) {
                String group = serviceToGroup.get(service);
                if (group == null) {
                    unmapped.add(service);
                } else {
                    groups.computeIfAbsent(group, g -> new TreeSet<>()).add(service);
                }
            }
        }
        return new ProvisioningPlan(new ArrayList<>(byName.values()), groups, unmapped);
    }

    public boolean isEmpty() {
        return targets.isEmpty();
    }

    /** Names of every component the plan keeps: target components plus mapped services. */
    public Set<String> componentNames() {
        Set<String> names = new HashSet<>();
        targets.forEach(t -> names.add(t.componentName().format()));
        groups.values().forEach(names::addAll);
        return names;
    }
}
