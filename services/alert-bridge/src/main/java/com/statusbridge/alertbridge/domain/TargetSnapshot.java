package com.statusbridge.alertbridge.domain;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable state of one target at a given version.
 * <p>
 * A target is identified by its instance together with the services it feeds, as labelled on
 * the alert. The same instance labelled for different services is a different target with its
 * own component; see {@link #key()}.
 *
 * @param targetInstance monitored instance, e.g. {@code 10.0.0.1:9100}
 * @param serviceNames   services the target feeds, in label order
 * @param activeAlerts   names of the alerts currently firing
 * @param critical       sticky critical flag
 * @param version        incremented on every state change, starting at 1
 */
public record TargetSnapshot(
        String targetInstance,
        List<String> serviceNames,
        SortedSet<String> activeAlerts,
        boolean critical,
        long version) {

    public TargetSnapshot {
        Objects.requireNonNull(targetInstance, "targetInstance");
        serviceNames = List.copyOf(serviceNames);
        activeAlerts = Collections.unmodifiableSortedSet(
                activeAlerts == null ? new TreeSet<>() : new TreeSet<>(activeAlerts));
    }

    /**
     * Store key of a target, {@code "<instance> | <service>, <service>"}. It equals the display
     * name of the target's component.
     */
    public static String keyOf(String targetInstance, List<String> serviceNames) {
        return targetInstance + " | " + String.join(", ", serviceNames);
    }

    public String key() {
        return keyOf(targetInstance, serviceNames);
    }

    /** A target that has not seen any alert yet. */
    static TargetSnapshot empty(String targetInstance, List<String> serviceNames) {
        return new TargetSnapshot(targetInstance, serviceNames, null, false, 0);
    }

    public TargetHealth health() {
        return activeAlerts.isEmpty() ? TargetHealth.HEALTHY : TargetHealth.DOWN;
    }

    public boolean isDown() {
        return health() == TargetHealth.DOWN;
    }

    /**
     * Applies an event of this target: firing adds the alert and may raise the critical flag,
     * resolved removes the alert. Returns {@code this} when nothing changed.
     */
    TargetSnapshot apply(AlertEvent event) {
        TreeSet<String> alerts = new TreeSet<>(activeAlerts);
        if (event.firing()) {
            alerts.add(event.alertName());
        } else {
            alerts.remove(event.alertName());
        }
        boolean nextCritical = critical || (event.firing() && event.critical());

        if (critical == nextCritical && activeAlerts.equals(alerts)) {
            return this;
        }
        return new TargetSnapshot(targetInstance, serviceNames, alerts, nextCritical, version + 1);
    }

    /** Equality ignoring the version. */
    public boolean sameState(TargetSnapshot other) {
        return other != null
                && critical == other.critical
                && serviceNames.equals(other.serviceNames)
                && activeAlerts.equals(other.activeAlerts);
    }
}
