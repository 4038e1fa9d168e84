package com.statusbridge.statuspage;

import java.util.Arrays;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Human-readable rendering of a target's state, stored as the target component description:
 *
 * <pre>
 * critical: yes
 * InstanceDown,HighLoad,
 * </pre>
 *
 * The second line reads {@code no alerts} when nothing is firing. The bridge keeps the typed
 * state in memory; this text is written for operators and read back only on cold start.
 *
 * @param critical     whether the target forces its services down on its own
 * @param activeAlerts currently firing alert names
 */
public record TargetDescription(boolean critical, SortedSet<String> activeAlerts) {

    private static final String CRITICAL_YES = "critical: yes";
    private static final String CRITICAL_NO = "critical: no";
    private static final String NO_ALERTS = "no alerts";

    public TargetDescription {
        activeAlerts = Collections.unmodifiableSortedSet(
                activeAlerts == null ? new TreeSet<>() : new TreeSet<>(activeAlerts));
    }

    /** Description of a freshly provisioned target. */
    public static TargetDescription initial(boolean critical) {
        return new TargetDescription(critical, null);
    }

    public String format() {
        String alertsLine = activeAlerts.isEmpty() ? NO_ALERTS : String.join(",", activeAlerts) + ",";
        return (critical ? CRITICAL_YES : CRITICAL_NO) + "\n" + alertsLine;
    }

    /**
     * Parses a description written by {@link #format()}. Single-line descriptions (written
     * before the critical flag existed) are read as a non-critical alert list.
     */
    public static TargetDescription parse(String description) {
        if (description == null || description.isBlank()) {
            return new TargetDescription(false, null);
        }
        String[] lines = description.split("\n", 2);
        boolean critical;
        String alertsLine;
        if (lines.length < 2 && lines[0].strip().startsWith("critical:")) {
            critical = CRITICAL_YES.equals(lines[0].strip());
            alertsLine = NO_ALERTS;
        } else if (lines.length < 2) {
            critical = false;
            alertsLine = lines[0];
        } else {
            critical = CRITICAL_YES.equals(lines[0].strip());
            alertsLine = lines[1];
        }
        TreeSet<String> alerts = new TreeSet<>();
        if (!NO_ALERTS.equals(alertsLine.strip())) {
            Arrays.stream(alertsLine.split(","))
                    .map(String::strip)
                    .filter(a -> !a.isEmpty())
                    .forEach(alerts::add);
        }
        return new TargetDescription(critical, alerts);
    }
}
