package com.statusbridge.alertbridge.domain;

import java.util.List;

/**
 * Result of applying one event to a target.
 *
 * @param previous state before the event, null if the target was unknown
 * @param current  state after the event
 */
public record TargetUpdate(TargetSnapshot previous, TargetSnapshot current) {

    public boolean changed() {
        return !current.sameState(previous);
    }

    /** An unknown target counts as healthy. */
    public boolean healthChanged() {
        TargetHealth before = previous == null ? TargetHealth.HEALTHY : previous.health();
        return before != current.health();
    }

    public boolean criticalChanged() {
        return previous != null && previous.critical() != current.critical();
    }

    /** True for a target seen for the first time, which joins its services. */
    public boolean membershipChanged() {
        return previous == null;
    }

    /** Whether the services of this target need their aggregate recomputed. */
    public boolean affectsAggregate() {
        return healthChanged() || criticalChanged() || membershipChanged();
    }

    public List<String> serviceNames() {
        return current.serviceNames();
    }
}
