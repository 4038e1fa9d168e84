package com.statusbridge.statuspage;

/**
 * Request body for creating a component.
 */
public record NewComponent(
        String name,
        ComponentStatus status,
        boolean enabled,
        String description,
        Long groupId) {

    /** A user-facing component assigned to a group. */
    public static NewComponent visible(String name, Long groupId) {
        return new NewComponent(name, ComponentStatus.OPERATIONAL, true, null, groupId);
    }

    /** A hidden per-target component carrying its typed state in the description. */
    public static NewComponent target(TargetComponentName name, TargetDescription description) {
        return new NewComponent(name.format(), ComponentStatus.OPERATIONAL, false, description.format(), null);
    }
}
