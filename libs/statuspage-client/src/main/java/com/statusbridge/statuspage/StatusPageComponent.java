package com.statusbridge.statuspage;

/**
 * A component record as stored by the backend.
 *
 * @param id          backend identifier
 * @param name        display name (visible components use the service name, target components
 *                    use {@link TargetComponentName#format()})
 * @param status      current status
 * @param enabled     true for visible components, false for target components
 * @param description free text; target components carry a {@link TargetDescription}
 * @param groupId     owning component group, null when ungrouped
 */
public record StatusPageComponent(
        long id,
        String name,
        ComponentStatus status,
        boolean enabled,
        String description,
        Long groupId) {

    public StatusPageComponent {
        if (name == null) {
            throw new IllegalArgumentException("name must not be null");
        }
        if (status == null) {
            status = ComponentStatus.UNKNOWN;
        }
        if (description == null) {
            description = "";
        }
    }
}
