package com.statusbridge.alertbridge.infrastructure.statuspage;

import com.statusbridge.alertbridge.domain.ServiceHealth;
import com.statusbridge.alertbridge.domain.TargetHealth;
import com.statusbridge.statuspage.ComponentStatus;

/**
 * Maps domain health to backend component status and back.
 */
public final class ComponentStatusMapper {

    private ComponentStatusMapper() {
    }

    public static ComponentStatus toComponentStatus(ServiceHealth health) {
        return switch (health) {
            case HEALTHY -> ComponentStatus.OPERATIONAL;
            case PARTIAL -> ComponentStatus.PARTIAL_OUTAGE;
            case DOWN -> ComponentStatus.MAJOR_OUTAGE;
        };
    }

    public static ComponentStatus toComponentStatus(TargetHealth health) {
        return health == TargetHealth.DOWN ? ComponentStatus.MAJOR_OUTAGE : ComponentStatus.OPERATIONAL;
    }

    /** Performance issues read as partial; unknown codes read as healthy. */
    public static ServiceHealth toServiceHealth(ComponentStatus status) {
        return switch (status) {
            case PERFORMANCE_ISSUES, PARTIAL_OUTAGE -> ServiceHealth.PARTIAL;
            case MAJOR_OUTAGE -> ServiceHealth.DOWN;
            default -> ServiceHealth.HEALTHY;
        };
    }

    public static TargetHealth toTargetHealth(ComponentStatus status) {
        return status == ComponentStatus.MAJOR_OUTAGE ? TargetHealth.DOWN : TargetHealth.HEALTHY;
    }
}
