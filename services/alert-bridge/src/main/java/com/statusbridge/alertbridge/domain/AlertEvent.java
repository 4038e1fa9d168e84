package com.statusbridge.alertbridge.domain;

import java.util.List;

/**
 * One alert state change for one target, as delivered by the alerting source.
 *
 * @param alertName      alert rule name
 * @param targetInstance monitored target, e.g. {@code 10.0.0.1:9100}
 * @param firing         true when firing, false when resolved
 * @param serviceNames   visible services the target feeds, in label order
 * @param critical       whether the target alone forces its services down
 */
public record AlertEvent(
        String alertName,
        String targetInstance,
        boolean firing,
        List<String> serviceNames,
        boolean critical) {

    public AlertEvent {
        if (alertName == null || alertName.isBlank()) {
            throw new IllegalArgumentException("alertName must not be blank");
        }
        if (targetInstance == null || targetInstance.isBlank()) {
            throw new IllegalArgumentException("targetInstance must not be blank");
        }
        if (serviceNames == null || serviceNames.isEmpty()) {
            throw new IllegalArgumentException("serviceNames must not be empty");
        }
        serviceNames = List.copyOf(serviceNames);
    }

    public static AlertEvent firing(String alertName, String targetInstance, List<String> serviceNames, boolean critical) {
        return new AlertEvent(alertName, targetInstance, true, serviceNames, critical);
    }

    public static AlertEvent resolved(String alertName, String targetInstance, List<String> serviceNames, boolean critical) {
        return new AlertEvent(alertName, targetInstance, false, serviceNames, critical);
    }
}
