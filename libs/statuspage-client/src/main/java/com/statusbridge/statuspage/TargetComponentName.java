package com.statusbridge.statuspage;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Display name of a target component: {@code "<instance> | <service>, <service>"}.
 * <p>
 * The provisioner creates target components under this name and the bridge resolves them by
 * it, so both sides must format it through this type.
 *
 * @param instance     monitored target, e.g. {@code db01.example.com:9100}
 * @param serviceNames visible services the target feeds, in label order
 */
public record TargetComponentName(String instance, List<String> serviceNames) {

    static final String SEPARATOR = " | ";

    public TargetComponentName {
        if (instance == null || instance.isBlank()) {
            throw new IllegalArgumentException("instance must not be blank");
        }
        if (serviceNames == null || serviceNames.isEmpty()) {
            throw new IllegalArgumentException("serviceNames must not be empty");
        }
        serviceNames = List.copyOf(serviceNames);
    }

    public String format() {
        return instance + SEPARATOR + String.join(", ", serviceNames);
    }

    /**
     * Parses a component name produced by {@link #format()}.
     *
     * @return empty if the name is not a target component name
     */
    public static Optional<TargetComponentName> parse(String componentName) {
        if (componentName == null) {
            return Optional.empty();
        }
        int separator = componentName.indexOf('|');
        if (separator < 0) {
            return Optional.empty();
        }
        String instance = componentName.substring(0, separator).strip();
        List<String> services = Arrays.stream(componentName.substring(separator + 1).split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
        if (instance.isEmpty() || services.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TargetComponentName(instance, services));
    }
}
