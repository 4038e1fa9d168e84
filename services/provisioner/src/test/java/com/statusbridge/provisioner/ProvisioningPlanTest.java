package com.statusbridge.provisioner;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProvisioningPlan")
class ProvisioningPlanTest {

    @Test
    @DisplayName("should group mapped services and collect unmapped ones")
    void shouldGroupServices() {
        List<MonitoredTarget> targets = List.of(
                new MonitoredTarget("node", "10.0.0.1:9100", List.of("Web", "API"), false),
                new MonitoredTarget("node", "10.0.0.2:9100", List.of("Web"), false),
                new MonitoredTarget("node", "10.0.0.3:9100", List.of("Metrics"), false));

        ProvisioningPlan plan = ProvisioningPlan.of(targets, Map.of("Web", "Core", "API", "Core"));

        assertThat(plan.groups()).containsOnlyKeys("Core");
        assertThat(plan.groups().get("Core")).containsExactly("API", "Web");
        assertThat(plan.unmappedServices()).containsExactly("Metrics");
        assertThat(plan.componentNames()).containsExactlyInAnyOrder(
                "10.0.0.1:9100 | Web, API", "10.0.0.2:9100 | Web", "10.0.0.3:9100 | Metrics", "Web", "API");
    }

    @Test
    @DisplayName("should merge duplicate target declarations keeping the critical flag")
    void shouldMergeDuplicateTargets() {
        List<MonitoredTarget> targets = List.of(
                new MonitoredTarget("node", "10.0.0.1:9100", List.of("Web"), false),
                new MonitoredTarget("blackbox", "10.0.0.1:9100", List.of("Web"), true));

        ProvisioningPlan plan = ProvisioningPlan.of(targets, Map.of("Web", "Core"));

        assertThat(plan.targets()).hasSize(1);
        assertThat(plan.targets().get(0).critical()).isTrue();
    }

    @Test
    @DisplayName("should be empty without targets")
    void shouldBeEmptyWithoutTargets() {
        ProvisioningPlan plan = ProvisioningPlan.of(List.of(), Map.of("Web", "Core"));

        assertThat(plan.isEmpty()).isTrue();
        assertThat(plan.groups()).isEmpty();
    }
}
