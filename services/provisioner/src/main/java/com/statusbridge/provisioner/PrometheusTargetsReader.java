package com.statusbridge.provisioner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the {@code prometheus_targets} section of a Prometheus deployment file:
 *
 * <pre>
 * prometheus_targets:
 *   node:
 *     - targets: ["10.0.0.1:9100", "10.0.0.2:9100"]
 *       labels:
 *         status_page_alert: true
 *         status_page_component: "Web, API"
 *         status_page_critical_target: false
 * </pre>
 *
 * Only target groups labelled {@code status_page_alert: true} are returned. Groups that are
 * enabled but name no component are skipped with a warning.
 */
public class PrometheusTargetsReader {

    private static final Logger log = LoggerFactory.getLogger(PrometheusTargetsReader.class);

    static final String SECTION = "prometheus_targets";
    static final String LABEL_ENABLED = "status_page_alert";
    static final String LABEL_COMPONENT = "status_page_component";
    static final String LABEL_CRITICAL = "status_page_critical_target";

    private final ObjectMapper yamlMapper;

    public PrometheusTargetsReader() {
        this(new ObjectMapper(new YAMLFactory()));
    }

    PrometheusTargetsReader(ObjectMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
    }

    public List<MonitoredTarget> read(Path file) {
        String name = file.getFileName().toString();
        if (!name.endsWith(".yml") && !name.endsWith(".yaml")) {
            throw new InvalidProvisioningInputException("Targets file must be a YAML file (.yml or .yaml): " + file);
        }
        JsonNode root;
        try {
            root = yamlMapper.readTree(Files.readString(file));
        } catch (NoSuchFileException e) {
            throw new InvalidProvisioningInputException("Targets file not found: " + file, e);
        } catch (IOException e) {
            throw new InvalidProvisioningInputException("Cannot parse targets file " + file + ": " + e.getMessage(), e);
        }
        return parse(root);
    }

    List<MonitoredTarget> parse(JsonNode root) {
        List<MonitoredTarget> targets = new ArrayList<>();
        JsonNode section = root == null ? null : root.get(SECTION);
        if (section == null || !section.isObject()) {
            log.warn("No '{}' section found", SECTION);
            return targets;
        }
        Iterator<Map.Entry<String, JsonNode>> jobs = section.fields();
        while (jobs.hasNext()) {
            Map.Entry<String, JsonNode> job = jobs.next();
            if (!job.getValue().isArray()) {
                log.debug("Job '{}' is not a list of target groups, skipping", job.getKey());
                continue;
            }
            for (JsonNode group : job.getValue()) {
                readGroup(job.getKey(), group, targets);
            }
        }
        return targets;
    }

    private void readGroup(String job, JsonNode group, List<MonitoredTarget> into) {
        if (!group.isObject()) {
            return;
        }
        JsonNode labels = group.path("labels");
        if (!isTrue(labels.get(LABEL_ENABLED))) {
            return;
        }
        List<String> services = splitServices(labels.path(LABEL_COMPONENT).asText(""));
        if (services.isEmpty()) {
            log.warn("Skipping target group in job '{}': missing {}", job, LABEL_COMPONENT);
            return;
        }
        boolean critical = isTrue(labels.get(LABEL_CRITICAL));
        for (JsonNode target : group.path("targets")) {
            String instance = target.asText("").strip();
            if (instance.isEmpty()) {
                log.warn("Skipping blank target in job '{}'", job);
                continue;
            }
            into.add(new MonitoredTarget(job, instance, services, critical));
        }
    }

    static List<String> splitServices(String label) {
        return Arrays.stream(label.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }

    // YAML booleans arrive as booleans, quoted ones as text
    static boolean isTrue(JsonNode value) {
        if (value == null || value.isNull()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return switch (value.asText().strip().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            default -> false;
        };
    }
}
