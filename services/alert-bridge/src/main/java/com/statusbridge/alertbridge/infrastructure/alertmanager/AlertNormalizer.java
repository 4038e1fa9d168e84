package com.statusbridge.alertbridge.infrastructure.alertmanager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.statusbridge.alertbridge.domain.AlertEvent;
import com.statusbridge.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a notification batch into {@link AlertEvent}s.
 * <p>
 * Alerts without {@code status_page_alert=true} are not meant for the status page and are
 * dropped at INFO. Alerts that are meant for it but lack a service, instance or alert name, or
 * carry an unknown status, are dropped at WARN. Both are counted under
 * {@code statusbridge.alerts.dropped}; neither fails the batch.
 */
public class AlertNormalizer {

    private static final Logger log = LoggerFactory.getLogger(AlertNormalizer.class);

    public static final String LABEL_ENABLED = "status_page_alert";
    public static final String LABEL_COMPONENT = "status_page_component";
    public static final String LABEL_CRITICAL = "status_page_critical_target";
    public static final String LABEL_INSTANCE = "instance";
    public static final String LABEL_ALERT_NAME = "alertname";

    private final ObjectMapper objectMapper;
    private final Counter disabled;
    private final Counter malformed;

    public AlertNormalizer(ObjectMapper objectMapper, MetricFactory metrics) {
        this.objectMapper = objectMapper;
        this.disabled = metrics.counter("statusbridge.alerts.dropped", "Alerts dropped before processing",
                "reason", "disabled");
        this.malformed = metrics.counter("statusbridge.alerts.dropped", "Alerts dropped before processing",
                "reason", "malformed");
    }

    /**
     * Reads a webhook body.
     *
     * @throws MalformedNotificationException if the body is not JSON or has no alert list
     */
    public AlertmanagerNotification parse(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedNotificationException("Empty notification body");
        }
        AlertmanagerNotification notification;
        try {
            notification = objectMapper.readValue(body, AlertmanagerNotification.class);
        } catch (JsonProcessingException e) {
            throw new MalformedNotificationException("Notification is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (notification == null || notification.alerts() == null) {
            throw new MalformedNotificationException("Notification has no alerts list");
        }
        return notification;
    }

    /** Lazily maps the alerts of a notification to events, skipping dropped ones. */
    public Stream<AlertEvent> normalize(AlertmanagerNotification notification) {
        return notification.alerts().stream()
                .map(this::toEvent)
                .flatMap(Optional::stream);
    }

    Optional<AlertEvent> toEvent(AlertmanagerAlert alert) {
        if (alert == null || alert.labels() == null) {
            return dropMalformed("alert without labels", null);
        }
        Map<String, String> labels = alert.labels();
        String alertName = labels.get(LABEL_ALERT_NAME);

        if (!parseBoolean(labels.get(LABEL_ENABLED)).orElse(false)) {
            disabled.increment();
            log.info("Ignoring alert {}: not enabled for the status page", alertName);
            return Optional.empty();
        }

        List<String> services = splitServices(labels.get(LABEL_COMPONENT));
        if (services.isEmpty()) {
            return dropMalformed("missing " + LABEL_COMPONENT + " label", alertName);
        }
        String instance = labels.get(LABEL_INSTANCE);
        if (instance == null || instance.isBlank()) {
            return dropMalformed("missing " + LABEL_INSTANCE + " label", alertName);
        }
        if (alertName == null || alertName.isBlank()) {
            return dropMalformed("missing " + LABEL_ALERT_NAME + " label", null);
        }
        Boolean firing = parseStatus(alert.status());
        if (firing == null) {
            return dropMalformed("unknown status " + alert.status(), alertName);
        }

        String criticalLabel = labels.get(LABEL_CRITICAL);
        Optional<Boolean> critical = parseBoolean(criticalLabel);
        if (criticalLabel != null && critical.isEmpty()) {
            log.warn("Alert {} on {}: unrecognized {} value \"{}\", treating as false",
                    alertName, instance, LABEL_CRITICAL, criticalLabel);
        }
        return Optional.of(new AlertEvent(alertName, instance.strip(), firing, services, critical.orElse(false)));
    }

    private Optional<AlertEvent> dropMalformed(String reason, String alertName) {
        malformed.increment();
        log.warn("Dropping malformed alert {}: {}", alertName != null ? alertName : "<unnamed>", reason);
        return Optional.empty();
    }

    static List<String> splitServices(String label) {
        if (label == null) {
            return List.of();
        }
        return Arrays.stream(label.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }

    /** true/yes/1 and false/no/0, case-insensitive; anything else is empty. */
    static Optional<Boolean> parseBoolean(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> Optional.of(Boolean.TRUE);
            case "false", "no", "0" -> Optional.of(Boolean.FALSE);
            default -> Optional.empty();
        };
    }

    private static Boolean parseStatus(String status) {
        if (status == null) {
            return null;
        }
        return switch (status.strip().toLowerCase(Locale.ROOT)) {
            case "firing" -> Boolean.TRUE;
            case "resolved" -> Boolean.FALSE;
            default -> null;
        };
    }
}
