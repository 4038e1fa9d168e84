package com.statusbridge.alertbridge.api;

import com.statusbridge.alertbridge.domain.AlertEvent;
import com.statusbridge.alertbridge.domain.AlertProcessor;
import com.statusbridge.alertbridge.domain.ProcessingSummary;
import com.statusbridge.alertbridge.infrastructure.alertmanager.AlertNormalizer;
import com.statusbridge.alertbridge.infrastructure.alertmanager.AlertmanagerNotification;
import com.statusbridge.alertbridge.infrastructure.web.WebhookRequestLogger;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound webhook of the alerting source.
 *
 * <p>Answers 200 once the payload is a well-formed notification, whatever happened to the
 * individual alerts: dropped alerts are logged and counted, backend failures are retried on
 * later events. Only a malformed payload gets a 400, which the source should not redeliver.
 */
@RestController
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final AlertNormalizer normalizer;
    private final AlertProcessor processor;
    private final WebhookRequestLogger requestLogger;

    public WebhookController(AlertNormalizer normalizer, AlertProcessor processor, WebhookRequestLogger requestLogger) {
        this.normalizer = normalizer;
        this.processor = processor;
        this.requestLogger = requestLogger;
    }

    @PostMapping("/webhook")
    public Map<String, Object> receive(@RequestBody String body, HttpServletRequest request) {
        requestLogger.log(request, body);
        AlertmanagerNotification notification = normalizer.parse(body);
        List<AlertEvent> events = normalizer.normalize(notification).toList();
        ProcessingSummary summary = processor.process(events);
        log.info("Processed notification: {} alerts received, {} applied, {} changed, {} services touched",
                notification.alerts().size(), summary.events(), summary.changed(), summary.services());
        return Map.of(
                "status", "OK",
                "received", notification.alerts().size(),
                "processed", summary.events());
    }
}
