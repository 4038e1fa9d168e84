package com.statusbridge.alertbridge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Incident texts, bound from {@code statusbridge.incidents.*}.
 *
 * @param nameTemplate    incident title, {@code %s} is replaced by the service name
 * @param message         first message of a new incident
 * @param resolvedMessage update posted when the incident is resolved
 */
@ConfigurationProperties(prefix = "statusbridge.incidents")
public record IncidentProperties(String nameTemplate, String message, String resolvedMessage) {

    public IncidentProperties {
        if (nameTemplate == null || nameTemplate.isBlank()) {
            nameTemplate = "%s is experiencing issues";
        }
        if (message == null || message.isBlank()) {
            message = "We are currently investigating this issue.";
        }
        if (resolvedMessage == null || resolvedMessage.isBlank()) {
            resolvedMessage = "The issue has been resolved.";
        }
    }

    public String incidentName(String serviceName) {
        return nameTemplate.replace("%s", serviceName);
    }
}
