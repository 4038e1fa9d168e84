package com.statusbridge.alertbridge.infrastructure.alertmanager;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Webhook payload of the alerting source. Only the fields the bridge reads are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlertmanagerNotification(String version, String status, String receiver, List<AlertmanagerAlert> alerts) {}
