package com.statusbridge.alertbridge.infrastructure.alertmanager;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * One alert of a notification batch.
 *
 * @param status {@code firing} or {@code resolved}
 * @param labels flat label mapping
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlertmanagerAlert(String status, Map<String, String> labels, String fingerprint) {}
