package com.statusbridge.alertbridge.domain;

/**
 * A target snapshot claimed for publication.
 *
 * @param snapshot             newest state to send
 * @param lastPublishedHealth  health the backend showed after the last successful publication,
 *                             null if this target was never published
 */
public record TargetPublication(TargetSnapshot snapshot, TargetHealth lastPublishedHealth) {}
