package com.statusbridge.alertbridge.domain;

/**
 * Counts for one processed batch.
 *
 * @param events      events applied to the target store
 * @param changed     events that changed a target's state
 * @param services    distinct services recomputed
 */
public record ProcessingSummary(int events, int changed, int services) {}
