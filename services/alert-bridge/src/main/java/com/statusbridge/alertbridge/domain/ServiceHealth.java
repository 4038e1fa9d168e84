package com.statusbridge.alertbridge.domain;

/** Aggregate health of a visible service. */
public enum ServiceHealth {
    HEALTHY,
    PARTIAL,
    DOWN
}
