package com.statusbridge.alertbridge.domain;

/** Health of a single target: down while any of its alerts fires. */
public enum TargetHealth {
    HEALTHY,
    DOWN
}
