package com.statusbridge.provisioner;

/**
 * What a provisioning run is allowed to change.
 */
public enum ProvisioningMode {

    /** Create whatever the configuration names and the backend lacks. Never deletes. */
    SYNC(false, true),

    /** Delete components and groups the configuration does not name, then sync. */
    RESET(true, true),

    /** Delete every component and group. */
    DELETE_ALL(true, false);

    private final boolean deletes;
    private final boolean creates;

    ProvisioningMode(boolean deletes, boolean creates) {
        this.deletes = deletes;
        this.creates = creates;
    }

    public boolean deletes() {
        return deletes;
    }

    public boolean creates() {
        return creates;
    }
}
