package com.statusbridge.provisioner;

import java.util.ArrayList;
import java.util.List;

/**
 * Tally of one provisioning run.
 */
public final class ProvisioningReport {

    private int targetComponentsCreated;
    private int groupsCreated;
    private int serviceComponentsCreated;
    private int componentsDeleted;
    private int groupsDeleted;
    private int unchanged;
    private final List<String> failures = new ArrayList<>();

    void targetComponentCreated() {
        targetComponentsCreated++;
    }

    void groupCreated() {
        groupsCreated++;
    }

    void serviceComponentCreated() {
        serviceComponentsCreated++;
    }

    void componentDeleted() {
        componentsDeleted++;
    }

    void groupDeleted() {
        groupsDeleted++;
    }

    void leftUnchanged() {
        unchanged++;
    }

    void failed(String what) {
        failures.add(what);
    }

    public int targetComponentsCreated() {
        return targetComponentsCreated;
    }

    public int groupsCreated() {
        return groupsCreated;
    }

    public int serviceComponentsCreated() {
        return serviceComponentsCreated;
    }

    public int componentsDeleted() {
        return componentsDeleted;
    }

    public int groupsDeleted() {
        return groupsDeleted;
    }

    /** Components and groups that already existed and were left alone. */
    public int unchanged() {
        return unchanged;
    }

    public List<String> failures() {
        return List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return "ProvisioningReport{targetComponentsCreated=" + targetComponentsCreated
                + ", groupsCreated=" + groupsCreated
                + ", serviceComponentsCreated=" + serviceComponentsCreated
                + ", componentsDeleted=" + componentsDeleted
                + ", groupsDeleted=" + groupsDeleted
                + ", unchanged=" + unchanged
                + ", failures=" + failures.size() + '}';
    }
}
