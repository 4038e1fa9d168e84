package com.statusbridge.provisioner;

import com.statusbridge.statuspage.TargetComponentName;

import java.util.List;

/**
 * One scrape target that reports to the status page.
 *
 * @param job          scrape job the target was declared under
 * @param instance     target address, e.g. {@code 10.0.0.1:9100}
 * @param serviceNames visible services the target feeds, in label order
 * @param critical     whether the target alone forces its services down
 */
public record MonitoredTarget(String job, String instance, List<String> serviceNames, boolean critical) {

    public MonitoredTarget {
        serviceNames = List.copyOf(serviceNames);
    }

    public TargetComponentName componentName() {
        return new TargetComponentName(instance, serviceNames);
    }
}
