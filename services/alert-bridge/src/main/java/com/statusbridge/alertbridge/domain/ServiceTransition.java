package com.statusbridge.alertbridge.domain;

/**
 * Outcome of a service recomputation.
 */
public record ServiceTransition(String serviceName, ServiceHealth previous, ServiceHealth current) {

    public boolean changed() {
        return previous != current;
    }
}
