package com.statusbridge.alertbridge.domain;

import com.statusbridge.alertbridge.domain.ports.GatewayException;
import com.statusbridge.alertbridge.domain.ports.StatusPageGateway;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mirrors target state to the hidden per-target components.
 * <p>
 * Publication of one target is serialized through {@link TargetStateStore#claimPublication}:
 * the thread holding the claim keeps publishing until the newest snapshot is confirmed, so
 * concurrent events for the same target collapse into at most one call in flight and the last
 * call always carries the newest state.
 */
public final class TargetComponentPublisher {

    private static final Logger log = LoggerFactory.getLogger(TargetComponentPublisher.class);
    private static final Logger transitions = LoggerFactory.getLogger("statusbridge.transitions");

    private final TargetStateStore store;
    private final StatusPageGateway gateway;

    public TargetComponentPublisher(TargetStateStore store, StatusPageGateway gateway) {
        this.store = store;
        this.gateway = gateway;
    }

    /**
     * Publishes the target until it is in sync or a call fails.
     *
     * @return true if the newest snapshot was confirmed (or nothing was pending)
     */
    public boolean publish(String targetKey) {
        while (true) {
            Optional<TargetPublication> claim = store.claimPublication(targetKey);
            if (claim.isEmpty()) {
                return !store.hasPendingPublication(targetKey);
            }
            TargetSnapshot snapshot = claim.get().snapshot();
            boolean confirmed = false;
            try {
                gateway.publishTargetState(snapshot);
                confirmed = true;
            } catch (GatewayException e) {
                if (e.isTransient()) {
                    log.warn("Could not publish target {}, will retry on next event: {}", targetKey, e.getMessage());
                } else {
                    log.error("Could not publish target {}: {}", targetKey, e.getMessage());
                }
            } finally {
                store.completePublication(snapshot, confirmed);
            }
            if (!confirmed) {
                return false;
            }
            TargetHealth before = claim.get().lastPublishedHealth();
            if (before != snapshot.health()) {
                transitions.info("component=\"{}\" kind=target old={} new={}",
                        targetKey, before == null ? "UNKNOWN" : before, snapshot.health());
            }
        }
    }
}
