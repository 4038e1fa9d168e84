package com.statusbridge.alertbridge.domain;

import com.statusbridge.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the engine: applies alert events and cascades their effect.
 * <p>
 * For every event: update the target, publish the target component, recompute the services
 * the target feeds when its health, critical flag or membership changed, then reconcile each
 * of those services with the backend. Services are also reconciled when an earlier attempt
 * left them pending, so a failed backend call is retried by the next event for the target.
 */
public final class AlertProcessor {

    private static final Logger log = LoggerFactory.getLogger(AlertProcessor.class);

    private final TargetStateStore store;
    private final ServiceAggregator aggregator;
    private final TargetComponentPublisher publisher;
    private final IncidentLifecycleManager lifecycle;
    private final Counter received;

    public AlertProcessor(
            TargetStateStore store,
            ServiceAggregator aggregator,
            TargetComponentPublisher publisher,
            IncidentLifecycleManager lifecycle,
            MetricFactory metrics) {
        this.store = store;
        this.aggregator = aggregator;
        this.publisher = publisher;
        this.lifecycle = lifecycle;
        this.received = metrics.counter("statusbridge.alerts.received", "Alert events applied to target state");
    }

    public ProcessingSummary process(Iterable<AlertEvent> events) {
        int count = 0;
        int changed = 0;
        Set<String> touched = new LinkedHashSet<>();
        for (AlertEvent event : events) {
            count++;
            received.increment();
            TargetUpdate update = store.apply(event);
            if (update.changed()) {
                changed++;
                log.debug("Target {} now has alerts {} (critical={})", update.current().key(),
                        update.current().activeAlerts(), update.current().critical());
            }
            publisher.publish(update.current().key());

            for (String service : update.serviceNames()) {
                if (update.affectsAggregate()) {
                    aggregator.recompute(service);
                }
                if (update.affectsAggregate() || lifecycle.hasPendingSync(service)) {
                    lifecycle.reconcile(service);
                    touched.add(service);
                }
            }
        }
        return new ProcessingSummary(count, changed, touched.size());
    }

    /** Recomputes and reconciles every known service, e.g. after rehydration. */
    public void resyncAll() {
        for (String service : store.serviceNames()) {
            aggregator.recompute(service);
            lifecycle.reconcile(service);
        }
        for (TargetSnapshot target : store.snapshots()) {
            publisher.publish(target.key());
        }
    }
}
