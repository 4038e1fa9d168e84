package com.statusbridge.alertbridge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.statusbridge.alertbridge.domain.AlertProcessor;
import com.statusbridge.alertbridge.domain.IncidentLifecycleManager;
import com.statusbridge.alertbridge.domain.ServiceAggregator;
import com.statusbridge.alertbridge.domain.TargetComponentPublisher;
import com.statusbridge.alertbridge.domain.TargetStateStore;
import com.statusbridge.alertbridge.domain.ports.StatusPageGateway;
import com.statusbridge.alertbridge.infrastructure.alertmanager.AlertNormalizer;
import com.statusbridge.alertbridge.infrastructure.statuspage.ComponentDirectory;
import com.statusbridge.alertbridge.infrastructure.statuspage.StateRehydrator;
import com.statusbridge.alertbridge.infrastructure.statuspage.StatusPageGatewayAdapter;
import com.statusbridge.observability.MetricFactory;
import com.statusbridge.statuspage.CachetStatusPageClient;
import com.statusbridge.statuspage.StatusPageClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Wires the engine. Domain classes carry no Spring annotations; they are assembled here.
 */
@Configuration
public class AlertBridgeConfig {

    private static final Logger log = LoggerFactory.getLogger(AlertBridgeConfig.class);

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public StatusPageClient statusPageClient(StatusPageProperties properties, RestClient.Builder builder) {
        log.info("Status page backend at {}", properties.baseUrl());
        return CachetStatusPageClient.create(properties.toSettings(), builder);
    }

    @Bean
    public ComponentDirectory componentDirectory(StatusPageClient client) {
        return new ComponentDirectory(client);
    }

    @Bean
    public StatusPageGateway statusPageGateway(
            StatusPageClient client, ComponentDirectory directory, IncidentProperties incidents, MetricFactory metrics) {
        return new StatusPageGatewayAdapter(client, directory, incidents, metrics);
    }

    @Bean
    public TargetStateStore targetStateStore() {
        return new TargetStateStore();
    }

    @Bean
    public ServiceAggregator serviceAggregator(TargetStateStore store) {
        return new ServiceAggregator(store);
    }

    @Bean
    public TargetComponentPublisher targetComponentPublisher(TargetStateStore store, StatusPageGateway gateway) {
        return new TargetComponentPublisher(store, gateway);
    }

    @Bean
    public IncidentLifecycleManager incidentLifecycleManager(
            ServiceAggregator aggregator, StatusPageGateway gateway, MetricFactory metrics) {
        return new IncidentLifecycleManager(aggregator, gateway, metrics);
    }

    @Bean
    public AlertProcessor alertProcessor(
            TargetStateStore store,
            ServiceAggregator aggregator,
            TargetComponentPublisher publisher,
            IncidentLifecycleManager lifecycle,
            MetricFactory metrics) {
        return new AlertProcessor(store, aggregator, publisher, lifecycle, metrics);
    }

    @Bean
    public AlertNormalizer alertNormalizer(ObjectMapper objectMapper, MetricFactory metrics) {
        return new AlertNormalizer(objectMapper, metrics);
    }

    @Bean
    public StateRehydrator stateRehydrator(
            StatusPageClient client,
            ComponentDirectory directory,
            TargetStateStore store,
            ServiceAggregator aggregator,
            AlertProcessor processor) {
        return new StateRehydrator(client, directory, store, aggregator, processor);
    }

    @Bean
    public ApplicationListener<ApplicationReadyEvent> rehydrateOnStartup(
            StatusPageProperties properties, StateRehydrator rehydrator) {
        return event -> {
            if (Boolean.TRUE.equals(properties.rehydrateOnStartup())) {
                rehydrator.rehydrate();
            } else {
                log.info("Startup rehydration disabled, starting with empty state");
            }
        };
    }
}
