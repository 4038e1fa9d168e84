package com.statusbridge.statuspage;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link StatusPageClient} for the Cachet JSON API.
 * <p>
 * Responses are read as JSON trees because the API wraps records as
 * {@code {"data": {"id": .., "attributes": {..}}}} and reports status either as a number or as
 * {@code {"value": n, ...}} depending on the version; both shapes are accepted.
 * <p>
 * Every call runs inside a resilience4j {@link Retry}: I/O errors, timeouts, 5xx and 429 are
 * retried with exponential backoff up to {@link StatusPageClientSettings#maxAttempts()} attempts,
 * then surface as {@link TransientStatusPageException}. Other 4xx answers surface immediately as
 * {@link PermanentStatusPageException}.
 */
public class CachetStatusPageClient implements StatusPageClient {

    private static final Logger log = LoggerFactory.getLogger(CachetStatusPageClient.class);

    static final String OPEN_INCIDENT_FILTER = "0,1,2,3";

    private final RestClient restClient;
    private final Retry retry;
    private final int pageSize;

    /**
     * @param restClient a client whose base URL and authentication are already configured
     * @param retryConfig retry policy, see {@link #retryConfig(StatusPageClientSettings)}
     * @param pageSize   {@code per_page} for listings
     */
    public CachetStatusPageClient(RestClient restClient, RetryConfig retryConfig, int pageSize) {
        this.restClient = restClient;
        this.retry = Retry.of("statuspage", retryConfig);
        this.pageSize = pageSize;
        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "Retrying status page call, attempt {} failed: {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    /**
     * Builds a client with timeouts, bearer authentication and retry taken from the settings.
     */
    public static CachetStatusPageClient create(StatusPageClientSettings settings) {
        return create(settings, RestClient.builder());
    }

    public static CachetStatusPageClient create(StatusPageClientSettings settings, RestClient.Builder builder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(settings.connectTimeout());
        requestFactory.setReadTimeout(settings.readTimeout());

        RestClient restClient = builder
                .baseUrl(settings.baseUrl().toString())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + settings.apiToken())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        return new CachetStatusPageClient(restClient, retryConfig(settings), settings.pageSize());
    }

    /**
     * Retry policy: bounded attempts, exponential backoff, transient failures only.
     */
    public static RetryConfig retryConfig(StatusPageClientSettings settings) {
        return RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(settings.initialBackoff(), 2.0))
                .retryOnException(e -> e instanceof StatusPageException spe && spe.isTransient())
                .build();
    }

    // ---- components ----

    @Override
    public StatusPageComponent getComponent(long componentId) {
        JsonNode root = execute("getComponent", () -> restClient.get()
                .uri("/components/{id}", componentId)
                .retrieve()
                .body(JsonNode.class));
        return toComponent(requireData("getComponent", root));
    }

    @Override
    public List<StatusPageComponent> listComponents() {
        return listAll("listComponents", "/components", Map.of()).stream()
                .map(this::toComponent)
                .toList();
    }

    @Override
    public StatusPageComponent createComponent(NewComponent component) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", component.name());
        body.put("status", component.status().code());
        body.put("enabled", component.enabled());
        if (component.description() != null) {
            body.put("description", component.description());
        }
        if (component.groupId() != null) {
            body.put("component_group_id", component.groupId());
        }
        JsonNode root = execute("createComponent", () -> restClient.post()
                .uri("/components")
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class));
        return toComponent(requireData("createComponent", root));
    }

    @Override
    public void updateComponentStatus(long componentId, ComponentStatus status) {
        execute("updateComponentStatus", () -> restClient.patch()
                .uri("/components/{id}", componentId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("status", status.code()))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void updateComponent(long componentId, ComponentUpdate update) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (update.status() != null) {
            body.put("status", update.status().code());
        }
        if (update.enabled() != null) {
            body.put("enabled", update.enabled());
        }
        if (update.description() != null) {
            body.put("description", update.description());
        }
        execute("updateComponent", () -> restClient.put()
                .uri("/components/{id}", componentId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void deleteComponent(long componentId) {
        execute("deleteComponent", () -> restClient.delete()
                .uri("/components/{id}", componentId)
                .retrieve()
                .toBodilessEntity());
    }

    // ---- component groups ----

    @Override
    public List<ComponentGroup> listComponentGroups() {
        return listAll("listComponentGroups", "/component-groups", Map.of()).stream()
                .map(node -> new ComponentGroup(node.path("id").asLong(), attributes(node).path("name").asText("")))
                .toList();
    }

    @Override
    public ComponentGroup createComponentGroup(String name) {
        JsonNode root = execute("createComponentGroup", () -> restClient.post()
                .uri("/component-groups")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("name", name, "visible", 1))
                .retrieve()
                .body(JsonNode.class));
        JsonNode data = requireData("createComponentGroup", root);
        return new ComponentGroup(data.path("id").asLong(), attributes(data).path("name").asText(name));
    }

    @Override
    public void deleteComponentGroup(long groupId) {
        execute("deleteComponentGroup", () -> restClient.delete()
                .uri("/component-groups/{id}", groupId)
                .retrieve()
                .toBodilessEntity());
    }

    // ---- incidents ----

    @Override
    public Incident createIncident(NewIncident incident) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", incident.name());
        body.put("message", incident.message());
        body.put("status", incident.status().code());
        body.put("visible", 1);
        body.put("component_id", incident.componentId());
        if (incident.componentStatus() != null) {
            body.put("component_status", incident.componentStatus().code());
        }
        JsonNode root = execute("createIncident", () -> restClient.post()
                .uri("/incidents")
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class));
        return toIncident(requireData("createIncident", root));
    }

    @Override
    public void updateIncident(long incidentId, IncidentStatus status) {
        execute("updateIncident", () -> restClient.put()
                .uri("/incidents/{id}", incidentId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("status", status.code()))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void createIncidentUpdate(long incidentId, IncidentStatus status, String message) {
        execute("createIncidentUpdate", () -> restClient.post()
                .uri("/incidents/{id}/updates", incidentId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("status", status.code(), "message", message, "visible", 1))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public List<Incident> listOpenIncidents() {
        return listAll("listOpenIncidents", "/incidents", Map.of("filter[status]", OPEN_INCIDENT_FILTER)).stream()
                .map(this::toIncident)
                .filter(incident -> incident.status().isOpen())
                .toList();
    }

    // ---- plumbing ----

    private List<JsonNode> listAll(String operation, String path, Map<String, String> query) {
        List<JsonNode> items = new ArrayList<>();
        int page = 1;
        while (true) {
            final int current = page;
            JsonNode root = execute(operation, () -> restClient.get()
                    .uri(builder -> {
                        builder.path(path)
                                .queryParam("per_page", pageSize)
                                .queryParam("page", current);
                        query.forEach((name, value) -> builder.queryParam(name, value));
                        return builder.build();
                    })
                    .retrieve()
                    .body(JsonNode.class));
            JsonNode data = requireData(operation, root);
            if (!data.isArray()) {
                throw new PermanentStatusPageException(operation, "expected a data array");
            }
            data.forEach(items::add);
            if (data.isEmpty() || !hasNextPage(root)) {
                return items;
            }
            page++;
        }
    }

    private static boolean hasNextPage(JsonNode root) {
        JsonNode next = root.path("links").path("next");
        return !next.isMissingNode() && !next.isNull() && !next.asText().isBlank();
    }

    private <T> T execute(String operation, Supplier<T> call) {
        return retry.executeSupplier(() -> translate(operation, call));
    }

    private static <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status >= 500 || status == 429) {
                throw new TransientStatusPageException(operation, status, e);
            }
            throw new PermanentStatusPageException(operation, status, e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new TransientStatusPageException(operation, e);
        } catch (RestClientException e) {
            throw new PermanentStatusPageException(operation, StatusPageException.NO_STATUS, e.getMessage(), e);
        }
    }

    private static JsonNode requireData(String operation, JsonNode root) {
        if (root == null || !root.has("data") || root.get("data").isNull()) {
            throw new PermanentStatusPageException(operation, "response has no data element");
        }
        return root.get("data");
    }

    private static JsonNode attributes(JsonNode data) {
        return data.has("attributes") ? data.get("attributes") : data;
    }

    private StatusPageComponent toComponent(JsonNode data) {
        JsonNode attrs = attributes(data);
        JsonNode group = attrs.has("component_group_id") ? attrs.get("component_group_id") : attrs.path("group_id");
        Long groupId = group.isMissingNode() || group.isNull() || group.asLong() == 0 ? null : group.asLong();
        return new StatusPageComponent(
                data.path("id").asLong(),
                attrs.path("name").asText(""),
                ComponentStatus.fromCode(statusCode(attrs.path("status"), ComponentStatus.OPERATIONAL.code())),
                attrs.path("enabled").asBoolean(true),
                attrs.path("description").asText(""),
                groupId);
    }

    private Incident toIncident(JsonNode data) {
        JsonNode attrs = attributes(data);
        JsonNode component = attrs.path("component_id");
        IncidentStatus status;
        try {
            status = IncidentStatus.fromCode(statusCode(attrs.path("status"), IncidentStatus.INVESTIGATING.code()));
        } catch (IllegalArgumentException e) {
            throw new PermanentStatusPageException("readIncident", StatusPageException.NO_STATUS, e.getMessage(), e);
        }
        return new Incident(
                data.path("id").asLong(),
                attrs.path("name").asText(""),
                status,
                component.isMissingNode() || component.isNull() ? null : component.asLong());
    }

    /** Status is either a plain number or an object carrying {@code value}. */
    private static int statusCode(JsonNode node, int fallback) {
        if (node.isObject()) {
            return node.path("value").asInt(fallback);
        }
        return node.isMissingNode() || node.isNull() ? fallback : node.asInt(fallback);
    }
}
