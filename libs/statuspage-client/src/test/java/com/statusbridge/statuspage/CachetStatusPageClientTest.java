package com.statusbridge.statuspage;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Tests for {@link CachetStatusPageClient} against a mocked HTTP server: request shapes,
 * response parsing, pagination and failure classification with retry.
 */
@DisplayName("CachetStatusPageClient")
class CachetStatusPageClientTest {

    private static final String BASE = "http://cachet.test/api";

    private MockRestServiceServer server;
    private CachetStatusPageClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        StatusPageClientSettings settings = new StatusPageClientSettings(
                URI.create(BASE), "token", null, null, 3, Duration.ofMillis(1), 2);
        client = new CachetStatusPageClient(builder.build(), CachetStatusPageClient.retryConfig(settings), 2);
    }

    @Nested
    @DisplayName("Components")
    class Components {

        @Test
        @DisplayName("should follow links.next across pages")
        void shouldFollowPagination() {
            server.expect(requestTo(BASE + "/components?per_page=2&page=1"))
                    .andRespond(withSuccess("""
                            {"data": [
                              {"id": 1, "attributes": {"name": "Web", "status": 1, "enabled": true}},
                              {"id": 2, "attributes": {"name": "API", "status": 3, "enabled": true}}
                            ],
                             "links": {"next": "http://cachet.test/api/components?page=2"}}
                            """, MediaType.APPLICATION_JSON));
            server.expect(requestTo(BASE + "/components?per_page=2&page=2"))
                    .andRespond(withSuccess("""
                            {"data": [
                              {"id": 3, "attributes": {"name": "10.0.0.1 | Web", "status": {"value": 4},
                                                       "enabled": false, "description": "critical: no\\nno alerts"}}
                            ],
                             "links": {"next": null}}
                            """, MediaType.APPLICATION_JSON));

            List<StatusPageComponent> components = client.listComponents();

            assertThat(components).extracting(StatusPageComponent::name)
                    .containsExactly("Web", "API", "10.0.0.1 | Web");
            assertThat(components.get(1).status()).isEqualTo(ComponentStatus.PARTIAL_OUTAGE);
            assertThat(components.get(2).status()).isEqualTo(ComponentStatus.MAJOR_OUTAGE);
            assertThat(components.get(2).enabled()).isFalse();
            assertThat(components.get(2).description()).isEqualTo("critical: no\nno alerts");
            server.verify();
        }

        @Test
        @DisplayName("should accept records without an attributes wrapper")
        void shouldAcceptFlatRecords() {
            server.expect(requestTo(BASE + "/components/9"))
                    .andRespond(withSuccess("""
                            {"data": {"id": 9, "name": "DB", "status": 2, "enabled": true, "group_id": 4}}
                            """, MediaType.APPLICATION_JSON));

            StatusPageComponent component = client.getComponent(9);

            assertThat(component.id()).isEqualTo(9);
            assertThat(component.name()).isEqualTo("DB");
            assertThat(component.status()).isEqualTo(ComponentStatus.PERFORMANCE_ISSUES);
            assertThat(component.groupId()).isEqualTo(4L);
        }

        @Test
        @DisplayName("should send only the status when patching a component status")
        void shouldPatchStatus() {
            server.expect(requestTo(BASE + "/components/7"))
                    .andExpect(method(HttpMethod.PATCH))
                    .andExpect(content().json("{\"status\": 4}", true))
                    .andRespond(withSuccess());

            client.updateComponentStatus(7, ComponentStatus.MAJOR_OUTAGE);

            server.verify();
        }

        @Test
        @DisplayName("should create hidden target components with their description")
        void shouldCreateTargetComponent() {
            server.expect(requestTo(BASE + "/components"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.name").value("10.0.0.1 | Web, API"))
                    .andExpect(jsonPath("$.enabled").value(false))
                    .andExpect(jsonPath("$.status").value(1))
                    .andExpect(jsonPath("$.description").value("critical: yes\nno alerts"))
                    .andRespond(withSuccess("""
                            {"data": {"id": 21, "attributes": {"name": "10.0.0.1 | Web, API", "status": 1,
                                                               "enabled": false}}}
                            """, MediaType.APPLICATION_JSON));

            StatusPageComponent created = client.createComponent(NewComponent.target(
                    new TargetComponentName("10.0.0.1", List.of("Web", "API")),
                    TargetDescription.initial(true)));

            assertThat(created.id()).isEqualTo(21);
            server.verify();
        }
    }

    @Nested
    @DisplayName("Incidents")
    class Incidents {

        @Test
        @DisplayName("should open an incident that also sets the component status")
        void shouldCreateIncident() {
            server.expect(requestTo(BASE + "/incidents"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.component_id").value(7))
                    .andExpect(jsonPath("$.component_status").value(4))
                    .andExpect(jsonPath("$.status").value(1))
                    .andExpect(jsonPath("$.visible").value(1))
                    .andRespond(withSuccess("""
                            {"data": {"id": 55, "attributes": {"name": "Web is experiencing issues",
                                                               "status": 1, "component_id": 7}}}
                            """, MediaType.APPLICATION_JSON));

            Incident incident = client.createIncident(new NewIncident(7, "Web is experiencing issues",
                    "Investigating", IncidentStatus.INVESTIGATING, ComponentStatus.MAJOR_OUTAGE));

            assertThat(incident.id()).isEqualTo(55);
            assertThat(incident.componentId()).isEqualTo(7L);
            assertThat(incident.status()).isEqualTo(IncidentStatus.INVESTIGATING);
        }

        @Test
        @DisplayName("should post incident updates to the incident timeline")
        void shouldPostUpdate() {
            server.expect(requestTo(BASE + "/incidents/55/updates"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.status").value(4))
                    .andExpect(jsonPath("$.message").value("Resolved"))
                    .andRespond(withSuccess());
            server.expect(requestTo(BASE + "/incidents/55"))
                    .andExpect(method(HttpMethod.PUT))
                    .andExpect(jsonPath("$.status").value(4))
                    .andRespond(withSuccess());

            client.createIncidentUpdate(55, IncidentStatus.FIXED, "Resolved");
            client.updateIncident(55, IncidentStatus.FIXED);

            server.verify();
        }

        @Test
        @DisplayName("should drop fixed incidents the backend returns despite the filter")
        void shouldFilterFixedIncidents() {
            server.expect(requestTo(startsWith(BASE + "/incidents")))
                    .andExpect(method(HttpMethod.GET))
                    .andExpect(queryParam("page", "1"))
                    .andRespond(withSuccess("""
                            {"data": [
                              {"id": 1, "attributes": {"name": "a", "status": 2, "component_id": 7}},
                              {"id": 2, "attributes": {"name": "b", "status": {"value": 4}, "component_id": 8}},
                              {"id": 3, "attributes": {"name": "c", "status": 1, "component_id": null}}
                            ]}
                            """, MediaType.APPLICATION_JSON));

            List<Incident> open = client.listOpenIncidents();

            assertThat(open).extracting(Incident::id).containsExactly(1L, 3L);
            assertThat(open.get(1).componentId()).isNull();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should retry a 503 and return the later success")
        void shouldRetryServerError() {
            server.expect(requestTo(BASE + "/components/7"))
                    .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
            server.expect(requestTo(BASE + "/components/7"))
                    .andRespond(withSuccess());

            client.updateComponentStatus(7, ComponentStatus.OPERATIONAL);

            server.verify();
        }

        @Test
        @DisplayName("should give up after the configured attempts with a transient failure")
        void shouldExhaustRetries() {
            for (int i = 0; i < 3; i++) {
                server.expect(requestTo(BASE + "/components/7"))
                        .andRespond(withStatus(HttpStatus.BAD_GATEWAY));
            }

            assertThatThrownBy(() -> client.updateComponentStatus(7, ComponentStatus.OPERATIONAL))
                    .isInstanceOf(TransientStatusPageException.class)
                    .satisfies(e -> {
                        StatusPageException spe = (StatusPageException) e;
                        assertThat(spe.statusCode()).isEqualTo(502);
                        assertThat(spe.operation()).isEqualTo("updateComponentStatus");
                    });
            server.verify();
        }

        @Test
        @DisplayName("should treat 429 as transient")
        void shouldRetryTooManyRequests() {
            server.expect(requestTo(BASE + "/components/7"))
                    .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
            server.expect(requestTo(BASE + "/components/7"))
                    .andRespond(withSuccess());

            client.updateComponentStatus(7, ComponentStatus.OPERATIONAL);

            server.verify();
        }

        @Test
        @DisplayName("should translate I/O errors into transient failures")
        void shouldTranslateIoErrors() {
            for (int i = 0; i < 3; i++) {
                server.expect(requestTo(BASE + "/components/7"))
                        .andRespond(request -> {
                            throw new IOException("connection reset");
                        });
            }

            assertThatThrownBy(() -> client.getComponent(7))
                    .isInstanceOf(TransientStatusPageException.class)
                    .hasMessageContaining("connection reset");
        }

        @Test
        @DisplayName("should not retry a 404 and report it as not found")
        void shouldNotRetryNotFound() {
            server.expect(requestTo(BASE + "/components/7"))
                    .andRespond(withStatus(HttpStatus.NOT_FOUND)
                            .body("{\"errors\":[\"not found\"]}")
                            .contentType(MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.updateComponentStatus(7, ComponentStatus.OPERATIONAL))
                    .isInstanceOfSatisfying(PermanentStatusPageException.class, e -> {
                        assertThat(e.isNotFound()).isTrue();
                        assertThat(e.isTransient()).isFalse();
                    });
            server.verify();
        }

        @Test
        @DisplayName("should reject a response without a data element")
        void shouldRejectMissingData() {
            server.expect(requestTo(BASE + "/components/7"))
                    .andRespond(withSuccess("{\"meta\": {}}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.getComponent(7))
                    .isInstanceOf(PermanentStatusPageException.class)
                    .hasMessageContaining("no data");
        }
    }
}
