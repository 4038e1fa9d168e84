package com.statusbridge.alertbridge.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.statusbridge.observability.MetricFactory;
import com.statusbridge.security.BasicCredentials;
import com.statusbridge.security.BasicCredentialsExtractor;
import com.statusbridge.security.CredentialVerifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WebhookAuthenticationFilter")
class WebhookAuthenticationFilterTest {

    private final BasicCredentials credentials = new BasicCredentials("alertmanager", "s3cret");
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final WebhookAuthenticationFilter filter = new WebhookAuthenticationFilter(
            new CredentialVerifier(credentials), "statusbridge", new ObjectMapper(), new MetricFactory(registry, "test"));

    @Test
    @DisplayName("should pass requests with the configured credentials")
    void shouldPassValidCredentials() throws Exception {
        var request = new MockHttpServletRequest("POST", "/webhook");
        request.addHeader("Authorization", BasicCredentialsExtractor.encode(credentials));
        var reached = new AtomicBoolean();

        filter.doFilter(request, new MockHttpServletResponse(), (req, resp) -> reached.set(true));

        assertThat(reached).isTrue();
    }

    @Test
    @DisplayName("should answer 401 with a challenge and never reach the chain")
    void shouldRejectWrongPassword() throws Exception {
        var request = new MockHttpServletRequest("POST", "/webhook");
        request.addHeader("Authorization", BasicCredentialsExtractor.encode(new BasicCredentials("alertmanager", "nope")));
        var response = new MockHttpServletResponse();
        var reached = new AtomicBoolean();

        filter.doFilter(request, response, (req, resp) -> reached.set(true));

        assertThat(reached).isFalse();
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getHeader("WWW-Authenticate")).isEqualTo("Basic realm=\"statusbridge\"");
        assertThat(response.getContentAsString()).contains("\"status\":401");
        assertThat(registry.get("statusbridge.webhook.rejected").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should reject requests without an Authorization header")
    void shouldRejectMissingHeader() throws Exception {
        var response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("POST", "/webhook"), response, (req, resp) -> {});

        assertThat(response.getStatus()).isEqualTo(401);
    }
}
