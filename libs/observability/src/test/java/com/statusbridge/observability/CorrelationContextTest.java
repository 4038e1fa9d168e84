package com.statusbridge.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CorrelationContext} record.
 */
@DisplayName("CorrelationContext")
class CorrelationContextTest {

    @Test
    @DisplayName("should create context with all fields populated")
    void shouldCreateWithAllFields() {
        var ctx = new CorrelationContext("corr-001", "192.168.1.20", "/webhook");

        assertThat(ctx.correlationId()).isEqualTo("corr-001");
        assertThat(ctx.sourceAddress()).isEqualTo("192.168.1.20");
        assertThat(ctx.requestPath()).isEqualTo("/webhook");
    }

    @Test
    @DisplayName("of() leaves optional fields null")
    void ofLeavesOptionalFieldsNull() {
        var ctx = CorrelationContext.of("corr-001");

        assertThat(ctx.sourceAddress()).isNull();
        assertThat(ctx.requestPath()).isNull();
    }

    @Test
    @DisplayName("should reject null or blank correlationId")
    void shouldRejectMissingCorrelationId() {
        assertThatThrownBy(() -> new CorrelationContext(null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
        assertThatThrownBy(() -> CorrelationContext.of("  "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
    }

    @Test
    @DisplayName("should expose MDC key names")
    void shouldExposeMdcKeys() {
        assertThat(CorrelationContext.MDC_CORRELATION_ID).isEqualTo("correlationId");
        assertThat(CorrelationContext.MDC_SOURCE_ADDRESS).isEqualTo("sourceAddress");
        assertThat(CorrelationContext.MDC_REQUEST_PATH).isEqualTo("requestPath");
    }
}
