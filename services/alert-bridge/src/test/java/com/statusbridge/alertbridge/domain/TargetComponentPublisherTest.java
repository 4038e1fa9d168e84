package com.statusbridge.alertbridge.domain;

import com.statusbridge.alertbridge.domain.ports.GatewayException;
import com.statusbridge.alertbridge.domain.ports.StatusPageGateway;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("TargetComponentPublisher")
class TargetComponentPublisherTest {

    private static final List<String> WEB = List.of("Web");

    private final TargetStateStore store = new TargetStateStore();
    private final StatusPageGateway gateway = mock(StatusPageGateway.class);
    private final TargetComponentPublisher publisher = new TargetComponentPublisher(store, gateway);

    @Test
    @DisplayName("should publish once per change")
    void shouldPublishOncePerChange() {
        store.apply(AlertEvent.firing("InstanceDown", "a", WEB, false));

        assertThat(publisher.publish("a | Web")).isTrue();
        assertThat(publisher.publish("a | Web")).isTrue();

        verify(gateway, times(1)).publishTargetState(any());
    }

    @Test
    @DisplayName("should leave the target pending after a failure and send it later")
    void shouldRetryLater() {
        store.apply(AlertEvent.firing("InstanceDown", "a", WEB, false));
        doThrow(new GatewayException("publishTargetState", true, "503", null))
                .doNothing()
                .when(gateway).publishTargetState(any());

        assertThat(publisher.publish("a | Web")).isFalse();
        assertThat(store.hasPendingPublication("a | Web")).isTrue();
        assertThat(publisher.publish("a | Web")).isTrue();

        verify(gateway, times(2)).publishTargetState(any());
    }

    @Test
    @DisplayName("should do nothing for unknown targets")
    void shouldIgnoreUnknown() {
        assertThat(publisher.publish("nope")).isTrue();

        verifyNoInteractions(gateway);
    }
}
