package com.portico.gateway.monitoring;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GatewayMetrics")
class GatewayMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final GatewayMetrics metrics = new GatewayMetrics(registry);

    @Test
    @DisplayName("auth rejections are counted per reason")
    void authRejections() {
        metrics.recordAuthRejection("missing_header");
        metrics.recordAuthRejection("missing_header");
        metrics.recordAuthRejection("token_expired");

        assertThat(registry.get(GatewayMetrics.AUTH_REJECTIONS).tag("reason", "missing_header").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get(GatewayMetrics.AUTH_REJECTIONS).tag("reason", "token_expired").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("downstream responses are tagged by service and status")
    void downstreamResponses() {
        metrics.recordDownstreamResponse("catalog", 200);

        assertThat(registry.get(GatewayMetrics.DOWNSTREAM_RESPONSES)
                .tags("service", "catalog", "status", "200").counter().count()).isEqualTo(1.0);
    }
}
