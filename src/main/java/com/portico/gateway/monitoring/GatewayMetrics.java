package com.portico.gateway.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Contadores del pipeline de despacho: rechazos de autenticación por motivo y
 * respuestas de los servicios downstream por servicio y código.
 */
@Component
public class GatewayMetrics {

    static final String AUTH_REJECTIONS = "gateway.auth.rejections";
    static final String DOWNSTREAM_RESPONSES = "gateway.downstream.responses";

    private final MeterRegistry registry;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registra una solicitud rechazada por el middleware de identidad.
     *
     * @param reason Motivo del rechazo (missing_header, invalid_format o el tipo de error del token)
     */
    public void recordAuthRejection(String reason) {
        Counter.builder(AUTH_REJECTIONS)
                .description("Number of requests rejected by token authentication")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Registra una respuesta recibida de un servicio downstream.
     */
    public void recordDownstreamResponse(String service, int status) {
        Counter.builder(DOWNSTREAM_RESPONSES)
                .description("Responses received from downstream services")
                .tag("service", service)
                .tag("status", String.valueOf(status))
                .register(registry)
                .increment();
    }
}
