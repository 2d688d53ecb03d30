package com.portico.gateway.routing;

import com.portico.gateway.monitoring.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;

/**
 * Observa las respuestas de los servicios downstream con fines de logging y métricas.
 *
 * Nunca modifica la respuesta y sus propios errores no hacen fallar la solicitud.
 */
@Component
public class DownstreamResponseObserver {

    private static final Logger logger = LoggerFactory.getLogger(DownstreamResponseObserver.class);

    private final GatewayMetrics metrics;

    public DownstreamResponseObserver(GatewayMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * @param route Ruta que atendió la solicitud
     * @param status Código devuelto por el backend (puede ser null si no llegó a fijarse)
     * @param originalPath Path recibido por el gateway
     * @param outboundPath Path enviado al backend
     */
    public void onResponse(RouteDescriptor route, HttpStatusCode status, String originalPath, String outboundPath) {
        try {
            int statusValue = status != null ? status.value() : 0;
            logger.info("Respuesta de downstream: service={}, target={}, status={}, path={}, upstreamPath={}",
                    route.getName(), route.getTargetUrl(), statusValue, originalPath, outboundPath);
            metrics.recordDownstreamResponse(route.getName(), statusValue);
        } catch (RuntimeException e) {
            logger.warn("Error observando respuesta de {}: {}", route.getName(), e.getMessage(), e);
        }
    }
}
