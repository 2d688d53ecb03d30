package com.portico.gateway.exception;

import com.portico.gateway.filter.LoggingFilter;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Manejador global de excepciones para el gateway.
 *
 * Traduce las excepciones no manejadas de la cadena de filtros a respuestas JSON:
 * - fallos de conectividad con el backend (conexión rechazada, host desconocido,
 *   timeout, cierre prematuro) a 502
 * - {@link ResponseStatusException} conserva su código
 * - cualquier otra excepción a 500
 *
 * El detalle técnico sólo se registra en el log.
 */
@Component
@Order(-2) // Antes del manejador de errores predeterminado de Spring Boot
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ErrorResponseBuilder errorResponseBuilder;

    public GlobalExceptionHandler(ErrorResponseBuilder errorResponseBuilder) {
        this.errorResponseBuilder = errorResponseBuilder;
    }

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        ServerHttpResponse response = exchange.getResponse();
        if (response.isCommitted()) {
            logger.warn("Respuesta ya enviada, no se puede escribir el error: {}", ex.toString());
            return Mono.error(ex);
        }

        String path = exchange.getRequest().getPath().value();
        String requestId = exchange.getAttribute(LoggingFilter.REQUEST_ID_ATTRIBUTE);

        HttpStatusCode statusCode;
        Map<String, Object> errorResponse;

        if (isUpstreamFailure(ex)) {
            statusCode = HttpStatus.BAD_GATEWAY;
            errorResponse = errorResponseBuilder.buildBadGatewayError(path, requestId);
            logger.warn("[{}] Backend no disponible para ruta {}: {}", requestId, path, ex.toString());
        } else if (ex instanceof ResponseStatusException) {
            statusCode = ((ResponseStatusException) ex).getStatusCode();
            HttpStatus resolved = HttpStatus.resolve(statusCode.value());
            String reasonPhrase = resolved != null ? resolved.getReasonPhrase() : String.valueOf(statusCode.value());
            errorResponse = errorResponseBuilder.buildError(
                    statusCode.value(),
                    resolved != null ? resolved.name() : String.valueOf(statusCode.value()),
                    reasonPhrase,
                    reasonPhrase,
                    path,
                    requestId);
            logger.debug("[{}] {} en ruta {}", requestId, statusCode.value(), path);
        } else {
            statusCode = HttpStatus.INTERNAL_SERVER_ERROR;
            errorResponse = errorResponseBuilder.buildInternalServerError(path, requestId);
            logger.error("[{}] Error interno del servidor para ruta {}", requestId, path, ex);
        }

        byte[] responseBytes = errorResponseBuilder.toJson(errorResponse).getBytes(StandardCharsets.UTF_8);
        DataBuffer buffer = response.bufferFactory().wrap(responseBytes);

        response.setStatusCode(statusCode);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return response.writeWith(Mono.just(buffer));
    }

    /**
     * Recorre la cadena de causas buscando un fallo de conectividad con el backend.
     */
    static boolean isUpstreamFailure(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof ConnectException
                    || current instanceof UnknownHostException
                    || current instanceof TimeoutException
                    || current instanceof ReadTimeoutException
                    || current instanceof PrematureCloseException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
