package com.portico.gateway.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.UUID;

/**
 * Filtro para el registro de solicitudes HTTP.
 *
 * Para cada solicitud:
 * - Reutiliza el X-Request-ID recibido o genera uno nuevo
 * - Lo devuelve en la respuesta y lo reenvía al backend
 * - Registra método, URI, estado y duración con el nivel según el resultado
 */
@Component
public class LoggingFilter implements WebFilter, Ordered {

    private static final Logger logger = LoggerFactory.getLogger(LoggingFilter.class);

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_ATTRIBUTE = "requestId";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String inbound = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
        String requestId = StringUtils.hasText(inbound) ? inbound : UUID.randomUUID().toString();
        long startTime = System.currentTimeMillis();

        ServerHttpRequest request = exchange.getRequest().mutate()
                .headers(headers -> headers.set(REQUEST_ID_HEADER, requestId))
                .build();
        ServerWebExchange tracked = exchange.mutate().request(request).build();

        tracked.getAttributes().put(REQUEST_ID_ATTRIBUTE, requestId);
        tracked.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);

        logger.debug("[{}] Request started: {} {} from {}",
                requestId, request.getMethod(), request.getURI(), request.getRemoteAddress());

        if (logger.isTraceEnabled()) {
            request.getHeaders().forEach((name, values) -> {
                if (isLoggableHeader(name)) {
                    logger.trace("[{}] Header {}: {}", requestId, name, String.join(", ", values));
                }
            });
        }

        return chain.filter(tracked)
                .doFinally(signalType -> {
                    long duration = System.currentTimeMillis() - startTime;
                    HttpStatusCode statusCode = tracked.getResponse().getStatusCode();

                    if (statusCode == null) {
                        logger.warn("[{}] Request ended without status code: {} {} - {} - Duration: {}ms",
                                requestId, request.getMethod(), request.getURI(), signalType, duration);
                    } else if (statusCode.is5xxServerError()) {
                        logger.error("[{}] Request failed: {} {} - Status: {} - Duration: {}ms",
                                requestId, request.getMethod(), request.getURI(), statusCode.value(), duration);
                    } else if (statusCode.is4xxClientError()) {
                        logger.warn("[{}] Request rejected: {} {} - Status: {} - Duration: {}ms",
                                requestId, request.getMethod(), request.getURI(), statusCode.value(), duration);
                    } else {
                        logger.info("[{}] Request completed: {} {} - Status: {} - Duration: {}ms",
                                requestId, request.getMethod(), request.getURI(), statusCode.value(), duration);
                    }
                });
    }

    /**
     * Authorization nunca se registra.
     */
    static boolean isLoggableHeader(String headerName) {
        String name = headerName.toLowerCase(Locale.ROOT);
        return name.startsWith("x-")
                || name.equals("content-type")
                || name.equals("user-agent")
                || name.equals("accept")
                || name.equals("origin");
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }
}
