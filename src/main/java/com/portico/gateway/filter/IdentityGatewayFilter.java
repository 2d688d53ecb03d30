package com.portico.gateway.filter;

import com.portico.gateway.monitoring.GatewayMetrics;
import com.portico.gateway.security.ClaimSet;
import com.portico.gateway.security.IdentityHeaders;
import com.portico.gateway.security.TokenVerificationException;
import com.portico.gateway.security.TokenVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.gateway.filter.GatewayFilter;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.core.Ordered;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Filtro de autenticación para las rutas protegidas.
 *
 * Este filtro:
 * - Exige un header Authorization con la forma "Bearer &lt;token&gt;"
 * - Verifica el token con {@link TokenVerifier}
 * - Sobrescribe los headers de identidad con los claims verificados
 * - Adjunta los claims a los atributos del intercambio
 * - Rechaza con 401 y un mensaje fijo cualquier solicitud no autenticada
 *
 * El detalle del fallo sólo se registra en el log; el cliente recibe siempre el mismo texto.
 */
public class IdentityGatewayFilter implements GatewayFilter, Ordered {

    private static final Logger logger = LoggerFactory.getLogger(IdentityGatewayFilter.class);

    public static final int ORDER = 1000;

    public static final String CLAIMS_ATTRIBUTE = IdentityGatewayFilter.class.getName() + ".claims";

    static final String BEARER_PREFIX = "Bearer ";
    static final String MISSING_HEADER_MESSAGE = "Missing Authorization Header";
    static final String INVALID_FORMAT_MESSAGE = "Invalid Authorization Header format";
    static final String INVALID_TOKEN_MESSAGE = "Invalid Token";

    private final TokenVerifier tokenVerifier;
    private final GatewayMetrics metrics;

    public IdentityGatewayFilter(TokenVerifier tokenVerifier, GatewayMetrics metrics) {
        this.tokenVerifier = tokenVerifier;
        this.metrics = metrics;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().value();

        String authorization = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization == null || authorization.isEmpty()) {
            logger.debug("Solicitud rechazada: falta Authorization en ruta protegida {}", path);
            return reject(exchange, MISSING_HEADER_MESSAGE, "missing_header");
        }
        if (!authorization.startsWith(BEARER_PREFIX)) {
            logger.debug("Solicitud rechazada: Authorization sin formato Bearer en {}", path);
            return reject(exchange, INVALID_FORMAT_MESSAGE, "invalid_format");
        }

        String token = authorization.substring(BEARER_PREFIX.length());
        ClaimSet claims;
        try {
            claims = tokenVerifier.verify(token);
        } catch (TokenVerificationException e) {
            logger.warn("Token inválido en ruta {}: {} - {}", path, e.getError(), e.getMessage());
            return reject(exchange, INVALID_TOKEN_MESSAGE, e.getError().name().toLowerCase(Locale.ROOT));
        }

        ServerHttpRequest mutatedRequest = request.mutate()
                .headers(headers -> IdentityHeaders.overwrite(headers, claims))
                .build();
        ServerWebExchange mutatedExchange = exchange.mutate().request(mutatedRequest).build();
        mutatedExchange.getAttributes().put(CLAIMS_ATTRIBUTE, claims);

        logger.debug("Inyectando headers de identidad: subject={}, roles={}, path={}",
                claims.getSubject(), claims.getRoles(), path);

        return chain.filter(mutatedExchange);
    }

    private Mono<Void> reject(ServerWebExchange exchange, String message, String reason) {
        metrics.recordAuthRejection(reason);

        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        response.getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        response.getHeaders().setContentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8));

        DataBuffer buffer = response.bufferFactory().wrap(message.getBytes(StandardCharsets.UTF_8));
        return response.writeWith(Mono.just(buffer));
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
