package com.portico.gateway.routing;

import com.portico.gateway.security.IdentityHeaders;
import org.springframework.cloud.gateway.filter.GatewayFilter;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Map;

import static org.springframework.cloud.gateway.support.ServerWebExchangeUtils.addOriginalRequestUrl;

/**
 * Filtro de proxy inverso de un servicio.
 *
 * Reescribe el path saliente (strip-prefix y path base del destino), vuelve a aplicar
 * los headers de identidad después de la reescritura y, cuando el backend responde,
 * notifica al observador. El host de destino lo fija la URI de la ruta; el envío lo
 * hace el NettyRoutingFilter de Spring Cloud Gateway.
 */
public class UpstreamForwarder implements GatewayFilter, Ordered {

    /**
     * Se ejecuta antes de RouteToRequestUrlFilter (10000), que combina el path con la URI de la ruta.
     */
    public static final int ORDER = 2000;

    private final RouteDescriptor route;
    private final URI targetUri;
    private final String basePath;
    private final DownstreamResponseObserver observer;

    UpstreamForwarder(RouteDescriptor route, URI targetUri, DownstreamResponseObserver observer) {
        this.route = route;
        this.targetUri = targetUri;
        this.basePath = normalizeBasePath(targetUri.getRawPath());
        this.observer = observer;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();

        // Headers de identidad antes de la reescritura (middleware o cliente en rutas públicas)
        Map<String, String> identity = IdentityHeaders.capture(request.getHeaders());

        String originalPath = request.getURI().getRawPath();
        String outboundPath = rewritePath(originalPath);

        addOriginalRequestUrl(exchange, request.getURI());

        ServerHttpRequest outbound = request.mutate()
                .path(outboundPath)
                .headers(headers -> identity.forEach(headers::set))
                .build();
        ServerWebExchange forwarded = exchange.mutate().request(outbound).build();

        return chain.filter(forwarded)
                .then(Mono.fromRunnable(() -> observer.onResponse(
                        route, forwarded.getResponse().getStatusCode(), originalPath, outboundPath)));
    }

    /**
     * Calcula el path que recibirá el backend.
     *
     * @param rawPath Path recibido (codificado)
     * @return Path sin una ocurrencia inicial de strip-prefix, precedido del path base del destino
     */
    String rewritePath(String rawPath) {
        String path = rawPath == null ? "" : rawPath;

        if (route.hasStripPrefix() && path.startsWith(route.getStripPrefix())) {
            path = path.substring(route.getStripPrefix().length());
        }
        if (!path.isEmpty() && !path.startsWith("/")) {
            path = "/" + path;
        }

        path = basePath + path;
        return path.isEmpty() ? "/" : path;
    }

    private static String normalizeBasePath(String rawPath) {
        if (rawPath == null) {
            return "";
        }
        String base = rawPath;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    public RouteDescriptor getRoute() {
        return route;
    }

    public URI getTargetUri() {
        return targetUri;
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
