package com.portico.gateway.routing;

import com.portico.gateway.config.GatewayConfig;
import com.portico.gateway.filter.IdentityGatewayFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.gateway.route.RouteLocator;
import org.springframework.cloud.gateway.route.builder.RouteLocatorBuilder;

/**
 * Construye la tabla de rutas del gateway a partir del registro de servicios.
 *
 * Por cada servicio:
 * - crea su {@link UpstreamForwarder} (un error aquí impide arrancar)
 * - antepone {@link IdentityGatewayFilter} si la ruta requiere autenticación
 * - registra el prefijo exacto y el patrón anidado "prefijo/**"
 *
 * Spring Cloud Gateway elige la primera ruta que coincide, así que el orden de cada
 * ruta se deriva del número de segmentos del prefijo: los prefijos más específicos
 * se evalúan primero.
 */
public class GatewayDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(GatewayDispatcher.class);

    private final RouteLocatorBuilder routeLocatorBuilder;
    private final UpstreamForwarderFactory forwarderFactory;
    private final IdentityGatewayFilter identityFilter;

    public GatewayDispatcher(RouteLocatorBuilder routeLocatorBuilder,
                             UpstreamForwarderFactory forwarderFactory,
                             IdentityGatewayFilter identityFilter) {
        this.routeLocatorBuilder = routeLocatorBuilder;
        this.forwarderFactory = forwarderFactory;
        this.identityFilter = identityFilter;
    }

    /**
     * @param config Configuración validada
     * @return RouteLocator con una ruta por servicio
     */
    public RouteLocator buildRouter(GatewayConfig config) {
        RouteLocatorBuilder.Builder routes = routeLocatorBuilder.routes();

        for (RouteDescriptor descriptor : config.getServiceRegistry()) {
            UpstreamForwarder forwarder = forwarderFactory.create(descriptor);

            routes.route(descriptor.getName(), r -> r
                    .order(precedence(descriptor.getPathPrefix()))
                    .path(pathPatterns(descriptor.getPathPrefix()))
                    .filters(f -> {
                        if (descriptor.isAuthRequired()) {
                            f.filter(identityFilter, IdentityGatewayFilter.ORDER);
                        }
                        return f.filter(forwarder, UpstreamForwarder.ORDER);
                    })
                    .uri(forwarder.getTargetUri()));

            logger.info("Servicio registrado: name={}, prefix={}, target={}, strip={}, auth={}",
                    descriptor.getName(), descriptor.getPathPrefix(), descriptor.getTargetUrl(),
                    descriptor.getStripPrefix(), descriptor.isAuthRequired());
        }

        if (config.getServiceRegistry().isEmpty()) {
            logger.warn("No hay servicios configurados; sólo /healthz estará disponible");
        }
        return routes.build();
    }

    /**
     * Patrones registrados para un prefijo: el exacto y cualquier sub-path.
     */
    static String[] pathPatterns(String prefix) {
        if ("/".equals(prefix)) {
            return new String[] {"/**"};
        }
        return new String[] {prefix, prefix + "/**"};
    }

    /**
     * Orden de la ruta: a más segmentos, menor valor (mayor prioridad).
     */
    static int precedence(String prefix) {
        int segments = 0;
        for (String segment : prefix.split("/")) {
            if (!segment.isEmpty()) {
                segments++;
            }
        }
        return -segments;
    }
}
