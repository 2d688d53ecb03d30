package com.portico.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portico.gateway.filter.IdentityGatewayFilter;
import com.portico.gateway.monitoring.GatewayMetrics;
import com.portico.gateway.routing.GatewayDispatcher;
import com.portico.gateway.routing.UpstreamForwarderFactory;
import com.portico.gateway.security.TokenVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cloud.gateway.route.RouteLocator;
import org.springframework.cloud.gateway.route.builder.RouteLocatorBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Configuración del pipeline de despacho: configuración validada, verificador de
 * tokens, middleware de identidad y tabla de rutas.
 *
 * Todas las dependencias se inyectan por constructor; ninguna se obtiene de estado global.
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class RoutingConfig {

    private static final Logger logger = LoggerFactory.getLogger(RoutingConfig.class);

    @Bean
    public GatewayConfig gatewayConfig(GatewayProperties properties, Environment environment) {
        return new GatewayConfigFactory(environment).create(properties);
    }

    @Bean
    public TokenVerifier tokenVerifier(GatewayConfig gatewayConfig, ObjectMapper objectMapper) {
        return new TokenVerifier(gatewayConfig.getSigningKeyBytes(), gatewayConfig.getClockSkew(), objectMapper);
    }

    @Bean
    public IdentityGatewayFilter identityGatewayFilter(TokenVerifier tokenVerifier, GatewayMetrics metrics) {
        return new IdentityGatewayFilter(tokenVerifier, metrics);
    }

    @Bean
    public GatewayDispatcher gatewayDispatcher(RouteLocatorBuilder builder,
                                               UpstreamForwarderFactory forwarderFactory,
                                               IdentityGatewayFilter identityGatewayFilter) {
        return new GatewayDispatcher(builder, forwarderFactory, identityGatewayFilter);
    }

    /**
     * Rutas de los servicios configurados.
     *
     * @param dispatcher Constructor de la tabla de rutas
     * @param gatewayConfig Configuración validada
     * @return RouteLocator configurado
     */
    @Bean
    public RouteLocator serviceRoutes(GatewayDispatcher dispatcher, GatewayConfig gatewayConfig) {
        logger.info("Configurando rutas para {} servicios", gatewayConfig.getServiceRegistry().size());
        return dispatcher.buildRouter(gatewayConfig);
    }
}
