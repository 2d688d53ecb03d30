package com.portico.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * Configuración CORS (Cross-Origin Resource Sharing) para el gateway.
 *
 * El filtro se ejecuta antes del enrutamiento: las solicitudes preflight se responden
 * aquí y nunca llegan al middleware de identidad ni a los backends.
 */
@Configuration
public class CorsConfig {

    private static final Logger logger = LoggerFactory.getLogger(CorsConfig.class);

    @Value("${gateway.cors.allowed-origins:*}")
    private List<String> allowedOrigins;

    @Value("${gateway.cors.allowed-methods:GET,POST,PUT,PATCH,DELETE,OPTIONS}")
    private List<String> allowedMethods;

    @Value("${gateway.cors.allowed-headers:Accept,Authorization,Content-Type,X-CSRF-Token,X-User-Subject,X-User-Id,X-User-Roles}")
    private List<String> allowedHeaders;

    @Value("${gateway.cors.exposed-headers:Link}")
    private List<String> exposedHeaders;

    @Value("${gateway.cors.max-age:300}")
    private Long maxAge;

    @Value("${gateway.cors.allow-credentials:true}")
    private Boolean allowCredentials;

    /**
     * Configura el filtro CORS centralizado.
     *
     * @return CorsWebFilter configurado
     */
    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE + 10)
    public CorsWebFilter corsWebFilter() {
        logger.info("Inicializando configuración CORS con orígenes: {}", allowedOrigins);

        CorsConfiguration corsConfig = new CorsConfiguration();

        // Patrones en lugar de orígenes: "*" no se admite junto con credenciales
        corsConfig.setAllowedOriginPatterns(allowedOrigins);
        corsConfig.setAllowedMethods(allowedMethods);
        corsConfig.setAllowedHeaders(allowedHeaders);
        corsConfig.setExposedHeaders(exposedHeaders);
        corsConfig.setMaxAge(maxAge);
        corsConfig.setAllowCredentials(allowCredentials);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", corsConfig);

        logger.debug("Configuración CORS: métodos={}, headers={}, expuestos={}, maxAge={}s, credenciales={}",
                allowedMethods, allowedHeaders, exposedHeaders, maxAge, allowCredentials);
        return new CorsWebFilter(source);
    }
}
