package com.portico.gateway.config;

import com.portico.gateway.exception.GatewayConfigurationException;
import com.portico.gateway.routing.RouteDescriptor;
import com.portico.gateway.routing.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Construye la {@link GatewayConfig} a partir de las propiedades declaradas,
 * aplicando las sobrescrituras por variables de entorno y validando el resultado.
 *
 * Sobrescrituras soportadas:
 * - JWT_SECRET reemplaza gateway.jwt-secret
 * - la variable env-var de cada servicio (o NOMBRE_SERVICE_URL) reemplaza su target-url
 */
public class GatewayConfigFactory {

    private static final Logger logger = LoggerFactory.getLogger(GatewayConfigFactory.class);

    static final String SECRET_VARIABLE = "JWT_SECRET";
    static final String SERVICE_URL_SUFFIX = "_SERVICE_URL";
    static final int MIN_SECRET_BYTES = 32;

    private final Environment environment;

    public GatewayConfigFactory(Environment environment) {
        this.environment = environment;
    }

    /**
     * @param properties Propiedades enlazadas desde application.yml
     * @return Configuración validada
     * @throws GatewayConfigurationException si la configuración no es válida
     */
    public GatewayConfig create(GatewayProperties properties) {
        String secret = resolveSecret(properties.getJwtSecret());

        List<RouteDescriptor> routes = new ArrayList<>();
        for (GatewayProperties.ServiceProperties service : properties.getServices()) {
            if (!StringUtils.hasText(service.getName())) {
                throw new GatewayConfigurationException("Todo servicio necesita un nombre");
            }
            routes.add(new RouteDescriptor(
                    service.getName(),
                    service.getPathPrefix(),
                    resolveTargetUrl(service),
                    service.getStripPrefix(),
                    service.isAuthRequired()));
        }

        if (properties.getClockSkewSeconds() < 0) {
            throw new GatewayConfigurationException("clock-skew-seconds no puede ser negativo");
        }

        int listenPort = environment.getProperty("server.port", Integer.class, 8080);
        GatewayConfig config = new GatewayConfig(
                listenPort,
                secret,
                Duration.ofSeconds(properties.getClockSkewSeconds()),
                new ServiceRegistry(routes));

        logger.info("Configuración del gateway cargada: {}", config);
        return config;
    }

    private String resolveSecret(String configured) {
        String secret = configured;
        String fromEnvironment = environment.getProperty(SECRET_VARIABLE);
        if (StringUtils.hasText(fromEnvironment)) {
            secret = fromEnvironment;
            logger.info("Secreto JWT tomado de la variable {}", SECRET_VARIABLE);
        }

        if (!StringUtils.hasText(secret)) {
            throw new GatewayConfigurationException("gateway.jwt-secret es obligatorio");
        }
        int length = secret.getBytes(StandardCharsets.UTF_8).length;
        if (length < MIN_SECRET_BYTES) {
            throw new GatewayConfigurationException("El secreto JWT debe tener al menos " + MIN_SECRET_BYTES
                    + " bytes para HMAC-SHA256 (actual: " + length + ")");
        }
        return secret;
    }

    private String resolveTargetUrl(GatewayProperties.ServiceProperties service) {
        String variable = StringUtils.hasText(service.getEnvVar())
                ? service.getEnvVar()
                : defaultVariableName(service.getName());

        String override = environment.getProperty(variable);
        if (StringUtils.hasText(override)) {
            logger.info("URL del servicio sobrescrita desde el entorno: servicio={}, variable={}",
                    service.getName(), variable);
            return override;
        }
        return service.getTargetUrl();
    }

    static String defaultVariableName(String serviceName) {
        return serviceName.replace('-', '_').toUpperCase(Locale.ROOT) + SERVICE_URL_SUFFIX;
    }
}
