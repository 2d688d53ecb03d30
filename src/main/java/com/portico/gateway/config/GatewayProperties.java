package com.portico.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Propiedades del gateway tal como se declaran en application.yml (prefijo "gateway").
 *
 * Se convierten una única vez en {@link GatewayConfig}, que es lo que consume el
 * resto de la aplicación.
 */
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private String jwtSecret;

    private long clockSkewSeconds = 0;

    private List<ServiceProperties> services = new ArrayList<>();

    public String getJwtSecret() {
        return jwtSecret;
    }

    public void setJwtSecret(String jwtSecret) {
        this.jwtSecret = jwtSecret;
    }

    public long getClockSkewSeconds() {
        return clockSkewSeconds;
    }

    public void setClockSkewSeconds(long clockSkewSeconds) {
        this.clockSkewSeconds = clockSkewSeconds;
    }

    public List<ServiceProperties> getServices() {
        return services;
    }

    public void setServices(List<ServiceProperties> services) {
        this.services = services;
    }

    /**
     * Declaración de un servicio backend.
     */
    public static class ServiceProperties {

        private String name;
        private String pathPrefix;
        private String targetUrl;
        private String stripPrefix = "";
        private boolean authRequired;

        // Variable de entorno que sobrescribe target-url; por defecto <NOMBRE>_SERVICE_URL
        private String envVar = "";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getPathPrefix() {
            return pathPrefix;
        }

        public void setPathPrefix(String pathPrefix) {
            this.pathPrefix = pathPrefix;
        }

        public String getTargetUrl() {
            return targetUrl;
        }

        public void setTargetUrl(String targetUrl) {
            this.targetUrl = targetUrl;
        }

        public String getStripPrefix() {
            return stripPrefix;
        }

        public void setStripPrefix(String stripPrefix) {
            this.stripPrefix = stripPrefix;
        }

        public boolean isAuthRequired() {
            return authRequired;
        }

        public void setAuthRequired(boolean authRequired) {
            this.authRequired = authRequired;
        }

        public String getEnvVar() {
            return envVar;
        }

        public void setEnvVar(String envVar) {
            this.envVar = envVar;
        }
    }
}
