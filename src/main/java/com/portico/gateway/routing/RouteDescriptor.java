package com.portico.gateway.routing;

import com.portico.gateway.exception.GatewayConfigurationException;

/**
 * Descriptor inmutable de una ruta: asocia un prefijo de path con un servicio backend.
 */
public final class RouteDescriptor {

    private final String name;
    private final String pathPrefix;
    private final String targetUrl;
    private final String stripPrefix;
    private final boolean authRequired;

    public RouteDescriptor(String name, String pathPrefix, String targetUrl, String stripPrefix, boolean authRequired) {
        if (name == null || name.isBlank()) {
            throw new GatewayConfigurationException("Todo servicio necesita un nombre");
        }
        if (pathPrefix == null || !pathPrefix.startsWith("/")) {
            throw new GatewayConfigurationException(
                    "Servicio '" + name + "': path-prefix debe comenzar con '/': " + pathPrefix);
        }
        if (targetUrl == null || targetUrl.isBlank()) {
            throw new GatewayConfigurationException("Servicio '" + name + "': target-url es obligatorio");
        }
        this.name = name;
        this.pathPrefix = trimTrailingSlash(pathPrefix);
        this.targetUrl = targetUrl.trim();
        this.stripPrefix = stripPrefix == null ? "" : stripPrefix;
        this.authRequired = authRequired;
    }

    private static String trimTrailingSlash(String prefix) {
        String trimmed = prefix;
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getName() {
        return name;
    }

    public String getPathPrefix() {
        return pathPrefix;
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    /**
     * @return Prefijo a eliminar del path saliente; vacío si no se reescribe
     */
    public String getStripPrefix() {
        return stripPrefix;
    }

    public boolean hasStripPrefix() {
        return !stripPrefix.isEmpty();
    }

    public boolean isAuthRequired() {
        return authRequired;
    }

    @Override
    public String toString() {
        return "RouteDescriptor[name=" + name + ", pathPrefix=" + pathPrefix + ", targetUrl=" + targetUrl
                + ", stripPrefix=" + stripPrefix + ", authRequired=" + authRequired + "]";
    }
}
