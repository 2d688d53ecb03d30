package com.portico.gateway.config;

import com.portico.gateway.routing.ServiceRegistry;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Configuración validada e inmutable del gateway.
 * Se construye antes de servir la primera solicitud y no cambia después.
 */
public final class GatewayConfig {

    private final int listenPort;
    private final String signingSecret;
    private final Duration clockSkew;
    private final ServiceRegistry serviceRegistry;

    public GatewayConfig(int listenPort, String signingSecret, Duration clockSkew, ServiceRegistry serviceRegistry) {
        this.listenPort = listenPort;
        this.signingSecret = signingSecret;
        this.clockSkew = clockSkew;
        this.serviceRegistry = serviceRegistry;
    }

    public int getListenPort() {
        return listenPort;
    }

    public byte[] getSigningKeyBytes() {
        return signingSecret.getBytes(StandardCharsets.UTF_8);
    }

    public Duration getClockSkew() {
        return clockSkew;
    }

    public ServiceRegistry getServiceRegistry() {
        return serviceRegistry;
    }

    @Override
    public String toString() {
        // El secreto nunca se imprime
        return "GatewayConfig[listenPort=" + listenPort + ", services=" + serviceRegistry.size()
                + ", clockSkew=" + clockSkew + "]";
    }
}
