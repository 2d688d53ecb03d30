package com.portico.gateway.exception;

/**
 * Error de configuración detectado al arrancar. Impide que el gateway empiece a servir.
 */
public class GatewayConfigurationException extends RuntimeException {

    public GatewayConfigurationException(String message) {
        super(message);
    }

    public GatewayConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
