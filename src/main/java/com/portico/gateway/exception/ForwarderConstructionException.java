package com.portico.gateway.exception;

/**
 * No fue posible construir el proxy de un servicio (URL de destino inválida).
 */
public class ForwarderConstructionException extends GatewayConfigurationException {

    private final String serviceName;

    public ForwarderConstructionException(String serviceName, String message) {
        super("Servicio '" + serviceName + "': " + message);
        this.serviceName = serviceName;
    }

    public ForwarderConstructionException(String serviceName, String message, Throwable cause) {
        super("Servicio '" + serviceName + "': " + message, cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
