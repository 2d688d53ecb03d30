package com.portico.gateway.routing;

import com.portico.gateway.exception.ForwarderConstructionException;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Crea un {@link UpstreamForwarder} por servicio al construir el router.
 * Una URL de destino inválida es un error fatal de arranque.
 */
@Component
public class UpstreamForwarderFactory {

    private final DownstreamResponseObserver observer;

    public UpstreamForwarderFactory(DownstreamResponseObserver observer) {
        this.observer = observer;
    }

    /**
     * @param route Descriptor del servicio
     * @return Forwarder listo para registrarse en la ruta
     * @throws ForwarderConstructionException si target-url no es una URL http(s) absoluta
     */
    public UpstreamForwarder create(RouteDescriptor route) {
        URI target;
        try {
            target = new URI(route.getTargetUrl());
        } catch (URISyntaxException e) {
            throw new ForwarderConstructionException(route.getName(),
                    "target-url inválida: " + route.getTargetUrl(), e);
        }

        if (!target.isAbsolute() || target.getHost() == null) {
            throw new ForwarderConstructionException(route.getName(),
                    "target-url debe ser una URL absoluta con host: " + route.getTargetUrl());
        }
        String scheme = target.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new ForwarderConstructionException(route.getName(),
                    "esquema no soportado en target-url: " + target.getScheme());
        }

        return new UpstreamForwarder(route, target, observer);
    }
}
