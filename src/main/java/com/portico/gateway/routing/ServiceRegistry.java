package com.portico.gateway.routing;

import com.portico.gateway.exception.GatewayConfigurationException;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lista ordenada e inmutable de rutas configuradas.
 * El orden es el de registro; nombres y prefijos son únicos.
 */
public final class ServiceRegistry implements Iterable<RouteDescriptor> {

    private final List<RouteDescriptor> routes;

    public ServiceRegistry(List<RouteDescriptor> routes) {
        this.routes = List.copyOf(routes);

        Set<String> names = new HashSet<>();
        Set<String> prefixes = new HashSet<>();
        for (RouteDescriptor route : this.routes) {
            if (!names.add(route.getName())) {
                throw new GatewayConfigurationException("Nombre de servicio duplicado: " + route.getName());
            }
            if (!prefixes.add(route.getPathPrefix())) {
                throw new GatewayConfigurationException("Prefijo duplicado: " + route.getPathPrefix()
                        + " (servicio '" + route.getName() + "')");
            }
        }
    }

    public static ServiceRegistry empty() {
        return new ServiceRegistry(List.of());
    }

    public List<RouteDescriptor> getRoutes() {
        return routes;
    }

    public Optional<RouteDescriptor> findByName(String name) {
        return routes.stream().filter(route -> route.getName().equals(name)).findFirst();
    }

    public int size() {
        return routes.size();
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }

    @Override
    public Iterator<RouteDescriptor> iterator() {
        return routes.iterator();
    }
}
