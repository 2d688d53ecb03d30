package com.portico.gateway.security;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunto de claims de un token verificado.
 *
 * Se crea por solicitud, sólo tras una verificación exitosa, y se adjunta a los
 * atributos del intercambio. Nunca se comparte entre solicitudes.
 */
public final class ClaimSet {

    public static final String ROLES_CLAIM = "roles";

    private final String subject;
    private final List<String> roles;
    private final Map<String, Object> claims;

    public ClaimSet(String subject, List<String> roles, Map<String, Object> claims) {
        this.subject = Objects.requireNonNull(subject, "subject");
        this.roles = roles == null ? List.of() : List.copyOf(roles);
        this.claims = claims == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }

    public String getSubject() {
        return subject;
    }

    /**
     * @return Roles en el orden del token; vacío si el claim no existe
     */
    public List<String> getRoles() {
        return roles;
    }

    /**
     * Acceso genérico de sólo lectura a todos los claims del token.
     *
     * @return Mapa inmutable nombre → valor
     */
    public Map<String, Object> getClaims() {
        return claims;
    }

    @Override
    public String toString() {
        return "ClaimSet[subject=" + subject + ", roles=" + roles + "]";
    }
}
