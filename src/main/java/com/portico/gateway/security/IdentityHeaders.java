package com.portico.gateway.security;

import org.springframework.http.HttpHeaders;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Headers de identidad que el gateway propaga hacia los servicios downstream.
 *
 * Sus valores provienen únicamente de claims verificados localmente. Cualquier copia
 * enviada por el cliente se considera no confiable y se sobrescribe.
 */
public final class IdentityHeaders {

    public static final String USER_SUBJECT = "X-User-Subject";
    public static final String USER_ID = "X-User-Id";
    public static final String USER_ROLES = "X-User-Roles";

    public static final List<String> ALL = List.of(USER_SUBJECT, USER_ID, USER_ROLES);

    private IdentityHeaders() {
    }

    /**
     * Elimina las copias entrantes de los headers de identidad y escribe los valores
     * derivados del conjunto de claims.
     *
     * @param headers Headers mutables de la solicitud saliente
     * @param claims Claims verificados del token
     */
    public static void overwrite(HttpHeaders headers, ClaimSet claims) {
        ALL.forEach(headers::remove);

        headers.set(USER_SUBJECT, claims.getSubject());
        headers.set(USER_ID, claims.getSubject());

        if (!claims.getRoles().isEmpty()) {
            headers.set(USER_ROLES, String.join(",", claims.getRoles()));
        }
    }

    /**
     * Captura los headers de identidad presentes en una solicitud.
     *
     * @param headers Headers de la solicitud
     * @return Mapa nombre → valor, sólo con los headers presentes y no vacíos
     */
    public static Map<String, String> capture(HttpHeaders headers) {
        Map<String, String> identity = new LinkedHashMap<>();
        for (String name : ALL) {
            String value = headers.getFirst(name);
            if (value != null && !value.isEmpty()) {
                identity.put(name, value);
            }
        }
        return identity;
    }
}
