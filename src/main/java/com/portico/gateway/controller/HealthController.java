package com.portico.gateway.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Endpoint de liveness. No requiere autenticación y no depende del registro de servicios.
 *
 * Responde 200 con cualquier header Accept: el tipo de contenido se fija en la respuesta
 * y no como condición del mapeo.
 */
@RestController
public class HealthController {

    static final String HEALTHY = "OK";

    @GetMapping("/healthz")
    public Mono<ResponseEntity<String>> healthz() {
        return Mono.just(ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(HEALTHY));
    }
}
