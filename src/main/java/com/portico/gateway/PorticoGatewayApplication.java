package com.portico.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.reactive.ReactiveUserDetailsServiceAutoConfiguration;

// Sin usuarios en memoria: la autenticación la hace el filtro de identidad por ruta
@SpringBootApplication(exclude = ReactiveUserDetailsServiceAutoConfiguration.class)
public class PorticoGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(PorticoGatewayApplication.class, args);
    }
}
