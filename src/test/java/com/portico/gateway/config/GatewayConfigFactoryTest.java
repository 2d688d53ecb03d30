package com.portico.gateway.config;

import com.portico.gateway.exception.GatewayConfigurationException;
import com.portico.gateway.routing.RouteDescriptor;
import com.portico.gateway.support.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("GatewayConfigFactory")
class GatewayConfigFactoryTest {

    private MockEnvironment environment;
    private GatewayProperties properties;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        properties = new GatewayProperties();
        properties.setJwtSecret(TestTokens.SECRET);
        properties.setServices(new ArrayList<>());
    }

    private static GatewayProperties.ServiceProperties service(String name, String prefix, String target) {
        GatewayProperties.ServiceProperties service = new GatewayProperties.ServiceProperties();
        service.setName(name);
        service.setPathPrefix(prefix);
        service.setTargetUrl(target);
        return service;
    }

    private GatewayConfig create() {
        return new GatewayConfigFactory(environment).create(properties);
    }

    @Test
    @DisplayName("builds the registry in declaration order")
    void buildsRegistry() {
        GatewayProperties.ServiceProperties users = service("users", "/api/users/", "http://users:8081");
        users.setAuthRequired(true);
        GatewayProperties.ServiceProperties catalog = service("catalog", "/api/catalog", "http://catalog:8082");
        catalog.setStripPrefix("/api/catalog");
        properties.setServices(List.of(users, catalog));
        properties.setClockSkewSeconds(30);
        environment.setProperty("server.port", "9090");

        GatewayConfig config = create();

        assertThat(config.getListenPort()).isEqualTo(9090);
        assertThat(config.getClockSkew()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getSigningKeyBytes()).isEqualTo(TestTokens.SECRET.getBytes(StandardCharsets.UTF_8));
        assertThat(config.getServiceRegistry().getRoutes())
                .extracting(RouteDescriptor::getName, RouteDescriptor::getPathPrefix, RouteDescriptor::isAuthRequired)
                .containsExactly(
                        tuple("users", "/api/users", true),
                        tuple("catalog", "/api/catalog", false));
        assertThat(config.getServiceRegistry().findByName("catalog").get().getStripPrefix()).isEqualTo("/api/catalog");
    }

    @Test
    @DisplayName("port defaults to 8080")
    void defaultPort() {
        assertThat(create().getListenPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("JWT_SECRET overrides the configured secret")
    void secretOverride() {
        environment.setProperty("JWT_SECRET", TestTokens.OTHER_SECRET);

        assertThat(create().getSigningKeyBytes()).isEqualTo(TestTokens.OTHER_SECRET.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("empty JWT_SECRET keeps the configured secret")
    void emptySecretOverride() {
        environment.setProperty("JWT_SECRET", "");

        assertThat(create().getSigningKeyBytes()).isEqualTo(TestTokens.SECRET.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("missing secret is fatal")
    void missingSecret() {
        properties.setJwtSecret(null);

        assertThatThrownBy(this::create).isInstanceOf(GatewayConfigurationException.class);
    }

    @Test
    @DisplayName("secret shorter than 32 bytes is fatal")
    void weakSecret() {
        properties.setJwtSecret("too-short");

        assertThatThrownBy(this::create)
                .isInstanceOf(GatewayConfigurationException.class)
                .hasMessageContaining("32");
    }

    @Test
    @DisplayName("the secret never appears in toString")
    void maskedSecret() {
        assertThat(create().toString()).doesNotContain(TestTokens.SECRET);
    }

    @Test
    @DisplayName("<NAME>_SERVICE_URL overrides the target URL")
    void defaultServiceVariable() {
        properties.setServices(List.of(service("user-profile", "/api/profile", "http://localhost:8081")));
        environment.setProperty("USER_PROFILE_SERVICE_URL", "http://profile.internal:9000");

        assertThat(create().getServiceRegistry().findByName("user-profile").get().getTargetUrl())
                .isEqualTo("http://profile.internal:9000");
    }

    @Test
    @DisplayName("a declared env-var takes the place of the default variable")
    void customServiceVariable() {
        GatewayProperties.ServiceProperties orders = service("orders", "/api/orders", "http://localhost:8083");
        orders.setEnvVar("ORDERS_BACKEND");
        properties.setServices(List.of(orders));
        environment.setProperty("ORDERS_BACKEND", "http://orders.internal");
        environment.setProperty("ORDERS_SERVICE_URL", "http://ignored");

        assertThat(create().getServiceRegistry().findByName("orders").get().getTargetUrl())
                .isEqualTo("http://orders.internal");
    }

    @Test
    @DisplayName("default variable names are upper-cased with dashes replaced")
    void defaultVariableName() {
        assertThat(GatewayConfigFactory.defaultVariableName("user-profile")).isEqualTo("USER_PROFILE_SERVICE_URL");
    }

    @Test
    @DisplayName("unnamed services, bad prefixes and duplicates are fatal")
    void invalidServices() {
        properties.setServices(List.of(service("", "/a", "http://a")));
        assertThatThrownBy(this::create).isInstanceOf(GatewayConfigurationException.class);

        properties.setServices(List.of(service("a", "a", "http://a")));
        assertThatThrownBy(this::create).isInstanceOf(GatewayConfigurationException.class);

        properties.setServices(List.of(service("a", "/a", "http://a"), service("b", "/a", "http://b")));
        assertThatThrownBy(this::create).isInstanceOf(GatewayConfigurationException.class);
    }

    @Test
    @DisplayName("negative clock skew is fatal")
    void negativeClockSkew() {
        properties.setClockSkewSeconds(-1);

        assertThatThrownBy(this::create).isInstanceOf(GatewayConfigurationException.class);
    }
}
