package com.portico.gateway.routing;

import com.portico.gateway.exception.GatewayConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RouteDescriptor")
class RouteDescriptorTest {

    @Test
    @DisplayName("trailing slashes are trimmed from the prefix, root is kept")
    void trimsTrailingSlash() {
        assertThat(new RouteDescriptor("a", "/api/users/", "http://h", "", false).getPathPrefix())
                .isEqualTo("/api/users");
        assertThat(new RouteDescriptor("root", "/", "http://h", "", false).getPathPrefix()).isEqualTo("/");
    }

    @Test
    @DisplayName("null strip prefix means no rewriting")
    void nullStripPrefix() {
        RouteDescriptor route = new RouteDescriptor("a", "/a", "http://h", null, true);

        assertThat(route.getStripPrefix()).isEmpty();
        assertThat(route.hasStripPrefix()).isFalse();
        assertThat(route.isAuthRequired()).isTrue();
    }

    @Test
    @DisplayName("prefix must start with a slash")
    void relativePrefix() {
        assertThatThrownBy(() -> new RouteDescriptor("a", "api", "http://h", "", false))
                .isInstanceOf(GatewayConfigurationException.class);
        assertThatThrownBy(() -> new RouteDescriptor("a", "", "http://h", "", false))
                .isInstanceOf(GatewayConfigurationException.class);
    }

    @Test
    @DisplayName("name and target are required")
    void requiredFields() {
        assertThatThrownBy(() -> new RouteDescriptor(" ", "/a", "http://h", "", false))
                .isInstanceOf(GatewayConfigurationException.class);
        assertThatThrownBy(() -> new RouteDescriptor("a", "/a", "", "", false))
                .isInstanceOf(GatewayConfigurationException.class);
    }
}
