package com.portico.gateway.routing;

import com.portico.gateway.exception.ForwarderConstructionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@DisplayName("UpstreamForwarderFactory")
class UpstreamForwarderFactoryTest {

    private final UpstreamForwarderFactory factory = new UpstreamForwarderFactory(mock(DownstreamResponseObserver.class));

    @Test
    @DisplayName("builds a forwarder for an absolute http URL")
    void absoluteUrl() {
        UpstreamForwarder forwarder = factory.create(
                new RouteDescriptor("users", "/api/users", "http://users.internal:8081/v1", "", true));

        assertThat(forwarder.getTargetUri().getHost()).isEqualTo("users.internal");
        assertThat(forwarder.getTargetUri().getPort()).isEqualTo(8081);
        assertThat(forwarder.getRoute().getName()).isEqualTo("users");
    }

    @Test
    @DisplayName("accepts https")
    void https() {
        assertThat(factory.create(new RouteDescriptor("s", "/s", "https://secure.example.com", "", false))
                .getTargetUri().getScheme()).isEqualTo("https");
    }

    @ParameterizedTest
    @ValueSource(strings = {"not a url", "/relative/path", "ftp://files.example.com", "http://", "localhost:8081"})
    @DisplayName("rejects target URLs that are not absolute http(s) URLs with a host")
    void invalidTargets(String target) {
        RouteDescriptor route = new RouteDescriptor("broken", "/broken", target, "", false);

        assertThatThrownBy(() -> factory.create(route))
                .isInstanceOf(ForwarderConstructionException.class)
                .hasMessageContaining("broken")
                .satisfies(e -> assertThat(((ForwarderConstructionException) e).getServiceName()).isEqualTo("broken"));
    }
}
