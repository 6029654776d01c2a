package fr.lapetina.gateway.routing;

import fr.lapetina.gateway.domain.model.OutboundRequest;
import fr.lapetina.gateway.domain.model.ProxyRequest;
import fr.lapetina.gateway.domain.model.RouteConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class OutboundRequestFactoryTest {

    private final OutboundRequestFactory factory = new OutboundRequestFactory("test-gateway", "2.0.0");

    @Test
    @DisplayName("should forward only allow-listed headers and add gateway headers")
    void shouldFilterHeaders() {
        ProxyRequest request = new ProxyRequest("POST", "/api/login",
                Map.of("Content-Type", "application/json",
                        "Authorization", "Bearer token",
                        "Cookie", "session=1",
                        "Host", "gateway.local",
                        "Accept-Encoding", "gzip"),
                Map.of("lang", List.of("fr"), "tag", List.of("a", "b")), "{}", "10.0.0.1");
        RouteConfig route = RouteConfig.builder()
                .method("POST").path("/api/login").serviceName("auth").targetPath("/login").build();

        OutboundRequest outbound = factory.create(request, route, "req_1_1");

        assertThat(outbound.headers())
                .containsEntry("content-type", "application/json")
                .containsEntry("authorization", "Bearer token")
                .containsEntry(OutboundRequestFactory.REQUEST_ID_HEADER, "req_1_1")
                .containsEntry(OutboundRequestFactory.FORWARDED_BY_HEADER, "test-gateway")
                .containsEntry(OutboundRequestFactory.GATEWAY_VERSION_HEADER, "2.0.0")
                .doesNotContainKeys("cookie", "host", "accept-encoding");
        assertThat(outbound.path()).isEqualTo("/login");
        assertThat(outbound.query())
                .containsEntry("lang", List.of("fr"))
                .containsEntry("tag", List.of("a", "b"));
        assertThat(outbound.method()).isEqualTo("POST");
    }

    @Test
    @DisplayName("should issue unique request ids")
    void shouldIssueUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(factory.nextRequestId());
        }

        assertThat(ids).hasSize(1000).allMatch(id -> id.matches("req_\\d+_\\d+"));
    }
}
