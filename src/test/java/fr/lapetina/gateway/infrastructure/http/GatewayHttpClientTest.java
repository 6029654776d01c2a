package fr.lapetina.gateway.infrastructure.http;

import fr.lapetina.gateway.domain.model.ServiceInstance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayHttpClientTest {

    private final ServiceInstance instance = ServiceInstance.builder()
            .id("search-1").name("search").host("10.0.0.5").port(7000).build();

    @Test
    @DisplayName("should forward every value of a repeated query parameter")
    void shouldForwardRepeatedQueryValues() {
        URI uri = GatewayHttpClient.buildUri(instance, "/search", Map.of("tag", List.of("a", "b")));

        assertThat(uri.toString()).isEqualTo("http://10.0.0.5:7000/search?tag=a&tag=b");
    }

    @Test
    @DisplayName("should encode query values and add a leading slash to the path")
    void shouldEncodeQuery() {
        URI uri = GatewayHttpClient.buildUri(instance, "search", Map.of("q", List.of("a b&c")));

        assertThat(uri.getRawQuery()).isEqualTo("q=a+b%26c");
        assertThat(uri.getPath()).isEqualTo("/search");
    }

    @Test
    @DisplayName("should omit the query string when there are no parameters")
    void shouldOmitEmptyQuery() {
        assertThat(GatewayHttpClient.buildUri(instance, "/health", Map.of()).toString())
                .isEqualTo("http://10.0.0.5:7000/health");
    }
}
