package fr.lapetina.gateway.infrastructure.config;

import fr.lapetina.gateway.domain.exception.ConfigurationException;
import fr.lapetina.gateway.domain.model.RateLimitRule;
import fr.lapetina.gateway.domain.model.RouteConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static GatewayConfig load(String text) {
        return new ConfigLoader("unused.yaml").loadFromStream(yaml(text));
    }

    @Test
    @DisplayName("should load the bundled configuration from the classpath")
    void shouldLoadBundledConfig() {
        GatewayConfig config = new ConfigLoader("config.yaml").load();

        assertThat(config.getStrategy().getType()).isEqualTo("health_based");
        assertThat(config.getServices()).extracting(GatewayConfig.ServiceConfig::getName)
                .containsExactly("auth-service", "voice-service");
        assertThat(config.getServices().get(0).getTags()).contains("critical");
        assertThat(config.getServices().get(1).getDependencies()).containsExactly("auth-service");
        assertThat(config.getRoutes()).hasSize(1);
    }

    @Test
    @DisplayName("should load from the file system before the classpath")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("gateway.yaml");
        Files.writeString(file, "strategy:\n  type: random\n");

        GatewayConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getStrategy().getType()).isEqualTo("random");
    }

    @Test
    @DisplayName("should apply defaults for an empty document")
    void shouldApplyDefaults() {
        GatewayConfig config = load("");

        assertThat(config.getServices()).isEmpty();
        assertThat(config.getRoutes()).isEmpty();
        assertThat(config.getCircuitBreaker().getFailureThreshold()).isPositive();
        assertThat(Integer.bitCount(config.getDisruptor().getRingBufferSize())).isEqualTo(1);
    }

    @Test
    @DisplayName("should fail when the file is missing")
    void shouldFailOnMissingFile() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should reject malformed yaml")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> load("server: [unclosed"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageStartingWith("Invalid configuration");
    }

    @Test
    @DisplayName("should reject an unknown strategy")
    void shouldRejectUnknownStrategy() {
        assertThatThrownBy(() -> load("strategy:\n  type: fastest\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("strategy.type");
    }

    @Test
    @DisplayName("should reject a ring buffer size that is not a power of two")
    void shouldRejectRingBufferSize() {
        assertThatThrownBy(() -> load("disruptor:\n  ringBufferSize: 1000\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("power of 2");
    }

    @Test
    @DisplayName("should reject duplicated service names")
    void shouldRejectDuplicatedServices() {
        String text = """
                services:
                  - name: auth
                    port: 3001
                  - name: auth
                    port: 3002
                """;

        assertThatThrownBy(() -> load(text))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("services[1].name is duplicated");
    }

    @Test
    @DisplayName("should require a service name on top-level routes")
    void shouldRequireServiceNameOnTopLevelRoutes() {
        String text = """
                routes:
                  - method: GET
                    path: /api/status
                """;

        assertThatThrownBy(() -> load(text))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("routes[0].serviceName");
    }

    @Test
    @DisplayName("should turn route entries into runtime routes")
    void shouldBuildRuntimeRoutes() {
        String text = """
                services:
                  - name: voice
                    port: 3002
                    routes:
                      - method: post
                        path: /api/voice
                        targetPath: /transcribe
                        rateLimit:
                          preset: voice
                      - method: GET
                        path: /api/voice/status
                        timeoutMs: 1500
                        rateLimit:
                          windowMs: 1000
                          maxRequests: 2
                          queueSize: 0
                """;
        GatewayConfig config = load(text);
        GatewayConfig.ServiceConfig service = config.getServices().get(0);

        RouteConfig transcribe = service.getRoutes().get(0).toRouteConfig("voice", Duration.ofSeconds(30));
        RouteConfig status = service.getRoutes().get(1).toRouteConfig("voice", Duration.ofSeconds(30));

        assertThat(transcribe.key()).isEqualTo("POST:/api/voice");
        assertThat(transcribe.getServiceName()).isEqualTo("voice");
        assertThat(transcribe.getTargetPath()).isEqualTo("/transcribe");
        assertThat(transcribe.getTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(transcribe.getRateLimit()).get().extracting(RateLimitRule::maxRequests).isEqualTo(20);

        assertThat(status.getTargetPath()).isEqualTo("/api/voice/status");
        assertThat(status.getTimeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(status.getRateLimit()).get().extracting(RateLimitRule::queueSize).isEqualTo(0);
    }
}
