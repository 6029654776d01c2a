package fr.lapetina.gateway.infrastructure.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.gateway.domain.model.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class HealthStatusEvaluatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Test
    @DisplayName("should treat a missing or non-object body as healthy")
    void shouldTreatMissingBodyAsHealthy() throws Exception {
        assertThat(HealthStatusEvaluator.evaluate(null)).isEqualTo(HealthStatus.HEALTHY);
        assertThat(HealthStatusEvaluator.evaluate(json("\"OK\""))).isEqualTo(HealthStatus.HEALTHY);
        assertThat(HealthStatusEvaluator.evaluate(json("{}"))).isEqualTo(HealthStatus.HEALTHY);
    }

    @ParameterizedTest
    @CsvSource({
            "healthy, HEALTHY",
            "ok, HEALTHY",
            "degraded, DEGRADED",
            "unhealthy, UNHEALTHY",
            "DOWN, UNHEALTHY"
    })
    @DisplayName("should honour an explicit status")
    void shouldHonourExplicitStatus(String reported, HealthStatus expected) throws Exception {
        JsonNode body = json("{\"status\":\"" + reported + "\",\"cpu\":{\"usage\":99}}");

        assertThat(HealthStatusEvaluator.evaluate(body)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should be unhealthy when the only dependency fails")
    void shouldBeUnhealthyWhenSoleDependencyFails() throws Exception {
        JsonNode body = json("{\"dependencies\":{\"database\":false}}");

        assertThat(HealthStatusEvaluator.evaluate(body)).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    @DisplayName("should be degraded when some of several dependencies fail")
    void shouldBeDegradedWhenSomeDependenciesFail() throws Exception {
        JsonNode body = json("{\"dependencies\":{\"database\":true,\"cache\":false}}");

        assertThat(HealthStatusEvaluator.evaluate(body)).isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    @DisplayName("should be unhealthy when every dependency fails even with low load")
    void shouldBeUnhealthyWhenAllDependenciesFail() throws Exception {
        JsonNode body = json("{\"dependencies\":{\"database\":false,\"cache\":false},\"cpu\":{\"usage\":10}}");

        assertThat(HealthStatusEvaluator.evaluate(body)).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    @DisplayName("should be degraded on memory or cpu saturation")
    void shouldBeDegradedOnSaturation() throws Exception {
        assertThat(HealthStatusEvaluator.evaluate(json("{\"memory\":{\"percentage\":95.5}}")))
                .isEqualTo(HealthStatus.DEGRADED);
        assertThat(HealthStatusEvaluator.evaluate(json("{\"cpu\":{\"usage\":91}}")))
                .isEqualTo(HealthStatus.DEGRADED);
        assertThat(HealthStatusEvaluator.evaluate(json("{\"cpu\":{\"usage\":90}}")))
                .isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("should keep structured details and skip the rest")
    void shouldExtractDetails() throws Exception {
        JsonNode body = json("{\"status\":\"healthy\",\"uptime\":120,\"extra\":1,\"memory\":{\"percentage\":40}}");

        assertThat(HealthStatusEvaluator.details(body)).containsOnlyKeys("uptime", "memory");
    }
}
