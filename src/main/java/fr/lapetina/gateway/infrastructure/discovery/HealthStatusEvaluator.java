package fr.lapetina.gateway.infrastructure.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.gateway.domain.model.HealthStatus;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Derives a {@link HealthStatus} from a health endpoint body of the form
 * {@code {status?, uptime?, memory?:{used,total,percentage}, cpu?:{usage}, dependencies?:{name:bool}}}.
 *
 * An explicit, recognised {@code status} wins. Otherwise the most severe
 * condition applies: failing dependencies give UNHEALTHY, or DEGRADED when
 * more than one dependency is declared and at least one still works; memory
 * or CPU above the saturation threshold gives DEGRADED.
 */
public final class HealthStatusEvaluator {

    static final double SATURATION_THRESHOLD = 90.0;

    private HealthStatusEvaluator() {
        // Utility class
    }

    public static HealthStatus evaluate(JsonNode body) {
        if (body == null || !body.isObject()) {
            return HealthStatus.HEALTHY;
        }

        JsonNode status = body.get("status");
        if (status != null && status.isTextual()) {
            Optional<HealthStatus> explicit = HealthStatus.fromWire(status.asText());
            if (explicit.isPresent()) {
                return explicit.get();
            }
        }

        JsonNode dependencies = body.get("dependencies");
        if (dependencies != null && dependencies.isObject() && dependencies.size() > 0) {
            int total = dependencies.size();
            int failed = 0;
            Iterator<JsonNode> values = dependencies.elements();
            while (values.hasNext()) {
                if (!values.next().asBoolean(false)) {
                    failed++;
                }
            }
            if (failed > 0) {
                return total > 1 && failed < total ? HealthStatus.DEGRADED : HealthStatus.UNHEALTHY;
            }
        }

        if (number(body.path("memory").path("percentage")) > SATURATION_THRESHOLD) {
            return HealthStatus.DEGRADED;
        }
        if (number(body.path("cpu").path("usage")) > SATURATION_THRESHOLD) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }

    /**
     * Extracts the structured fields worth keeping with a result.
     */
    public static Map<String, Object> details(JsonNode body) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (body == null || !body.isObject()) {
            return details;
        }
        for (String field : new String[]{"uptime", "memory", "cpu", "dependencies"}) {
            JsonNode value = body.get(field);
            if (value != null && !value.isNull()) {
                details.put(field, value);
            }
        }
        return details;
    }

    private static double number(JsonNode node) {
        return node.isNumber() || node.isTextual() ? node.asDouble(0.0) : 0.0;
    }
}
