package fr.lapetina.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Error body {@code {"error":{"code","message","timestamp","requestId"}}}
 * used by the admin and ops endpoints.
 */
public class ErrorResponse {

    private final Detail error;

    public ErrorResponse(String code, String message, String requestId) {
        this.error = new Detail(code, message, Instant.now(), requestId);
    }

    public static ErrorResponse of(int statusCode, String message, String requestId) {
        return new ErrorResponse(codeFor(statusCode), message, requestId);
    }

    private static String codeFor(int statusCode) {
        return switch (statusCode) {
            case 400 -> "BAD_REQUEST";
            case 404 -> "NOT_FOUND";
            case 405 -> "METHOD_NOT_ALLOWED";
            case 503 -> "SERVICE_UNAVAILABLE";
            case 504 -> "GATEWAY_TIMEOUT";
            default -> "INTERNAL_ERROR";
        };
    }

    public Detail getError() { return error; }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Detail(String code, String message, Instant timestamp, String requestId) {
    }
}
