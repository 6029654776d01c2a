package fr.lapetina.gateway.domain.model;

import java.util.Locale;

/**
 * Transport scheme used to reach a service instance.
 */
public enum Protocol {
    HTTP,
    HTTPS,
    WS,
    WSS;

    public String scheme() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Scheme used for plain HTTP calls (health probes, proxied requests).
     * WebSocket instances expose their health endpoint over HTTP(S).
     */
    public String httpScheme() {
        return switch (this) {
            case HTTP, WS -> "http";
            case HTTPS, WSS -> "https";
        };
    }

    public static Protocol fromString(String value) {
        if (value == null || value.isBlank()) {
            return HTTP;
        }
        return Protocol.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
