package fr.lapetina.gateway.disruptor.exception;

import fr.lapetina.gateway.domain.exception.GatewayException;
import fr.lapetina.gateway.domain.model.ErrorType;

/**
 * Exception thrown when the request pipeline cannot accept more work.
 *
 * This occurs when:
 * - Ring buffer is full and cannot accept new requests
 * - The pipeline is stopped or not yet started
 */
public final class BackpressureException extends GatewayException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason) {
        super(ErrorType.BACKPRESSURE, "Backpressure: " + reason.getMessage());
        this.reason = reason;
    }

    public BackpressureException(BackpressureReason reason, String details) {
        super(ErrorType.BACKPRESSURE, "Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        RING_BUFFER_FULL("Ring buffer is full"),
        PIPELINE_STOPPED("Request pipeline is not running");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
