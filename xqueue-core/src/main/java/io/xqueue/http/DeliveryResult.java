package io.xqueue.http;

import java.util.Objects;

/**
 * Outcome of one HTTP exchange.
 *
 * @param success true only for HTTP 200
 * @param message the response body on success, a diagnostic otherwise
 */
public record DeliveryResult(boolean success, String message) {

    public DeliveryResult {
        Objects.requireNonNull(message, "message");
    }

    public static DeliveryResult success(String body) {
        return new DeliveryResult(true, body);
    }

    public static DeliveryResult failure(String message) {
        return new DeliveryResult(false, message);
    }
}
