package io.xqueue.http;

import java.time.Duration;

/**
 * Posts payloads to grader and origin callback endpoints.
 *
 * <p>Implementations never throw for transport or protocol problems; they report them in the
 * returned {@link DeliveryResult}. They do not retry.
 *
 * @see HttpDeliveryClient
 */
@FunctionalInterface
public interface DeliveryClient {

    /**
     * POSTs {@code payload} to {@code url}.
     *
     * @param url     the endpoint
     * @param payload the body to send
     * @param timeout bound on connecting and on waiting for the response
     * @return success with the response body for HTTP 200, failure with a diagnostic otherwise
     */
    DeliveryResult post(String url, Payload payload, Duration timeout);
}
