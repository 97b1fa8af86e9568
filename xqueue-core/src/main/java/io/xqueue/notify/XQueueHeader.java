package io.xqueue.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xqueue.util.JsonCodec;

import java.util.Objects;

/**
 * A submission header: the origin callback address plus the original text, which is
 * forwarded back to the origin untouched.
 *
 * @param lmsCallbackUrl where results for this submission are posted
 * @param raw            the header exactly as stored
 */
public record XQueueHeader(String lmsCallbackUrl, String raw) {
    public static final String CALLBACK_URL_FIELD = "lms_callback_url";

    public XQueueHeader {
        Objects.requireNonNull(lmsCallbackUrl, "lmsCallbackUrl");
        Objects.requireNonNull(raw, "raw");
    }

    /**
     * Parses a stored header.
     *
     * @param raw JSON object text carrying {@value #CALLBACK_URL_FIELD}
     * @return the parsed header
     * @throws InvalidHeaderException if the text is not a JSON object or the callback address
     *                                is missing, not a string, or blank
     */
    public static XQueueHeader parse(String raw) {
        ObjectNode object;
        try {
            object = JsonCodec.parseObject(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidHeaderException("Header is not a JSON object: " + e.getMessage(), e);
        }
        JsonNode url = object.get(CALLBACK_URL_FIELD);
        if (url == null || !url.isTextual() || url.asText().isBlank()) {
            throw new InvalidHeaderException("Header has no " + CALLBACK_URL_FIELD);
        }
        return new XQueueHeader(url.asText(), raw);
    }
}
