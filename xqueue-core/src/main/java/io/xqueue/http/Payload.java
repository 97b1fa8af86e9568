package io.xqueue.http;

import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.apache.hc.core5.net.WWWFormCodec;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A serialized request body and its media type. Bodies are always UTF-8.
 *
 * @param body     the serialized body
 * @param mimeType the media type without parameters
 */
public record Payload(String body, String mimeType) {
    public static final String APPLICATION_JSON = "application/json";
    public static final String FORM_URLENCODED = "application/x-www-form-urlencoded";

    public Payload {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(mimeType, "mimeType");
    }

    public static Payload json(String json) {
        return new Payload(json, APPLICATION_JSON);
    }

    /**
     * Form-encodes the given fields in iteration order.
     *
     * @param fields field names and values; null values are sent empty
     * @return the form payload
     */
    public static Payload form(Map<String, String> fields) {
        List<NameValuePair> pairs = new ArrayList<>(fields.size());
        fields.forEach((name, value) -> pairs.add(new BasicNameValuePair(name, value == null ? "" : value)));
        return new Payload(WWWFormCodec.format(pairs, StandardCharsets.UTF_8), FORM_URLENCODED);
    }
}
