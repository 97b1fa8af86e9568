package io.xqueue.notify;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xqueue.CallbackEncoding;
import io.xqueue.XQueueConfig;
import io.xqueue.http.DeliveryClient;
import io.xqueue.http.DeliveryResult;
import io.xqueue.http.Payload;
import io.xqueue.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Sends grading outcomes back to the origin system.
 *
 * <p>The callback address is read from the submission header; the header itself is echoed
 * back as {@code xqueue_header} next to the outcome in {@code xqueue_body}. Each notification
 * is attempted up to {@value #MAX_ATTEMPTS} times back to back and reports whether the origin
 * answered HTTP 200.
 *
 * <p>This class is thread-safe.
 */
public final class ResultNotifier {
    private static final Logger logger = Logger.getLogger(ResultNotifier.class.getName());

    public static final int MAX_ATTEMPTS = 5;

    static final String FAILURE_MESSAGE = "<div class=\"capa_alert\">"
        + "Your submission could not be graded. "
        + "Please recheck your submission and try again. "
        + "If the problem persists, please notify the course staff."
        + "</div>";

    private final DeliveryClient deliveryClient;
    private final XQueueConfig config;

    public ResultNotifier(DeliveryClient deliveryClient, XQueueConfig config) {
        this.deliveryClient = Objects.requireNonNull(deliveryClient, "deliveryClient");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Posts an outcome to the callback named in {@code header}.
     *
     * @param header the submission header as stored
     * @param body   the outcome, usually the grader's raw reply
     * @return true if the origin acknowledged with HTTP 200 within {@value #MAX_ATTEMPTS} attempts;
     *         false after exhausting them or when the header has no usable callback address
     */
    public boolean notify(String header, String body) {
        XQueueHeader parsed;
        try {
            parsed = XQueueHeader.parse(header);
        } catch (InvalidHeaderException e) {
            logger.severe("Unable to return to LMS: invalid xqueue_header " + header + ": " + e.getMessage());
            return false;
        }

        Payload payload = payload(parsed, body);
        DeliveryResult reply = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            reply = deliveryClient.post(parsed.lmsCallbackUrl(), payload, config.requestsTimeout());
            if (reply.success()) {
                return true;
            }
        }
        logger.severe("Unable to return to LMS: lms_callback_url: " + parsed.lmsCallbackUrl()
            + ", payload: " + payload.body() + ", lms_reply: " + reply.message());
        return false;
    }

    /**
     * Tells the origin the submission could not be graded, using {@link #failureNotice()}
     * as the outcome.
     *
     * @param header the submission header as stored
     * @return whether the origin acknowledged
     */
    public boolean notifyFailure(String header) {
        return notify(header, failureNotice());
    }

    /**
     * The outcome reported to the origin when grading fails: no correctness verdict,
     * score zero, and a fixed HTML message for the student.
     *
     * @return the JSON failure notice
     */
    public static String failureNotice() {
        ObjectNode notice = JsonCodec.newObject();
        notice.putNull("correct");
        notice.put("score", 0);
        notice.put("msg", FAILURE_MESSAGE);
        return JsonCodec.toJson(notice);
    }

    private Payload payload(XQueueHeader header, String body) {
        if (config.callbackEncoding() == CallbackEncoding.FORM) {
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put("xqueue_header", header.raw());
            fields.put("xqueue_body", body);
            return Payload.form(fields);
        }
        ObjectNode json = JsonCodec.newObject();
        json.put("xqueue_header", header.raw());
        json.put("xqueue_body", body);
        return Payload.json(JsonCodec.toJson(json));
    }
}
