package io.xqueue.notify;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xqueue.CallbackEncoding;
import io.xqueue.XQueueConfig;
import io.xqueue.http.DeliveryResult;
import io.xqueue.http.Payload;
import io.xqueue.http.RecordingDeliveryClient;
import io.xqueue.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultNotifierTest {
    private static final String HEADER =
        "{\"lms_callback_url\":\"http://lms.test/callback\",\"lms_key\":\"k1\",\"queue_name\":\"python\"}";

    private final XQueueConfig config = XQueueConfig.builder()
        .requestsTimeout(Duration.ofSeconds(3))
        .build();

    @Test
    void firstAcknowledgementStopsRetrying() {
        RecordingDeliveryClient client = RecordingDeliveryClient.always(DeliveryResult.success("ok"));
        ResultNotifier notifier = new ResultNotifier(client, config);

        assertTrue(notifier.notify(HEADER, "{\"score\":1}"));

        assertEquals(1, client.calls().size());
        RecordingDeliveryClient.Call call = client.calls().get(0);
        assertEquals("http://lms.test/callback", call.url());
        assertEquals(Duration.ofSeconds(3), call.timeout());
        assertEquals(Payload.APPLICATION_JSON, call.payload().mimeType());

        ObjectNode body = JsonCodec.parseObject(call.payload().body());
        assertEquals(HEADER, body.get("xqueue_header").asText());
        assertEquals("{\"score\":1}", body.get("xqueue_body").asText());
    }

    @Test
    void succeedsOnThirdAttempt() {
        RecordingDeliveryClient client = new RecordingDeliveryClient(n -> n < 3
            ? DeliveryResult.failure("unexpected HTTP status code [503]")
            : DeliveryResult.success("ok"));
        ResultNotifier notifier = new ResultNotifier(client, config);

        assertTrue(notifier.notify(HEADER, "reply"));
        assertEquals(3, client.calls().size());
    }

    @Test
    void givesUpAfterFiveAttempts() {
        RecordingDeliveryClient client = RecordingDeliveryClient.always(DeliveryResult.failure("cannot connect to server"));
        ResultNotifier notifier = new ResultNotifier(client, config);

        assertFalse(notifier.notify(HEADER, "reply"));
        assertEquals(ResultNotifier.MAX_ATTEMPTS, client.calls().size());
    }

    @Test
    void failureNoticeCarriesNullVerdictAndZeroScore() {
        ObjectNode notice = JsonCodec.parseObject(ResultNotifier.failureNotice());

        assertTrue(notice.get("correct").isNull());
        assertEquals(0, notice.get("score").intValue());
        assertTrue(notice.get("score").isIntegralNumber());
        assertEquals(ResultNotifier.FAILURE_MESSAGE, notice.get("msg").asText());
        assertTrue(notice.get("msg").asText().startsWith("<div class=\"capa_alert\">"));
    }

    @Test
    void notifyFailureSendsFailureNotice() {
        RecordingDeliveryClient client = RecordingDeliveryClient.always(DeliveryResult.success("ok"));
        ResultNotifier notifier = new ResultNotifier(client, config);

        assertTrue(notifier.notifyFailure(HEADER));

        ObjectNode body = JsonCodec.parseObject(client.calls().get(0).payload().body());
        assertEquals(ResultNotifier.failureNotice(), body.get("xqueue_body").asText());
    }

    @Test
    void invalidHeaderIsNotPosted() {
        RecordingDeliveryClient client = RecordingDeliveryClient.always(DeliveryResult.success("ok"));
        ResultNotifier notifier = new ResultNotifier(client, config);

        assertFalse(notifier.notify("not json", "reply"));
        assertFalse(notifier.notify("{\"lms_key\":\"k1\"}", "reply"));
        assertEquals(0, client.calls().size());
    }

    @Test
    void formEncodingSendsBothFields() {
        RecordingDeliveryClient client = RecordingDeliveryClient.always(DeliveryResult.success("ok"));
        XQueueConfig formConfig = XQueueConfig.builder()
            .callbackEncoding(CallbackEncoding.FORM)
            .build();
        ResultNotifier notifier = new ResultNotifier(client, formConfig);

        assertTrue(notifier.notify("{\"lms_callback_url\":\"http://lms.test/cb\"}", "ok"));

        Payload payload = client.calls().get(0).payload();
        assertEquals(Payload.FORM_URLENCODED, payload.mimeType());
        assertTrue(payload.body().startsWith("xqueue_header="));
        assertTrue(payload.body().endsWith("&xqueue_body=ok"));
    }
}
