package io.xqueue.http;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.IntFunction;

/**
 * {@link DeliveryClient} that records calls and answers from a script keyed by call number.
 */
public final class RecordingDeliveryClient implements DeliveryClient {

    public record Call(String url, Payload payload, Duration timeout) {
    }

    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final IntFunction<DeliveryResult> script;

    public RecordingDeliveryClient(IntFunction<DeliveryResult> script) {
        this.script = script;
    }

    public static RecordingDeliveryClient always(DeliveryResult result) {
        return new RecordingDeliveryClient(n -> result);
    }

    @Override
    public DeliveryResult post(String url, Payload payload, Duration timeout) {
        calls.add(new Call(url, payload, timeout));
        return script.apply(calls.size());
    }

    public List<Call> calls() {
        return calls;
    }
}
