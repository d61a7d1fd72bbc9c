package io.retrygate.hook;

import io.retrygate.GateMessage;
import io.retrygate.Qos;
import io.retrygate.spi.DeliveryControl;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * DeliveryControl stub that records suppression requests.
 */
public class StubDeliveryControl implements DeliveryControl {
    private final GateMessage message;
    public final AtomicInteger suppressCount = new AtomicInteger();
    public final AtomicInteger messageReads = new AtomicInteger();

    public StubDeliveryControl(GateMessage message) {
        this.message = message;
    }

    public static StubDeliveryControl of(String topic, String payload) {
        return new StubDeliveryControl(GateMessage.ofText(topic, payload, Qos.AT_LEAST_ONCE));
    }

    @Override
    public String topic() {
        return message.topic();
    }

    @Override
    public GateMessage message() {
        messageReads.incrementAndGet();
        return message;
    }

    @Override
    public void suppressDelivery() {
        suppressCount.incrementAndGet();
    }

    public boolean suppressed() {
        return suppressCount.get() > 0;
    }
}
