package io.retrygate.hook;

import io.retrygate.GateMessage;
import io.retrygate.spi.BrokerPublisher;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * BrokerPublisher stub that records every publish and lets tests wait for a given count.
 */
public class RecordingPublisher implements BrokerPublisher {
    public final List<GateMessage> published = new CopyOnWriteArrayList<>();
    private volatile CountDownLatch latch = new CountDownLatch(0);

    public void expect(int count) {
        latch = new CountDownLatch(count);
    }

    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return latch.await(timeout, unit);
    }

    @Override
    public CompletionStage<Void> publish(GateMessage message) {
        published.add(message);
        latch.countDown();
        return CompletableFuture.completedFuture(null);
    }
}
