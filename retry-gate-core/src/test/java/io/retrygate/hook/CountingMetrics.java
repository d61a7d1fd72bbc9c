package io.retrygate.hook;

import io.retrygate.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * MetricsExporter stub that counts each call.
 */
public class CountingMetrics implements MetricsExporter {
    public final AtomicInteger retryAccepted = new AtomicInteger();
    public final AtomicInteger retryDelivered = new AtomicInteger();
    public final AtomicInteger underflows = new AtomicInteger();
    public final AtomicInteger normalDelivered = new AtomicInteger();
    public final AtomicInteger deferred = new AtomicInteger();
    public final AtomicInteger requeued = new AtomicInteger();
    public final AtomicInteger redelivered = new AtomicInteger();
    public final AtomicInteger redeliveryFailed = new AtomicInteger();
    public final AtomicInteger cancelled = new AtomicInteger();
    public final AtomicInteger lastPendingRetries = new AtomicInteger(-1);

    @Override
    public void incrementRetryAccepted() {
        retryAccepted.incrementAndGet();
    }

    @Override
    public void incrementRetryDelivered() {
        retryDelivered.incrementAndGet();
    }

    @Override
    public void incrementCounterUnderflow() {
        underflows.incrementAndGet();
    }

    @Override
    public void incrementNormalDelivered() {
        normalDelivered.incrementAndGet();
    }

    @Override
    public void incrementDeferred() {
        deferred.incrementAndGet();
    }

    @Override
    public void incrementRequeued() {
        requeued.incrementAndGet();
    }

    @Override
    public void incrementRedelivered() {
        redelivered.incrementAndGet();
    }

    @Override
    public void incrementRedeliveryFailed() {
        redeliveryFailed.incrementAndGet();
    }

    @Override
    public void incrementCancelled(int count) {
        cancelled.addAndGet(count);
    }

    @Override
    public void recordPendingRetries(int pending) {
        lastPendingRetries.set(pending);
    }
}
