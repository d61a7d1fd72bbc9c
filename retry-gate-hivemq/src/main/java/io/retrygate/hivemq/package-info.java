/**
 * HiveMQ extension that installs the retry gate on every client connection.
 *
 * <p>{@link io.retrygate.hivemq.RetryGateExtensionMain} reads {@code retry-gate.properties}
 * from the extension folder, builds a {@link io.retrygate.RetryGate} on the broker's managed
 * executor and registers a {@link io.retrygate.hivemq.RetryInboundInterceptor} and a
 * {@link io.retrygate.hivemq.RetryOutboundInterceptor} through the client initializer.
 * Deferred messages go back through the broker's {@code PublishService}.
 */
package io.retrygate.hivemq;
