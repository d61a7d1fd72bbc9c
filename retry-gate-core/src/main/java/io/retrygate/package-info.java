/**
 * Root API for retry-gate, a priority gate embedded in a publish/subscribe broker.
 *
 * <h2>Core Design</h2>
 * <p>Messages whose routing key has a segment equal to {@code retry} are retry traffic.
 * The broker reports each accepted message to the inbound hook, which counts retry
 * traffic, and each prospective delivery to the outbound gate, which counts it down
 * again. While the count is above zero, deliveries of normal traffic are suppressed and
 * re-attempted on a fixed delay until the count drains; the re-attempt goes through the
 * broker's general publish entry point.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>retry-gate-core</b>: classifier, counter, hooks, scheduler (zero external deps)</li>
 *   <li><b>retry-gate-micrometer</b>: Micrometer implementation of the metrics SPI</li>
 *   <li><b>retry-gate-spring-boot-starter</b>: auto-configuration for embedded brokers</li>
 *   <li><b>retry-gate-hivemq</b>: HiveMQ extension installing the gate as publish interceptors</li>
 * </ul>
 *
 * @see io.retrygate.RetryGate
 * @see io.retrygate.classify.TopicClassifier
 * @see io.retrygate.hook.InboundHook
 * @see io.retrygate.hook.OutboundGate
 * @see io.retrygate.redelivery.RedeliveryScheduler
 */
package io.retrygate;
