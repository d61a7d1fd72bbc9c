/**
 * Spring Boot auto-configuration for the retry gate.
 *
 * <p>Declare a {@link io.retrygate.spi.BrokerPublisher} bean and the starter wires a
 * {@link io.retrygate.RetryGate} from {@code retry-gate.*} properties. With Micrometer
 * on the classpath the gate reports through a
 * {@link io.retrygate.micrometer.MicrometerMetricsExporter}.
 */
package io.retrygate.spring.boot;
