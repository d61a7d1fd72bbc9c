/**
 * Micrometer bridge for the retry gate's counters and gauges.
 *
 * <p>{@link io.retrygate.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.retrygate.spi.MetricsExporter} SPI. Pass it to
 * {@link io.retrygate.RetryGate.Builder#metrics} and the gate removes its meters on close.
 */
package io.retrygate.micrometer;
