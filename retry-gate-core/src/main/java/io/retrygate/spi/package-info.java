/**
 * Service Provider Interfaces (SPI) that connect the gate to a broker and a metrics backend.
 *
 * <p>A broker adapter implements {@link io.retrygate.spi.BrokerPublisher} once and wraps each
 * outbound delivery attempt in a {@link io.retrygate.spi.DeliveryControl}.
 *
 * @see io.retrygate.spi.BrokerPublisher
 * @see io.retrygate.spi.DeliveryControl
 * @see io.retrygate.spi.MetricsExporter
 */
package io.retrygate.spi;
