/**
 * The broker-facing operations of the gate.
 *
 * <p>{@link io.retrygate.hook.InboundHook} counts retry traffic as it enters the broker;
 * {@link io.retrygate.hook.OutboundGate} counts it down on delivery and holds back normal
 * traffic while the count is above zero.
 */
package io.retrygate.hook;
