package io.retrygate.hivemq;

import io.retrygate.MessageClass;
import io.retrygate.RetryGate;
import com.hivemq.extension.sdk.api.annotations.NotNull;
import com.hivemq.extension.sdk.api.interceptor.publish.PublishInboundInterceptor;
import com.hivemq.extension.sdk.api.interceptor.publish.parameter.PublishInboundInput;
import com.hivemq.extension.sdk.api.interceptor.publish.parameter.PublishInboundOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Counts retry-class publishes as they reach the broker. Never modifies or drops the packet.
 */
public class RetryInboundInterceptor implements PublishInboundInterceptor {

  private static final Logger log = LoggerFactory.getLogger(RetryInboundInterceptor.class);

  private final RetryGate gate;

  public RetryInboundInterceptor(RetryGate gate) {
    this.gate = Objects.requireNonNull(gate, "gate");
  }

  @Override
  public void onInboundPublish(@NotNull PublishInboundInput input, @NotNull PublishInboundOutput output) {
    try {
      String topic = input.getPublishPacket().getTopic();
      MessageClass messageClass = gate.onInbound(topic);
      if (log.isDebugEnabled()) {
        log.debug("Inbound publish topic={} class={} pendingRetries={}",
            topic, messageClass, gate.pendingRetries());
      }
    } catch (RuntimeException e) {
      log.error("Failed to inspect inbound publish", e);
    }
  }
}
