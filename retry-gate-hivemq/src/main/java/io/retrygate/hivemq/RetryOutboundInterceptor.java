package io.retrygate.hivemq;

import io.retrygate.GateDecision;
import io.retrygate.GateMessage;
import io.retrygate.RetryGate;
import io.retrygate.spi.DeliveryControl;
import com.hivemq.extension.sdk.api.annotations.NotNull;
import com.hivemq.extension.sdk.api.interceptor.publish.PublishOutboundInterceptor;
import com.hivemq.extension.sdk.api.interceptor.publish.parameter.PublishOutboundInput;
import com.hivemq.extension.sdk.api.interceptor.publish.parameter.PublishOutboundOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs every outbound delivery through the gate. A suppressed delivery is dropped with
 * {@link PublishOutboundOutput#preventPublishDelivery()} and republished later by the gate.
 */
public class RetryOutboundInterceptor implements PublishOutboundInterceptor {

  private static final Logger log = LoggerFactory.getLogger(RetryOutboundInterceptor.class);

  private final RetryGate gate;

  public RetryOutboundInterceptor(RetryGate gate) {
    this.gate = Objects.requireNonNull(gate, "gate");
  }

  @Override
  public void onOutboundPublish(@NotNull PublishOutboundInput input, @NotNull PublishOutboundOutput output) {
    GateDecision decision = gate.onOutbound(new OutboundDelivery(input, output));
    if (decision == GateDecision.SUPPRESSED && log.isDebugEnabled()) {
      try {
        log.debug("Held back publish on {} for client {}", input.getPublishPacket().getTopic(),
            input.getClientInformation().getClientId());
      } catch (RuntimeException e) {
        log.debug("Held back publish; client details unavailable", e);
      }
    }
  }

  /**
   * One delivery attempt to one subscriber.
   */
  static final class OutboundDelivery implements DeliveryControl {

    private final PublishOutboundInput input;
    private final PublishOutboundOutput output;

    OutboundDelivery(PublishOutboundInput input, PublishOutboundOutput output) {
      this.input = input;
      this.output = output;
    }

    @Override
    public String topic() {
      return input.getPublishPacket().getTopic();
    }

    @Override
    public GateMessage message() {
      return Packets.toMessage(input.getPublishPacket());
    }

    @Override
    public void suppressDelivery() {
      output.preventPublishDelivery();
    }
  }
}
