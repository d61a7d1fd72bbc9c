package io.retrygate.hivemq;

import io.retrygate.RetryGate;
import com.hivemq.extension.sdk.api.annotations.NotNull;
import com.hivemq.extension.sdk.api.client.ClientContext;
import com.hivemq.extension.sdk.api.client.parameter.InitializerInput;
import com.hivemq.extension.sdk.api.services.intializer.ClientInitializer;

/**
 * Adds the gate's interceptors to every client. The interceptors are stateless, so one pair
 * is shared across all clients.
 */
public class RetryGateInitializer implements ClientInitializer {

  private final RetryInboundInterceptor inbound;
  private final RetryOutboundInterceptor outbound;

  public RetryGateInitializer(RetryGate gate) {
    this.inbound = new RetryInboundInterceptor(gate);
    this.outbound = new RetryOutboundInterceptor(gate);
  }

  @Override
  public void initialize(@NotNull InitializerInput initializerInput, @NotNull ClientContext clientContext) {
    clientContext.addPublishInboundInterceptor(inbound);
    clientContext.addPublishOutboundInterceptor(outbound);
  }
}
