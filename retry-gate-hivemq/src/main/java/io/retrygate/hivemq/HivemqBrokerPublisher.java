package io.retrygate.hivemq;

import io.retrygate.GateMessage;
import io.retrygate.spi.BrokerPublisher;
import com.hivemq.extension.sdk.api.services.builder.PublishBuilder;
import com.hivemq.extension.sdk.api.services.publish.Publish;
import com.hivemq.extension.sdk.api.services.publish.PublishService;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Republishes deferred messages through HiveMQ's {@link PublishService}, so they are routed
 * to subscribers again and pass the outbound interceptors like any other publish.
 */
public final class HivemqBrokerPublisher implements BrokerPublisher {

  private final PublishService publishService;
  private final Supplier<PublishBuilder> builders;

  /**
   * @param publishService the broker's publish service
   * @param builders       source of fresh publish builders, normally {@code Builders::publish}
   */
  public HivemqBrokerPublisher(PublishService publishService, Supplier<PublishBuilder> builders) {
    this.publishService = Objects.requireNonNull(publishService, "publishService");
    this.builders = Objects.requireNonNull(builders, "builders");
  }

  @Override
  public CompletionStage<Void> publish(GateMessage message) {
    Publish publish = builders.get()
        .topic(message.topic())
        .qos(Packets.toBrokerQos(message.qos()))
        .retain(message.retain())
        .payload(ByteBuffer.wrap(message.payload()))
        .build();
    return publishService.publish(publish);
  }
}
