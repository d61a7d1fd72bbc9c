package io.retrygate.hivemq;

import io.retrygate.GateMessage;
import io.retrygate.Qos;
import com.hivemq.extension.sdk.api.packets.publish.PublishPacket;

import java.nio.ByteBuffer;

/**
 * Conversions between HiveMQ publish packets and gate messages.
 */
final class Packets {

  private Packets() {
  }

  /**
   * Snapshots a packet. The packet's payload buffer is read through a duplicate so its
   * position is left untouched for the broker.
   */
  static GateMessage toMessage(PublishPacket packet) {
    byte[] payload = packet.getPayload()
        .map(Packets::bytes)
        .orElse(null);
    return new GateMessage(packet.getTopic(), payload, toGateQos(packet.getQos()), packet.getRetain());
  }

  static Qos toGateQos(com.hivemq.extension.sdk.api.packets.general.Qos qos) {
    switch (qos) {
      case AT_MOST_ONCE:
        return Qos.AT_MOST_ONCE;
      case AT_LEAST_ONCE:
        return Qos.AT_LEAST_ONCE;
      case EXACTLY_ONCE:
        return Qos.EXACTLY_ONCE;
      default:
        throw new IllegalArgumentException("Unknown QoS: " + qos);
    }
  }

  static com.hivemq.extension.sdk.api.packets.general.Qos toBrokerQos(Qos qos) {
    switch (qos) {
      case AT_MOST_ONCE:
        return com.hivemq.extension.sdk.api.packets.general.Qos.AT_MOST_ONCE;
      case AT_LEAST_ONCE:
        return com.hivemq.extension.sdk.api.packets.general.Qos.AT_LEAST_ONCE;
      case EXACTLY_ONCE:
        return com.hivemq.extension.sdk.api.packets.general.Qos.EXACTLY_ONCE;
      default:
        throw new IllegalArgumentException("Unknown QoS: " + qos);
    }
  }

  private static byte[] bytes(ByteBuffer buffer) {
    ByteBuffer view = buffer.duplicate();
    byte[] bytes = new byte[view.remaining()];
    view.get(bytes);
    return bytes;
  }
}
