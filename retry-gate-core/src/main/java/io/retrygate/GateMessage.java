package io.retrygate;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable snapshot of a broker message: routing key, payload, quality level and
 * retain flag.
 *
 * <p>The payload is copied on the way in and on the way out, so a snapshot taken
 * inside a broker callback stays valid after the callback returns. A {@code null}
 * payload is stored as an empty one.
 */
public final class GateMessage {
    private static final byte[] EMPTY = new byte[0];

    private final String topic;
    private final byte[] payload;
    private final Qos qos;
    private final boolean retain;

    public GateMessage(String topic, byte[] payload, Qos qos, boolean retain) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.qos = Objects.requireNonNull(qos, "qos");
        this.payload = payload == null ? EMPTY : Arrays.copyOf(payload, payload.length);
        this.retain = retain;
    }

    /**
     * Creates a non-retained message with a UTF-8 text payload.
     *
     * @param topic   the routing key
     * @param payload the payload text
     * @param qos     the quality level
     * @return a new message
     */
    public static GateMessage ofText(String topic, String payload, Qos qos) {
        Objects.requireNonNull(payload, "payload");
        return new GateMessage(topic, payload.getBytes(StandardCharsets.UTF_8), qos, false);
    }

    public String topic() {
        return topic;
    }

    public byte[] payload() {
        return Arrays.copyOf(payload, payload.length);
    }

    public int payloadSize() {
        return payload.length;
    }

    /**
     * Decodes the payload as UTF-8. Intended for logging.
     *
     * @return the payload text
     */
    public String payloadText() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public Qos qos() {
        return qos;
    }

    public boolean retain() {
        return retain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GateMessage other)) return false;
        return retain == other.retain
            && topic.equals(other.topic)
            && qos == other.qos
            && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(topic, qos, retain);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "GateMessage{topic=" + topic
            + ", qos=" + qos
            + ", retain=" + retain
            + ", payloadBytes=" + payload.length + '}';
    }
}
