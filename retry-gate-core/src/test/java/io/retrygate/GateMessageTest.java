package io.retrygate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GateMessageTest {

    @Test
    void payloadIsCopiedOnTheWayIn() {
        byte[] payload = {1, 2, 3};
        GateMessage message = new GateMessage("a/b", payload, Qos.AT_LEAST_ONCE, false);

        payload[0] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, message.payload());
    }

    @Test
    void payloadIsCopiedOnTheWayOut() {
        GateMessage message = new GateMessage("a/b", new byte[]{1, 2, 3}, Qos.AT_LEAST_ONCE, false);

        message.payload()[0] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, message.payload());
    }

    @Test
    void nullPayloadBecomesEmpty() {
        GateMessage message = new GateMessage("a/b", null, Qos.AT_MOST_ONCE, true);

        assertEquals(0, message.payloadSize());
        assertEquals("", message.payloadText());
    }

    @Test
    void equalityCoversEveryField() {
        GateMessage base = new GateMessage("a/b", new byte[]{1}, Qos.AT_LEAST_ONCE, false);

        assertEquals(base, new GateMessage("a/b", new byte[]{1}, Qos.AT_LEAST_ONCE, false));
        assertEquals(base.hashCode(), new GateMessage("a/b", new byte[]{1}, Qos.AT_LEAST_ONCE, false).hashCode());
        assertNotEquals(base, new GateMessage("a/c", new byte[]{1}, Qos.AT_LEAST_ONCE, false));
        assertNotEquals(base, new GateMessage("a/b", new byte[]{2}, Qos.AT_LEAST_ONCE, false));
        assertNotEquals(base, new GateMessage("a/b", new byte[]{1}, Qos.EXACTLY_ONCE, false));
        assertNotEquals(base, new GateMessage("a/b", new byte[]{1}, Qos.AT_LEAST_ONCE, true));
    }

    @Test
    void rejectsMissingTopicOrQos() {
        assertThrows(NullPointerException.class, () -> new GateMessage(null, null, Qos.AT_MOST_ONCE, false));
        assertThrows(NullPointerException.class, () -> new GateMessage("a", null, null, false));
    }

    @Test
    void qosCodesRoundTrip() {
        assertEquals(Qos.AT_MOST_ONCE, Qos.fromCode(0));
        assertEquals(Qos.AT_LEAST_ONCE, Qos.fromCode(1));
        assertEquals(Qos.EXACTLY_ONCE, Qos.fromCode(2));
        assertThrows(IllegalArgumentException.class, () -> Qos.fromCode(3));
    }
}
