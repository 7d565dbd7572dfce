package com.mqdelivery.backend.storage.serializer;

import com.mqdelivery.common.model.DeliveryState;
import com.mqdelivery.common.model.InflightMessage;
import com.mqdelivery.common.model.QueuedMessage;
import com.mqdelivery.common.model.SessionSnapshot;
import com.mqdelivery.common.model.Subscription;
import com.mqdelivery.common.model.WillSpec;
import com.mqdelivery.common.protocol.MqttQos;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonStorageSerializerTest {

    private final JsonStorageSerializer<SessionSnapshot> serializer =
            JsonStorageSerializer.forType(SessionSnapshot.class);

    @Test
    void testSessionSnapshotKeepsDeliveryState() throws Exception {
        SessionSnapshot snapshot = SessionSnapshot.builder()
                .clientId("sensor1")
                .sessionId("sess_1")
                .sessionExpiryInterval(3600)
                .createdAt(1000L)
                .disconnectedAt(2000L)
                .subscriptions(List.of(Subscription.builder()
                        .clientId("sensor1").topicFilter("$share/g/a/+").filter("a/+").shareGroup("g")
                        .qos(MqttQos.EXACTLY_ONCE).subscriptionIdentifier(7).build()))
                .outboundInflight(List.of(InflightMessage.builder()
                        .packetId(3).direction(InflightMessage.Direction.SEND).state(DeliveryState.RELEASED)
                        .qos(MqttQos.EXACTLY_ONCE).topic("a/b").build()))
                .queue(List.of(QueuedMessage.builder()
                        .topic("cmd/sensor1").payload("on".getBytes(StandardCharsets.UTF_8))
                        .qos(MqttQos.AT_LEAST_ONCE).queuedAt(1500L).build()))
                .will(WillSpec.builder().topic("status/sensor1").payload("offline".getBytes(StandardCharsets.UTF_8))
                        .qos(MqttQos.AT_LEAST_ONCE).retain(true).delaySeconds(5).build())
                .nextPacketId(4)
                .build();

        SessionSnapshot restored = serializer.deserialize(serializer.serialize(snapshot));

        assertEquals("sensor1", restored.getClientId());
        assertEquals(3600, restored.getSessionExpiryInterval());
        assertEquals(4, restored.getNextPacketId());
        Subscription subscription = restored.getSubscriptions().get(0);
        assertTrue(subscription.isShared());
        assertEquals("a/+", subscription.getFilter());
        assertEquals(Integer.valueOf(7), subscription.getSubscriptionIdentifier());
        assertEquals(DeliveryState.RELEASED, restored.getOutboundInflight().get(0).getState());
        assertNull(restored.getOutboundInflight().get(0).getPayload());
        assertArrayEquals("on".getBytes(StandardCharsets.UTF_8), restored.getQueue().get(0).getPayload());
        assertEquals(5, restored.getWill().getDelaySeconds());
        assertTrue(restored.getWill().isRetain());
    }

    @Test
    void testEmptyBytesDeserializeToNull() throws Exception {
        assertNull(serializer.deserialize(new byte[0]));
        assertNull(serializer.serialize(null));
    }

    @Test
    void testCorruptBytesRaiseSerializationException() {
        byte[] corrupt = "{not json".getBytes(StandardCharsets.UTF_8);
        assertThrows(StorageSerializer.SerializationException.class, () -> serializer.deserialize(corrupt));
    }
}
