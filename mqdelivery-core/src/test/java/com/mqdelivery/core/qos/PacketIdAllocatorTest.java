package com.mqdelivery.core.qos;

import com.mqdelivery.common.exception.QuotaExceededException;
import com.mqdelivery.common.model.ClientSession;
import com.mqdelivery.common.model.DeliveryState;
import com.mqdelivery.common.model.InflightMessage;
import com.mqdelivery.common.protocol.MqttQos;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PacketIdAllocatorTest {

    @Test
    void testSequentialAllocation() {
        ClientSession session = new ClientSession("c1", "s1", 0, 0);
        assertEquals(1, PacketIdAllocator.allocate(session));
        assertEquals(2, PacketIdAllocator.allocate(session));
        assertEquals(3, session.getNextPacketId());
    }

    @Test
    void testWrapSkipsInUse() {
        ClientSession session = new ClientSession("c1", "s1", 0, 0);
        session.putOutbound(inflight(1));
        session.setNextPacketId(PacketIdAllocator.MAX_PACKET_ID);

        assertEquals(65535, PacketIdAllocator.allocate(session));
        // 回绕到1，但1仍在飞行中
        assertEquals(2, PacketIdAllocator.allocate(session));
    }

    @Test
    void testExhausted() {
        ClientSession session = new ClientSession("c1", "s1", 0, 0);
        for (int id = 1; id <= PacketIdAllocator.MAX_PACKET_ID; id++) {
            session.putOutbound(inflight(id));
        }
        assertThrows(QuotaExceededException.class, () -> PacketIdAllocator.allocate(session));

        session.removeOutbound(40000);
        session.setNextPacketId(1);
        assertEquals(40000, PacketIdAllocator.allocate(session));
    }

    private static InflightMessage inflight(int packetId) {
        return InflightMessage.builder()
                .packetId(packetId)
                .direction(InflightMessage.Direction.SEND)
                .state(DeliveryState.PENDING)
                .topic("t")
                .qos(MqttQos.AT_LEAST_ONCE)
                .build();
    }
}
