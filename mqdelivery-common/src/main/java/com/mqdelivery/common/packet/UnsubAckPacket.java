package com.mqdelivery.common.packet;

import com.mqdelivery.common.protocol.PacketType;
import com.mqdelivery.common.protocol.ReasonCode;

import java.util.List;

/**
 * UNSUBACK
 */
public record UnsubAckPacket(int packetId, List<ReasonCode> reasonCodes) implements OutboundPacket {

    public UnsubAckPacket {
        reasonCodes = List.copyOf(reasonCodes);
    }

    @Override
    public PacketType type() {
        return PacketType.UNSUBACK;
    }
}
