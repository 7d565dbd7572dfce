package com.mqdelivery.common.packet;

import com.mqdelivery.common.protocol.PacketType;
import com.mqdelivery.common.protocol.ReasonCode;

import java.util.List;

/**
 * SUBACK，每个过滤器一个结果码，顺序与SUBSCRIBE一致
 */
public record SubAckPacket(int packetId, List<ReasonCode> reasonCodes) implements OutboundPacket {

    public SubAckPacket {
        reasonCodes = List.copyOf(reasonCodes);
    }

    @Override
    public PacketType type() {
        return PacketType.SUBACK;
    }
}
