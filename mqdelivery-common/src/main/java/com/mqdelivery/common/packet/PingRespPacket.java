package com.mqdelivery.common.packet;

import com.mqdelivery.common.protocol.PacketType;

/**
 * PINGRESP
 */
public record PingRespPacket() implements OutboundPacket {

    public static final PingRespPacket INSTANCE = new PingRespPacket();

    @Override
    public PacketType type() {
        return PacketType.PINGRESP;
    }
}
