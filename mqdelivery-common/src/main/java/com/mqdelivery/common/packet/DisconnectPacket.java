package com.mqdelivery.common.packet;

import com.mqdelivery.common.protocol.PacketType;
import com.mqdelivery.common.protocol.ReasonCode;

import java.util.Objects;

/**
 * 代理主动断开时发出的DISCONNECT
 */
public record DisconnectPacket(ReasonCode reasonCode) implements OutboundPacket {

    public DisconnectPacket {
        Objects.requireNonNull(reasonCode, "reasonCode");
    }

    @Override
    public PacketType type() {
        return PacketType.DISCONNECT;
    }
}
