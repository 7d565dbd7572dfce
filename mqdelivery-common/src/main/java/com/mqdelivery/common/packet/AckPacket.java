package com.mqdelivery.common.packet;

import com.mqdelivery.common.protocol.PacketType;
import com.mqdelivery.common.protocol.ReasonCode;

import java.util.Objects;

/**
 * PUBACK / PUBREC / PUBREL / PUBCOMP
 */
public record AckPacket(PacketType type, int packetId, ReasonCode reasonCode) implements OutboundPacket {

    public AckPacket {
        Objects.requireNonNull(type, "type");
        if (!type.isPublishAck()) {
            throw new IllegalArgumentException("Not a publish acknowledgement: " + type);
        }
        if (reasonCode == null) {
            reasonCode = ReasonCode.SUCCESS;
        }
    }

    public static AckPacket of(PacketType type, int packetId) {
        return new AckPacket(type, packetId, ReasonCode.SUCCESS);
    }
}
