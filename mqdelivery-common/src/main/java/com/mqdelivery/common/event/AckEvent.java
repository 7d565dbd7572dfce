package com.mqdelivery.common.event;

import com.mqdelivery.common.protocol.PacketType;
import com.mqdelivery.common.protocol.ReasonCode;

import java.util.Objects;

/**
 * 客户端发来的PUBACK / PUBREC / PUBREL / PUBCOMP
 */
public record AckEvent(PacketType type, int packetId, ReasonCode reasonCode) {

    public AckEvent {
        Objects.requireNonNull(type, "type");
        if (!type.isPublishAck()) {
            throw new IllegalArgumentException("Not a publish acknowledgement: " + type);
        }
        if (reasonCode == null) {
            reasonCode = ReasonCode.SUCCESS;
        }
    }

    public static AckEvent of(PacketType type, int packetId) {
        return new AckEvent(type, packetId, ReasonCode.SUCCESS);
    }
}
