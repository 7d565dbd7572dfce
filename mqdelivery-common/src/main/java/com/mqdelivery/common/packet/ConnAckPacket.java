package com.mqdelivery.common.packet;

import com.mqdelivery.common.protocol.PacketType;
import com.mqdelivery.common.protocol.ReasonCode;

import java.util.Objects;

/**
 * CONNACK
 *
 * @param sessionPresent   是否恢复了已有会话
 * @param reasonCode       连接结果
 * @param assignedClientId 代理分配的客户端ID，客户端提供了ID时为null
 */
public record ConnAckPacket(boolean sessionPresent, ReasonCode reasonCode, String assignedClientId)
        implements OutboundPacket {

    public ConnAckPacket {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (!reasonCode.isSuccess() && sessionPresent) {
            throw new IllegalArgumentException("sessionPresent must be false on a refused connection");
        }
    }

    public static ConnAckPacket refused(ReasonCode reasonCode) {
        return new ConnAckPacket(false, reasonCode, null);
    }

    @Override
    public PacketType type() {
        return PacketType.CONNACK;
    }
}
