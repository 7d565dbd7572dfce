package com.mqdelivery.common.packet;

import com.mqdelivery.common.protocol.MqttQos;
import com.mqdelivery.common.protocol.PacketType;

import java.util.Objects;

/**
 * 发往订阅者的PUBLISH
 *
 * @param packetId QoS 0 时为0
 */
public record PublishPacket(String topic, byte[] payload, MqttQos qos, boolean retain, boolean dup,
                            int packetId, Integer subscriptionIdentifier) implements OutboundPacket {

    public PublishPacket {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(qos, "qos");
        if (qos == MqttQos.AT_MOST_ONCE && (packetId != 0 || dup)) {
            throw new IllegalArgumentException("QoS 0 PUBLISH carries neither packet id nor DUP");
        }
        if (qos != MqttQos.AT_MOST_ONCE && (packetId < 1 || packetId > 65535)) {
            throw new IllegalArgumentException("Invalid packet id: " + packetId);
        }
        if (payload == null) {
            payload = new byte[0];
        }
    }

    @Override
    public PacketType type() {
        return PacketType.PUBLISH;
    }
}
