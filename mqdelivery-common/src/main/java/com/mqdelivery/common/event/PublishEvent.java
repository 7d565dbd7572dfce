package com.mqdelivery.common.event;

import com.mqdelivery.common.protocol.MqttQos;

import java.util.Objects;

/**
 * 解码后的PUBLISH
 *
 * @param packetId              QoS 0 时为0
 * @param messageExpiryInterval 消息过期间隔（秒），null表示不过期
 * @param authorized            外部ACL判定
 */
public record PublishEvent(String topic, byte[] payload, MqttQos qos, boolean retain, boolean dup,
                           int packetId, Long messageExpiryInterval, boolean authorized) {

    public PublishEvent {
        Objects.requireNonNull(qos, "qos");
        if (payload == null) {
            payload = new byte[0];
        }
    }

    public static PublishEvent of(String topic, byte[] payload, MqttQos qos, boolean retain, int packetId) {
        return new PublishEvent(topic, payload, qos, retain, false, packetId, null, true);
    }

    public PublishEvent asDuplicate() {
        return new PublishEvent(topic, payload, qos, retain, true, packetId, messageExpiryInterval, authorized);
    }
}
