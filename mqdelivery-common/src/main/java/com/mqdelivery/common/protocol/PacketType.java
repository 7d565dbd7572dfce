/**
 * MQTT控制包类型枚举
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.protocol;

/**
 * 投递引擎收发的控制包类型
 * 字节级编解码由外部完成，这里只保留类型语义
 */
public enum PacketType {
    CONNECT(1, false),
    CONNACK(2, false),
    PUBLISH(3, true),
    PUBACK(4, true),
    PUBREC(5, true),
    PUBREL(6, true),
    PUBCOMP(7, true),
    SUBSCRIBE(8, true),
    SUBACK(9, true),
    UNSUBSCRIBE(10, true),
    UNSUBACK(11, true),
    PINGREQ(12, false),
    PINGRESP(13, false),
    DISCONNECT(14, false);

    /**
     * 包类型值（固定头高4位）
     */
    private final int value;

    /**
     * 是否携带包标识符
     */
    private final boolean hasPacketId;

    PacketType(int value, boolean hasPacketId) {
        this.value = value;
        this.hasPacketId = hasPacketId;
    }

    public int getValue() {
        return value;
    }

    public boolean hasPacketId() {
        return hasPacketId;
    }

    /**
     * 是否是QoS 1/2 发布流程中的确认包
     */
    public boolean isPublishAck() {
        return this == PUBACK || this == PUBREC || this == PUBREL || this == PUBCOMP;
    }
}
