/**
 * MQTT QoS级别定义
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.protocol;

/**
 * MQTT服务质量（Quality of Service）级别
 * 决定投递引擎为一条消息维护哪一种状态机
 */
public enum MqttQos {
    /**
     * 至多一次：无状态，不确认，不重传
     */
    AT_MOST_ONCE(0),

    /**
     * 至少一次：PENDING -> ACKED，可能重复
     */
    AT_LEAST_ONCE(1),

    /**
     * 恰好一次：PUBLISH/PUBREC/PUBREL/PUBCOMP 四步握手
     */
    EXACTLY_ONCE(2);

    private final int value;

    MqttQos(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * 根据值获取QoS级别
     *
     * @param value QoS级别值
     * @return QoS级别
     * @throws IllegalArgumentException 如果QoS级别不支持
     */
    public static MqttQos fromValue(int value) {
        for (MqttQos qos : values()) {
            if (qos.value == value) {
                return qos;
            }
        }
        throw new IllegalArgumentException("Invalid QoS level: " + value);
    }

    /**
     * 是否需要对端确认（QoS 1和2）
     */
    public boolean requiresAcknowledgment() {
        return this != AT_MOST_ONCE;
    }

    /**
     * 取两者中较低的级别，用于计算订阅者的有效QoS
     *
     * @param other 另一个QoS级别
     * @return 较低的QoS级别
     */
    public MqttQos min(MqttQos other) {
        return this.value <= other.value ? this : other;
    }

    /**
     * 取两者中较高的级别
     *
     * @param other 另一个QoS级别
     * @return 较高的QoS级别
     */
    public MqttQos max(MqttQos other) {
        return this.value >= other.value ? this : other;
    }

    @Override
    public String toString() {
        return "QoS " + value;
    }
}
