/**
 * 飞行消息
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.model;

import com.mqdelivery.common.protocol.MqttQos;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话飞行表中的一条QoS 1/2消息
 * 包标识符在同一会话、同一方向内唯一
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class InflightMessage {

    /**
     * 方向
     */
    public enum Direction {
        /**
         * 代理发给订阅者
         */
        SEND,

        /**
         * 发布者发给代理
         */
        RECEIVE
    }

    private int packetId;

    private Direction direction;

    private DeliveryState state;

    private String topic;

    /**
     * 收到PUBREC后丢弃
     */
    private byte[] payload;

    private MqttQos qos;

    private boolean retain;

    /**
     * 下一次发送PUBLISH是否带DUP
     */
    private boolean duplicate;

    private Integer subscriptionIdentifier;

    private Long expiresAt;

    /**
     * 发布者客户端ID（接收方向）
     */
    private String publisherId;

    private int retryCount;

    /**
     * 最后一次发送时间（毫秒）
     */
    private long lastSentAt;

    public void dropPayload() {
        this.payload = null;
    }

    public boolean isExpired(long now) {
        return expiresAt != null && now >= expiresAt;
    }
}
