/**
 * 发布消息
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
 * 进入路由的一条应用消息，来源是客户端PUBLISH或遗嘱
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PublishMessage {

    /**
     * 主题名
     */
    private String topic;

    /**
     * 消息负载
     */
    @Builder.Default
    private byte[] payload = new byte[0];

    /**
     * 发布QoS
     */
    @Builder.Default
    private MqttQos qos = MqttQos.AT_MOST_ONCE;

    /**
     * 保留标志
     */
    private boolean retain;

    /**
     * 发布者客户端ID，用于noLocal判断
     */
    private String publisherId;

    /**
     * 过期时间点（毫秒），null表示不过期
     */
    private Long expiresAt;

    public boolean isExpired(long now) {
        return expiresAt != null && now >= expiresAt;
    }

    public boolean hasEmptyPayload() {
        return payload == null || payload.length == 0;
    }
}
