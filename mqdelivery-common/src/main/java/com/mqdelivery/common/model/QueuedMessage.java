/**
 * 排队消息信息
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
 * 排队消息模型
 * 会话离线或发送窗口已满时暂存，等待按顺序投递
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueuedMessage {

    /**
     * 主题
     */
    private String topic;

    /**
     * 消息负载
     */
    private byte[] payload;

    /**
     * 订阅者的有效QoS
     */
    private MqttQos qos;

    /**
     * 保留消息标志
     */
    private boolean retain;

    /**
     * 订阅标识符（MQTT 5.0）
     */
    private Integer subscriptionIdentifier;

    /**
     * 入队时间（毫秒）
     */
    private long queuedAt;

    /**
     * 过期时间点（毫秒），null表示不过期
     */
    private Long expiresAt;

    public boolean isExpired(long now) {
        return expiresAt != null && now >= expiresAt;
    }
}
