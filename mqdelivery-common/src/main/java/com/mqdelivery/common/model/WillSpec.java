/**
 * 遗嘱消息
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
 * CONNECT时附带的遗嘱，异常断开时最多发布一次
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WillSpec {

    private String topic;

    @Builder.Default
    private byte[] payload = new byte[0];

    @Builder.Default
    private MqttQos qos = MqttQos.AT_MOST_ONCE;

    private boolean retain;

    /**
     * 遗嘱延迟（秒），0表示立即发布
     */
    private long delaySeconds;

    /**
     * 遗嘱消息过期间隔（秒），null表示不过期
     */
    private Long messageExpiryInterval;

    /**
     * 转换为普通发布消息，走正常发布路径
     *
     * @param publisherId 客户端ID
     * @param now         当前时间（毫秒）
     * @return 发布消息
     */
    public PublishMessage toPublishMessage(String publisherId, long now) {
        return PublishMessage.builder()
                .topic(topic)
                .payload(payload)
                .qos(qos)
                .retain(retain)
                .publisherId(publisherId)
                .expiresAt(messageExpiryInterval == null ? null : now + messageExpiryInterval * 1000L)
                .build();
    }
}
