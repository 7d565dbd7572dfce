/**
 * 保留消息
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
 * 每个主题最多一条的保留消息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetainedEntry {

    /**
     * 主题名（非过滤器）
     */
    private String topic;

    private byte[] payload;

    private MqttQos qos;

    private String publisherId;

    /**
     * 存储时间（毫秒）
     */
    private long storedAt;

    /**
     * 过期时间点（毫秒），null表示不过期
     */
    private Long expiresAt;

    public boolean isExpired(long now) {
        return expiresAt != null && now >= expiresAt;
    }

    public static RetainedEntry from(PublishMessage message, long now) {
        return RetainedEntry.builder()
                .topic(message.getTopic())
                .payload(message.getPayload())
                .qos(message.getQos())
                .publisherId(message.getPublisherId())
                .storedAt(now)
                .expiresAt(message.getExpiresAt())
                .build();
    }
}
