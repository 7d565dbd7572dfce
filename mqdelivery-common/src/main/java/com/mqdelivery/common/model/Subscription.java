/**
 * 主题订阅信息
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mqdelivery.common.protocol.MqttQos;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 主题订阅模型
 * 属于唯一一个会话，由SUBSCRIBE创建，UNSUBSCRIBE或会话销毁时移除
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    /**
     * 订阅者客户端ID
     */
    private String clientId;

    /**
     * 客户端提交的过滤器原文
     */
    private String topicFilter;

    /**
     * 去掉共享前缀后的过滤器
     */
    private String filter;

    /**
     * 共享组名，非共享订阅为null
     */
    private String shareGroup;

    /**
     * 授予的QoS
     */
    @Builder.Default
    private MqttQos qos = MqttQos.AT_MOST_ONCE;

    /**
     * 不接收自己发布的消息（MQTT 5.0）
     */
    private boolean noLocal;

    /**
     * 转发时保留原始RETAIN标志（MQTT 5.0）
     */
    private boolean retainAsPublished;

    @Builder.Default
    private RetainHandling retainHandling = RetainHandling.SEND_ON_SUBSCRIBE;

    /**
     * 订阅标识符（MQTT 5.0）
     */
    private Integer subscriptionIdentifier;

    @JsonIgnore
    public boolean isShared() {
        return shareGroup != null;
    }

    /**
     * 计算订阅者的有效QoS
     */
    public MqttQos getEffectiveQos(MqttQos publishQos) {
        return qos.min(publishQos);
    }

    /**
     * 保留消息处理方式
     */
    public enum RetainHandling {
        /**
         * 订阅时发送保留消息
         */
        SEND_ON_SUBSCRIBE(0),

        /**
         * 仅新订阅时发送
         */
        SEND_IF_NEW(1),

        /**
         * 不发送
         */
        DO_NOT_SEND(2);

        private final int value;

        RetainHandling(int value) {
            this.value = value;
        }

        public int getValue() {
            return value;
        }

        public static RetainHandling fromValue(int value) {
            for (RetainHandling handling : values()) {
                if (handling.value == value) {
                    return handling;
                }
            }
            throw new IllegalArgumentException("Invalid retain handling: " + value);
        }
    }
}
