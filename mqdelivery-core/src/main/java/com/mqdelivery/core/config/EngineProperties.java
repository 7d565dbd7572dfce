/**
 * 投递引擎配置
 *
 * @author zhenglin
 * @date 2026/10/10
 */
package com.mqdelivery.core.config;

import com.mqdelivery.common.model.SessionExpiry;
import com.mqdelivery.common.protocol.MqttQos;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 投递引擎配置类
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "mqdelivery.engine")
public class EngineProperties {

    /**
     * 未确认的PUBLISH/PUBREL重传间隔（毫秒）
     */
    private long retransmitIntervalMs = 5000;

    /**
     * 保活超时 = 保活间隔 × 该系数
     */
    private double keepAliveMultiplier = 1.5;

    /**
     * 每个会话出站未确认QoS 1/2消息上限，与客户端receive-maximum取较小值
     */
    private int maxInflightMessages = 100;

    /**
     * 每个会话入站QoS 2 RECEIVED标记上限
     */
    private int receiveMaximum = 100;

    /**
     * 每个会话离线队列长度上限
     */
    private int maxQueuedMessages = 1000;

    /**
     * 离线持久会话是否也排队QoS 0消息
     */
    private boolean queueQos0WhenOffline = false;

    /**
     * 保留消息主题数上限
     */
    private int maxRetainedMessages = 100_000;

    /**
     * 订阅可授予的最高QoS
     */
    private int maxQos = 2;

    /**
     * 未携带会话过期间隔且clean=false时使用的过期间隔（秒）
     */
    private long defaultSessionExpirySeconds = SessionExpiry.NEVER;

    /**
     * 客户端可请求的最大会话过期间隔（秒）
     */
    private long maxSessionExpirySeconds = SessionExpiry.NEVER;

    /**
     * 会话过期和保留消息过期扫描间隔（毫秒）
     */
    private long maintenanceIntervalMs = 1000;

    /**
     * 定时器线程数
     */
    private int timerThreads = 2;

    public MqttQos getMaximumQos() {
        return MqttQos.fromValue(maxQos);
    }
}
