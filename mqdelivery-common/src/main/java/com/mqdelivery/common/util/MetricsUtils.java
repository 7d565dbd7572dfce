/**
 * 监控指标工具类
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

/**
 * 投递引擎的进程内指标
 * 默认注册到 SimpleMeterRegistry，应用可通过 {@link #setMeterRegistry} 替换
 */
public class MetricsUtils {

    /**
     * 默认度量注册表
     */
    private static volatile MeterRegistry meterRegistry = new SimpleMeterRegistry();

    private MetricsUtils() {
    }

    /**
     * 设置度量注册表
     *
     * @param registry 度量注册表
     */
    public static void setMeterRegistry(MeterRegistry registry) {
        if (registry != null) {
            meterRegistry = registry;
        }
    }

    /**
     * 获取度量注册表
     *
     * @return 度量注册表
     */
    public static MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    // ==================== 消息相关指标 ====================

    public static void recordPublishedMessage() {
        counter("mqtt.messages.published", "Number of published messages").increment();
    }

    public static void recordDeliveredMessage() {
        counter("mqtt.messages.delivered", "Number of messages written to subscribers").increment();
    }

    /**
     * 记录丢弃消息数
     *
     * @param reason 丢弃原因，作为标签
     */
    public static void recordDroppedMessage(String reason) {
        Counter.builder("mqtt.messages.dropped")
                .description("Number of dropped messages")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public static void recordQueuedMessage() {
        counter("mqtt.messages.queued", "Number of messages queued for offline or busy sessions").increment();
    }

    public static void recordRetransmission() {
        counter("mqtt.messages.retransmitted", "Number of PUBLISH/PUBREL retransmissions").increment();
    }

    /**
     * 记录QoS消息数
     *
     * @param qos QoS级别
     */
    public static void recordQosMessage(int qos) {
        Counter.builder("mqtt.messages.qos")
                .description("Messages by QoS level")
                .tag("qos", String.valueOf(qos))
                .register(meterRegistry)
                .increment();
    }

    // ==================== 会话相关指标 ====================

    public static void recordSessionCreated() {
        counter("mqtt.sessions.created", "Number of sessions created").increment();
    }

    public static void recordSessionExpired() {
        counter("mqtt.sessions.expired", "Number of sessions destroyed by expiry").increment();
    }

    public static void recordSessionTakeover() {
        counter("mqtt.sessions.takeover", "Number of connections taken over by a newer CONNECT").increment();
    }

    public static void recordWillFired() {
        counter("mqtt.wills.fired", "Number of will messages published").increment();
    }

    // ==================== 自定义指标 ====================

    /**
     * 创建仪表盘
     *
     * @param name        指标名称
     * @param description 指标描述
     * @param supplier    数值提供者
     * @return 仪表盘
     */
    public static Gauge createGauge(String name, String description, Supplier<Number> supplier) {
        return Gauge.builder(name, supplier, s -> s.get().doubleValue())
                .description(description)
                .register(meterRegistry);
    }

    /**
     * 读取计数器当前值，未注册时返回0
     */
    public static double count(String name) {
        Counter counter = meterRegistry.find(name).counter();
        return counter == null ? 0 : counter.count();
    }

    private static Counter counter(String name, String description) {
        return Counter.builder(name)
                .description(description)
                .register(meterRegistry);
    }

    /**
     * 清理所有指标
     */
    public static void clear() {
        meterRegistry.clear();
    }
}
