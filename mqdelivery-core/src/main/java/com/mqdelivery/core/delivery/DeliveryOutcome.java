package com.mqdelivery.core.delivery;

/**
 * 单个接收者的投递结果
 */
public enum DeliveryOutcome {
    /**
     * 已写入连接
     */
    SENT,
    /**
     * 离线或发送窗口已满，进入会话队列
     */
    QUEUED,
    /**
     * QoS 0 离线、非持久会话离线或消息已过期
     */
    DROPPED,
    /**
     * 会话队列已满
     */
    DROPPED_QUOTA
}
