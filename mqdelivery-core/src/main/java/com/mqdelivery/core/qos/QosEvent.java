package com.mqdelivery.core.qos;

/**
 * 驱动QoS状态机的事件
 */
public enum QosEvent {
    /**
     * 代理向订阅者首次发送
     */
    SEND,
    PUBACK,
    PUBREC,
    /**
     * 接收方在PUBREC中返回了失败原因码
     */
    PUBREC_REJECTED,
    PUBCOMP,
    RETRANSMIT_TIMEOUT,
    /**
     * 持久会话重连
     */
    RESUME,
    /**
     * 代理收到发布者的PUBLISH
     */
    PUBLISH,
    PUBREL
}
