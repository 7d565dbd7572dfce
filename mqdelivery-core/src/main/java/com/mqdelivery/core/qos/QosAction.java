package com.mqdelivery.core.qos;

/**
 * 状态迁移产生的动作，由调用方按顺序执行
 */
public enum QosAction {
    SEND_PUBLISH,
    SEND_PUBLISH_DUP,
    SEND_PUBREL,
    SEND_PUBACK,
    SEND_PUBREC,
    SEND_PUBCOMP,
    /**
     * 写入飞行表（持久会话同时写入后端）
     */
    STORE,
    /**
     * 交给路由（接收方向）
     */
    DELIVER,
    /**
     * 丢弃负载副本，只保留包标识符
     */
    DROP_PAYLOAD,
    /**
     * 从飞行表移除，包标识符可复用
     */
    DISCARD,
    SCHEDULE_RETRANSMIT,
    CANCEL_RETRANSMIT
}
