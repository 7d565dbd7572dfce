/**
 * 飞行消息状态
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.model;

/**
 * QoS 1/2 飞行消息在状态机中的位置
 * QoS 1 发送方: PENDING -> ACKED
 * QoS 2 发送方: PENDING -> RELEASED -> COMPLETE
 * QoS 2 接收方: RECEIVED -> COMPLETE
 */
public enum DeliveryState {
    /**
     * 已发送PUBLISH，等待PUBACK/PUBREC
     */
    PENDING,

    /**
     * 已收到PUBACK
     */
    ACKED,

    /**
     * 接收方已记录包标识符并回复PUBREC，等待PUBREL
     */
    RECEIVED,

    /**
     * 发送方已收到PUBREC并发出PUBREL，等待PUBCOMP
     */
    RELEASED,

    /**
     * 握手完成
     */
    COMPLETE;

    /**
     * 终态的条目可以从飞行表移除，包标识符可复用
     */
    public boolean isTerminal() {
        return this == ACKED || this == COMPLETE;
    }
}
