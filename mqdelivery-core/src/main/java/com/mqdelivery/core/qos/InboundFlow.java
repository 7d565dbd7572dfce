/**
 * 接收方状态机
 *
 * @author zhenglin
 * @date 2026/10/10
 */
package com.mqdelivery.core.qos;

import com.mqdelivery.common.model.DeliveryState;
import com.mqdelivery.common.protocol.MqttQos;

import static com.mqdelivery.core.qos.QosAction.DELIVER;
import static com.mqdelivery.core.qos.QosAction.DISCARD;
import static com.mqdelivery.core.qos.QosAction.SEND_PUBACK;
import static com.mqdelivery.core.qos.QosAction.SEND_PUBCOMP;
import static com.mqdelivery.core.qos.QosAction.SEND_PUBREC;
import static com.mqdelivery.core.qos.QosAction.STORE;

/**
 * 代理作为接收方（发布者 -> 代理）的纯状态迁移函数
 *
 * QoS 2 的消息在PUBLISH时只记录为RECEIVED，收到PUBREL才交给路由，
 * RECEIVED标记保证重复的PUBLISH和PUBREL都不会再次投递。
 */
public final class InboundFlow {

    private InboundFlow() {
    }

    /**
     * @param qos   PUBLISH的QoS
     * @param state 该包标识符的当前状态，没有记录时为null
     * @param event PUBLISH 或 PUBREL
     * @return 迁移结果
     */
    public static Transition apply(MqttQos qos, DeliveryState state, QosEvent event) {
        if (event == QosEvent.PUBLISH) {
            switch (qos) {
                case AT_MOST_ONCE:
                    return Transition.to(DeliveryState.COMPLETE, DELIVER);
                case AT_LEAST_ONCE:
                    // 重复的PUBLISH同样投递并确认
                    return Transition.to(DeliveryState.ACKED, DELIVER, SEND_PUBACK);
                default:
                    return state == DeliveryState.RECEIVED
                            ? Transition.to(DeliveryState.RECEIVED, SEND_PUBREC)
                            : Transition.to(DeliveryState.RECEIVED, STORE, SEND_PUBREC);
            }
        }
        if (event == QosEvent.PUBREL) {
            return state == DeliveryState.RECEIVED
                    ? Transition.to(DeliveryState.COMPLETE, DELIVER, DISCARD, SEND_PUBCOMP)
                    // 标记已清除：重复的PUBREL，只回复PUBCOMP
                    : Transition.to(null, SEND_PUBCOMP);
        }
        return Transition.ignored(state);
    }
}
