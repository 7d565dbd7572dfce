/**
 * 发送方状态机
 *
 * @author zhenglin
 * @date 2026/10/10
 */
package com.mqdelivery.core.qos;

import com.mqdelivery.common.model.DeliveryState;
import com.mqdelivery.common.protocol.MqttQos;

import static com.mqdelivery.core.qos.QosAction.CANCEL_RETRANSMIT;
import static com.mqdelivery.core.qos.QosAction.DISCARD;
import static com.mqdelivery.core.qos.QosAction.DROP_PAYLOAD;
import static com.mqdelivery.core.qos.QosAction.SCHEDULE_RETRANSMIT;
import static com.mqdelivery.core.qos.QosAction.SEND_PUBLISH;
import static com.mqdelivery.core.qos.QosAction.SEND_PUBLISH_DUP;
import static com.mqdelivery.core.qos.QosAction.SEND_PUBREL;
import static com.mqdelivery.core.qos.QosAction.STORE;

/**
 * 代理作为发送方（代理 -> 订阅者）的纯状态迁移函数
 *
 * QoS 1: PENDING -> ACKED
 * QoS 2: PENDING -> RELEASED -> COMPLETE
 * 超时和重连时重发最后一个出站控制包；当前状态下无效的事件被忽略。
 */
public final class OutboundFlow {

    private OutboundFlow() {
    }

    /**
     * @param qos   消息的有效QoS
     * @param state 当前状态，条目尚不存在时为null
     * @param event 事件
     * @return 迁移结果
     */
    public static Transition apply(MqttQos qos, DeliveryState state, QosEvent event) {
        if (qos == MqttQos.AT_MOST_ONCE) {
            return event == QosEvent.SEND && state == null
                    ? Transition.to(DeliveryState.COMPLETE, SEND_PUBLISH)
                    : Transition.ignored(state);
        }
        if (state == null) {
            return event == QosEvent.SEND
                    ? Transition.to(DeliveryState.PENDING, STORE, SEND_PUBLISH, SCHEDULE_RETRANSMIT)
                    : Transition.ignored(null);
        }
        switch (state) {
            case PENDING:
                return fromPending(qos, event);
            case RELEASED:
                return fromReleased(event);
            default:
                return Transition.ignored(state);
        }
    }

    private static Transition fromPending(MqttQos qos, QosEvent event) {
        switch (event) {
            case PUBACK:
                return qos == MqttQos.AT_LEAST_ONCE
                        ? Transition.to(DeliveryState.ACKED, DISCARD, CANCEL_RETRANSMIT)
                        : Transition.ignored(DeliveryState.PENDING);
            case PUBREC:
                return qos == MqttQos.EXACTLY_ONCE
                        ? Transition.to(DeliveryState.RELEASED, DROP_PAYLOAD, STORE, SEND_PUBREL, SCHEDULE_RETRANSMIT)
                        : Transition.ignored(DeliveryState.PENDING);
            case PUBREC_REJECTED:
                return qos == MqttQos.EXACTLY_ONCE
                        ? Transition.to(DeliveryState.COMPLETE, DISCARD, CANCEL_RETRANSMIT)
                        : Transition.ignored(DeliveryState.PENDING);
            case RETRANSMIT_TIMEOUT:
            case RESUME:
                return Transition.to(DeliveryState.PENDING, SEND_PUBLISH_DUP, SCHEDULE_RETRANSMIT);
            default:
                return Transition.ignored(DeliveryState.PENDING);
        }
    }

    private static Transition fromReleased(QosEvent event) {
        switch (event) {
            case PUBREC:
                // PUBREL 丢失后对端重发了PUBREC
                return Transition.to(DeliveryState.RELEASED, SEND_PUBREL);
            case PUBCOMP:
                return Transition.to(DeliveryState.COMPLETE, DISCARD, CANCEL_RETRANSMIT);
            case RETRANSMIT_TIMEOUT:
            case RESUME:
                return Transition.to(DeliveryState.RELEASED, SEND_PUBREL, SCHEDULE_RETRANSMIT);
            default:
                return Transition.ignored(DeliveryState.RELEASED);
        }
    }
}
