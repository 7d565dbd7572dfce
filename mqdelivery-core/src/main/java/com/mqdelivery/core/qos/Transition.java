package com.mqdelivery.core.qos;

import com.mqdelivery.common.model.DeliveryState;

import java.util.List;

/**
 * 一次状态迁移的结果
 *
 * @param next    迁移后的状态，条目不存在时为null
 * @param actions 需要执行的动作
 * @param ignored 事件在当前状态下无效，状态不变
 */
public record Transition(DeliveryState next, List<QosAction> actions, boolean ignored) {

    public Transition {
        actions = List.copyOf(actions);
    }

    public static Transition to(DeliveryState next, QosAction... actions) {
        return new Transition(next, List.of(actions), false);
    }

    public static Transition ignored(DeliveryState current) {
        return new Transition(current, List.of(), true);
    }

    public boolean has(QosAction action) {
        return actions.contains(action);
    }
}
