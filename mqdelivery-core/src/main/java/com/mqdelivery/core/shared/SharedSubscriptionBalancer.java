/**
 * 共享订阅均衡器
 *
 * @author zhenglin
 * @date 2026/10/10
 */
package com.mqdelivery.core.shared;

import com.mqdelivery.common.model.ClientSession;
import com.mqdelivery.common.model.Subscription;
import com.mqdelivery.common.protocol.MqttQos;
import com.mqdelivery.core.session.SessionStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 为共享组中的每条消息选出唯一的接收者
 *
 * 成员按客户端ID排序后轮询。轮到的成员离线时顺延到下一个在线成员；
 * 全组离线时，QoS 1/2 消息排入轮询选中成员的持久会话队列，QoS 0 消息丢弃。
 */
@Slf4j
public class SharedSubscriptionBalancer {

    private final LoadBalancer<Subscription> loadBalancer;
    private final SessionStore sessionStore;

    public SharedSubscriptionBalancer(LoadBalancer<Subscription> loadBalancer, SessionStore sessionStore) {
        this.loadBalancer = loadBalancer;
        this.sessionStore = sessionStore;
    }

    /**
     * 共享组的均衡维度：组名加过滤器
     */
    public static String groupKey(Subscription subscription) {
        return subscription.getShareGroup() + "/" + subscription.getFilter();
    }

    /**
     * 选出接收者
     *
     * @param groupKey   共享组键
     * @param members    该组中与消息匹配的订阅
     * @param publishQos 发布QoS
     * @return 选中的订阅和会话，没有可投递的成员时为空
     */
    public Optional<Selection> select(String groupKey, List<Subscription> members, MqttQos publishQos) {
        if (members.isEmpty()) {
            return Optional.empty();
        }
        List<Subscription> ordered = new ArrayList<>(members);
        ordered.sort(Comparator.comparing(Subscription::getClientId));
        Subscription chosen = loadBalancer.select(ordered, groupKey);
        int start = ordered.indexOf(chosen);
        for (int i = 0; i < ordered.size(); i++) {
            Subscription candidate = ordered.get((start + i) % ordered.size());
            Optional<ClientSession> session = sessionStore.get(candidate.getClientId());
            if (session.isPresent() && session.get().isConnected()) {
                return Optional.of(new Selection(candidate, session.get()));
            }
        }
        MqttQos effective = chosen.getEffectiveQos(publishQos);
        Optional<ClientSession> fallback = sessionStore.get(chosen.getClientId());
        if (effective != MqttQos.AT_MOST_ONCE && fallback.isPresent() && fallback.get().isPersistent()) {
            log.debug("共享组无在线成员，消息排入离线队列: group={}, clientId={}", groupKey, chosen.getClientId());
            return Optional.of(new Selection(chosen, fallback.get()));
        }
        log.debug("共享组无在线成员，丢弃消息: group={}, qos={}", groupKey, effective);
        return Optional.empty();
    }

    /**
     * 选择结果
     */
    public record Selection(Subscription subscription, ClientSession session) {
    }
}
