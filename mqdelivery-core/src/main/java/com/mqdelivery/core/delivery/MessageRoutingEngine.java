/**
 * 消息路由引擎
 *
 * @author zhenglin
 * @date 2026/10/12
 */
package com.mqdelivery.core.delivery;

import com.mqdelivery.common.exception.QuotaExceededException;
import com.mqdelivery.common.model.ClientSession;
import com.mqdelivery.common.model.PublishMessage;
import com.mqdelivery.common.model.Subscription;
import com.mqdelivery.common.util.MetricsUtils;
import com.mqdelivery.core.retain.RetainedStore;
import com.mqdelivery.core.session.SessionStore;
import com.mqdelivery.core.shared.SharedSubscriptionBalancer;
import com.mqdelivery.core.topic.TopicTree;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 把一条发布消息扇出到所有匹配的会话
 *
 * 普通订阅：同一客户端多个过滤器命中时只投递一次，取最高QoS；No Local 订阅不接收自己发布的消息。
 * 共享订阅：每个共享组只选一个成员。
 */
@Slf4j
public class MessageRoutingEngine {

    private final TopicTree topicTree;
    private final RetainedStore retainedStore;
    private final SharedSubscriptionBalancer sharedBalancer;
    private final QoSDeliveryManager deliveryManager;
    private final SessionStore sessionStore;

    public MessageRoutingEngine(TopicTree topicTree, RetainedStore retainedStore,
                                SharedSubscriptionBalancer sharedBalancer, QoSDeliveryManager deliveryManager,
                                SessionStore sessionStore) {
        this.topicTree = topicTree;
        this.retainedStore = retainedStore;
        this.sharedBalancer = sharedBalancer;
        this.deliveryManager = deliveryManager;
        this.sessionStore = sessionStore;
    }

    /**
     * 路由消息
     *
     * @param message 已通过校验的发布消息
     * @return 路由统计
     */
    public RouteResult route(PublishMessage message) {
        MetricsUtils.recordPublishedMessage();
        MetricsUtils.recordQosMessage(message.getQos().getValue());
        boolean quotaExceeded = false;
        if (message.isRetain()) {
            try {
                retainedStore.set(message);
            } catch (QuotaExceededException e) {
                log.warn("保留消息超出配额: topic={}, publisher={}", message.getTopic(), message.getPublisherId());
                quotaExceeded = true;
            }
        }

        Map<String, Subscription> direct = new LinkedHashMap<>();
        Map<String, List<Subscription>> shared = new LinkedHashMap<>();
        for (Subscription subscription : topicTree.match(message.getTopic())) {
            if (subscription.isShared()) {
                shared.computeIfAbsent(SharedSubscriptionBalancer.groupKey(subscription), k -> new ArrayList<>())
                        .add(subscription);
                continue;
            }
            if (subscription.isNoLocal() && subscription.getClientId().equals(message.getPublisherId())) {
                continue;
            }
            direct.merge(subscription.getClientId(), subscription,
                    (a, b) -> b.getQos().getValue() > a.getQos().getValue() ? b : a);
        }

        Tally tally = new Tally(quotaExceeded);
        for (Subscription subscription : direct.values()) {
            Optional<ClientSession> session = sessionStore.get(subscription.getClientId());
            if (session.isEmpty()) {
                continue;
            }
            tally.matched++;
            tally.add(deliver(session.get(), message, subscription));
        }
        for (Map.Entry<String, List<Subscription>> group : shared.entrySet()) {
            tally.matched++;
            Optional<SharedSubscriptionBalancer.Selection> selection =
                    sharedBalancer.select(group.getKey(), group.getValue(), message.getQos());
            if (selection.isEmpty()) {
                tally.dropped++;
                MetricsUtils.recordDroppedMessage("shared_no_member");
                continue;
            }
            tally.add(deliver(selection.get().session(), message, selection.get().subscription()));
        }
        log.debug("路由消息: topic={}, qos={}, matched={}, sent={}, queued={}, dropped={}", message.getTopic(),
                message.getQos(), tally.matched, tally.sent, tally.queued, tally.dropped);
        return new RouteResult(tally.matched, tally.sent, tally.queued, tally.dropped, tally.quotaExceeded);
    }

    private DeliveryOutcome deliver(ClientSession session, PublishMessage message, Subscription subscription) {
        return deliveryManager.deliver(session, message, subscription,
                subscription.isRetainAsPublished() && message.isRetain());
    }

    private static final class Tally {
        int matched;
        int sent;
        int queued;
        int dropped;
        boolean quotaExceeded;

        Tally(boolean quotaExceeded) {
            this.quotaExceeded = quotaExceeded;
        }

        void add(DeliveryOutcome outcome) {
            switch (outcome) {
                case SENT -> sent++;
                case QUEUED -> queued++;
                case DROPPED -> dropped++;
                case DROPPED_QUOTA -> {
                    dropped++;
                    quotaExceeded = true;
                }
            }
        }
    }
}
