package com.mqdelivery.common.event;

import com.mqdelivery.common.model.Subscription;
import com.mqdelivery.common.protocol.MqttQos;

import java.util.List;
import java.util.Objects;

/**
 * 解码后的SUBSCRIBE
 */
public record SubscribeEvent(int packetId, List<SubscriptionRequest> requests) {

    public SubscribeEvent {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("SUBSCRIBE must carry at least one filter");
        }
        requests = List.copyOf(requests);
    }

    public static SubscribeEvent of(int packetId, String topicFilter, MqttQos qos) {
        return new SubscribeEvent(packetId, List.of(SubscriptionRequest.of(topicFilter, qos)));
    }

    /**
     * 单个过滤器的订阅请求
     *
     * @param authorized 外部ACL对该过滤器的判定
     */
    public record SubscriptionRequest(String topicFilter, MqttQos qos, boolean noLocal, boolean retainAsPublished,
                                      Subscription.RetainHandling retainHandling, Integer subscriptionIdentifier,
                                      boolean authorized) {

        public SubscriptionRequest {
            Objects.requireNonNull(qos, "qos");
            if (retainHandling == null) {
                retainHandling = Subscription.RetainHandling.SEND_ON_SUBSCRIBE;
            }
        }

        public static SubscriptionRequest of(String topicFilter, MqttQos qos) {
            return new SubscriptionRequest(topicFilter, qos, false, false,
                    Subscription.RetainHandling.SEND_ON_SUBSCRIBE, null, true);
        }
    }
}
