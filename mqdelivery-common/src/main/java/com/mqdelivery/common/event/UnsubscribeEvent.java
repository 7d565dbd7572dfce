package com.mqdelivery.common.event;

import java.util.List;

/**
 * 解码后的UNSUBSCRIBE
 */
public record UnsubscribeEvent(int packetId, List<String> topicFilters) {

    public UnsubscribeEvent {
        topicFilters = List.copyOf(topicFilters);
    }
}
