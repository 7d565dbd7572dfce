package com.mqdelivery.core.shared;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 按共享组键独立计数的轮询负载均衡
 * 组成员变化时计数器保留，按新的成员数取模继续轮转
 */
public class RoundRobinLoadBalancer<T> implements LoadBalancer<T> {
    private final ConcurrentMap<String, AtomicInteger> keyToCounter = new ConcurrentHashMap<>();

    @Override
    public T select(List<T> candidates, String key) {
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }
        AtomicInteger counter = keyToCounter.computeIfAbsent(key, k -> new AtomicInteger(0));
        int idx = Math.floorMod(counter.getAndIncrement(), candidates.size());
        return candidates.get(idx);
    }
}
