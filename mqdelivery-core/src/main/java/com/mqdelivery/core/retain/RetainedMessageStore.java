/**
 * 保留消息存储实现
 *
 * @author zhenglin
 * @date 2026/10/09
 */
package com.mqdelivery.core.retain;

import com.mqdelivery.common.exception.QuotaExceededException;
import com.mqdelivery.common.model.PublishMessage;
import com.mqdelivery.common.model.RetainedEntry;
import com.mqdelivery.common.protocol.MqttQos;
import com.mqdelivery.common.store.RetainedPersistence;
import com.mqdelivery.common.topic.TopicFilter;
import com.mqdelivery.common.util.MetricsUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存索引加写穿透持久化的保留消息存储
 *
 * 同一主题的写入在 ConcurrentHashMap.compute 中完成，持久化写入发生在同一临界区内，
 * 后端失败时内存映射保持不变。过期消息在读取时惰性清除，并由维护任务定期扫描。
 */
@Slf4j
public class RetainedMessageStore implements RetainedStore {

    private final Map<String, RetainedEntry> entries = new ConcurrentHashMap<>();
    private final AtomicInteger count = new AtomicInteger();
    private final RetainedPersistence persistence;
    private final Clock clock;
    private final int maxRetainedMessages;

    public RetainedMessageStore(RetainedPersistence persistence, Clock clock, int maxRetainedMessages) {
        this.persistence = persistence;
        this.clock = clock;
        this.maxRetainedMessages = maxRetainedMessages;
        MetricsUtils.createGauge("mqtt.retained.count", "Number of retained messages", count::get);
    }

    @Override
    public void set(String topic, byte[] payload, MqttQos qos) {
        set(PublishMessage.builder().topic(topic).payload(payload).qos(qos).retain(true).build());
    }

    @Override
    public void set(PublishMessage message) {
        String topic = message.getTopic();
        if (message.hasEmptyPayload()) {
            entries.computeIfPresent(topic, (key, existing) -> {
                persistence.delete(key);
                count.decrementAndGet();
                return null;
            });
            log.debug("删除保留消息: topic={}", topic);
            return;
        }
        RetainedEntry entry = RetainedEntry.from(message, clock.millis());
        entries.compute(topic, (key, existing) -> {
            if (existing == null && count.incrementAndGet() > maxRetainedMessages) {
                count.decrementAndGet();
                throw new QuotaExceededException("Retained message store is full (" + maxRetainedMessages + ")");
            }
            try {
                persistence.save(entry);
            } catch (RuntimeException e) {
                if (existing == null) {
                    count.decrementAndGet();
                }
                throw e;
            }
            return entry;
        });
        log.debug("保存保留消息: topic={}, qos={}", topic, message.getQos());
    }

    @Override
    public Optional<RetainedEntry> get(String topic) {
        RetainedEntry entry = entries.get(topic);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            evict(entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public List<RetainedEntry> scan(TopicFilter filter) {
        if (!filter.hasWildcard()) {
            return get(filter.getFilter()).map(List::of).orElse(List.of());
        }
        long now = clock.millis();
        List<RetainedEntry> result = new ArrayList<>();
        List<RetainedEntry> expired = new ArrayList<>();
        for (RetainedEntry entry : entries.values()) {
            if (!filter.matches(entry.getTopic())) {
                continue;
            }
            if (entry.isExpired(now)) {
                expired.add(entry);
            } else {
                result.add(entry);
            }
        }
        expired.forEach(this::evict);
        return result;
    }

    @Override
    public int evictExpired() {
        long now = clock.millis();
        int evicted = 0;
        for (RetainedEntry entry : entries.values()) {
            if (entry.isExpired(now) && evict(entry)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("清除过期保留消息: count={}", evicted);
        }
        return evicted;
    }

    @Override
    public int size() {
        return count.get();
    }

    @Override
    public void recover() {
        List<RetainedEntry> loaded = persistence.loadAll();
        long now = clock.millis();
        for (RetainedEntry entry : loaded) {
            if (entry.isExpired(now)) {
                persistence.delete(entry.getTopic());
                continue;
            }
            if (entries.put(entry.getTopic(), entry) == null) {
                count.incrementAndGet();
            }
        }
        log.info("保留消息恢复完成: count={}", count.get());
    }

    /**
     * 仅当映射仍指向该条目时删除，避免误删并发写入的新值
     */
    private boolean evict(RetainedEntry entry) {
        boolean[] removed = new boolean[1];
        entries.computeIfPresent(entry.getTopic(), (key, current) -> {
            if (current != entry) {
                return current;
            }
            persistence.delete(key);
            count.decrementAndGet();
            removed[0] = true;
            return null;
        });
        return removed[0];
    }
}
