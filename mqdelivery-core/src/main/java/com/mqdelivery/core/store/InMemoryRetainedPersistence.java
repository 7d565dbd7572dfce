package com.mqdelivery.core.store;

import com.mqdelivery.common.model.RetainedEntry;
import com.mqdelivery.common.store.RetainedPersistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内的保留消息持久化
 */
public class InMemoryRetainedPersistence implements RetainedPersistence {

    private final Map<String, RetainedEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void save(RetainedEntry entry) {
        entries.put(entry.getTopic(), entry);
    }

    @Override
    public void delete(String topic) {
        entries.remove(topic);
    }

    @Override
    public List<RetainedEntry> loadAll() {
        return new ArrayList<>(entries.values());
    }
}
