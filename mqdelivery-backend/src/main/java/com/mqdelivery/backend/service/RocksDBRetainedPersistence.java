/**
 * 保留消息持久化服务实现
 *
 * @author zhenglin
 * @date 2026/10/15
 */
package com.mqdelivery.backend.service;

import com.mqdelivery.backend.storage.StorageException;
import com.mqdelivery.backend.storage.StorageKeyspace;
import com.mqdelivery.backend.storage.StorageOperations;
import com.mqdelivery.backend.storage.engine.RocksDBStorageEngine;
import com.mqdelivery.common.exception.StoreException;
import com.mqdelivery.common.model.RetainedEntry;
import com.mqdelivery.common.store.RetainedPersistence;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 保留消息持久化服务
 */
@Slf4j
public class RocksDBRetainedPersistence implements RetainedPersistence {

    private final StorageOperations storageOperations;

    public RocksDBRetainedPersistence(StorageOperations storageOperations) {
        this.storageOperations = storageOperations;
    }

    @Override
    public void save(RetainedEntry entry) {
        try {
            storageOperations.put(RocksDBStorageEngine.RETAINED_CF, StorageKeyspace.retainedKey(entry.getTopic()),
                    entry);
        } catch (StorageException e) {
            throw new StoreException("Failed to save retained message: " + entry.getTopic(), e);
        }
    }

    @Override
    public void delete(String topic) {
        try {
            storageOperations.delete(RocksDBStorageEngine.RETAINED_CF, StorageKeyspace.retainedKey(topic));
        } catch (StorageException e) {
            throw new StoreException("Failed to delete retained message: " + topic, e);
        }
    }

    @Override
    public List<RetainedEntry> loadAll() {
        List<RetainedEntry> entries = storageOperations.scanByPrefix(RocksDBStorageEngine.RETAINED_CF,
                StorageKeyspace.retainedScanPrefix(), RetainedEntry.class);
        log.info("Loaded {} retained messages", entries.size());
        return entries;
    }
}
