/**
 * 存储操作助手类
 *
 * @author zhenglin
 * @date 2026/10/15
 */
package com.mqdelivery.backend.storage;

import com.mqdelivery.backend.storage.engine.RocksDBStorageEngine;
import com.mqdelivery.backend.storage.serializer.JsonStorageSerializer;
import com.mqdelivery.backend.storage.serializer.StorageSerializer;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.RocksDBException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 存储操作助手类
 * 提供类型安全的存储操作接口
 */
@Slf4j
public class StorageOperations {

    private final RocksDBStorageEngine storageEngine;

    public StorageOperations(RocksDBStorageEngine storageEngine) {
        this.storageEngine = storageEngine;
    }

    /**
     * 存储对象
     *
     * @param cfName 列族名称
     * @param key    键
     * @param value  值对象
     * @param <T>    值类型
     * @throws StorageException 存储异常
     */
    @SuppressWarnings("unchecked")
    public <T> void put(String cfName, String key, T value) throws StorageException {
        if (value == null) {
            delete(cfName, key);
            return;
        }
        try {
            StorageSerializer<T> serializer = JsonStorageSerializer.forType((Class<T>) value.getClass());
            storageEngine.put(cfName, key, serializer.serialize(value));
            log.debug("Put object to {}: key={}, type={}", cfName, key, value.getClass().getSimpleName());
        } catch (RocksDBException | StorageSerializer.SerializationException e) {
            log.error("Failed to put object: cfName={}, key={}", cfName, key, e);
            throw new StorageException("Failed to put object", e);
        }
    }

    /**
     * 获取对象
     *
     * @param cfName    列族名称
     * @param key       键
     * @param valueType 值类型
     * @param <T>       值类型
     * @return 对象Optional
     * @throws StorageException 存储异常
     */
    public <T> Optional<T> get(String cfName, String key, Class<T> valueType) throws StorageException {
        try {
            byte[] serializedValue = storageEngine.get(cfName, key);
            if (serializedValue == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(JsonStorageSerializer.forType(valueType).deserialize(serializedValue));
        } catch (RocksDBException | StorageSerializer.SerializationException e) {
            log.error("Failed to get object: cfName={}, key={}, type={}",
                    cfName, key, valueType.getSimpleName(), e);
            throw new StorageException("Failed to get object", e);
        }
    }

    /**
     * 删除对象
     *
     * @param cfName 列族名称
     * @param key    键
     * @throws StorageException 存储异常
     */
    public void delete(String cfName, String key) throws StorageException {
        try {
            storageEngine.delete(cfName, key);
            log.debug("Delete object from {}: key={}", cfName, key);
        } catch (RocksDBException e) {
            log.error("Failed to delete object: cfName={}, key={}", cfName, key, e);
            throw new StorageException("Failed to delete object", e);
        }
    }

    /**
     * 前缀扫描，无法反序列化的记录跳过并记录告警
     *
     * @param cfName    列族名称
     * @param prefix    键前缀
     * @param valueType 值类型
     * @param <T>       值类型
     * @return 对象列表
     */
    public <T> List<T> scanByPrefix(String cfName, String prefix, Class<T> valueType) {
        JsonStorageSerializer<T> serializer = JsonStorageSerializer.forType(valueType);
        List<T> results = new ArrayList<>();
        for (RocksDBStorageEngine.KeyValue kv : storageEngine.scanByPrefix(cfName, prefix)) {
            try {
                T value = serializer.deserialize(kv.getValue());
                if (value != null) {
                    results.add(value);
                }
            } catch (StorageSerializer.SerializationException e) {
                log.warn("Failed to deserialize value for key {}: {}", kv.getKey(), e.getMessage());
            }
        }
        return results;
    }
}
