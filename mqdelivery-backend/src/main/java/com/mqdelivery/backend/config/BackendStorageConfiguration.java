/**
 * RocksDB持久化Bean配置
 *
 * @author zhenglin
 * @date 2026/10/15
 */
package com.mqdelivery.backend.config;

import com.mqdelivery.backend.service.RocksDBRetainedPersistence;
import com.mqdelivery.backend.service.RocksDBSessionPersistence;
import com.mqdelivery.backend.storage.StorageOperations;
import com.mqdelivery.backend.storage.engine.RocksDBStorageEngine;
import com.mqdelivery.common.store.RetainedPersistence;
import com.mqdelivery.common.store.SessionPersistence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * mqdelivery.storage.type=rocksdb 时启用
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "mqdelivery.storage.type", havingValue = "rocksdb")
public class BackendStorageConfiguration {

    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    public RocksDBStorageEngine rocksDBStorageEngine(RocksDBConfig config) {
        log.info("创建RocksDB存储引擎Bean: dataDir={}", config.getDataDir());
        return new RocksDBStorageEngine(config);
    }

    @Bean
    public StorageOperations storageOperations(RocksDBStorageEngine storageEngine) {
        return new StorageOperations(storageEngine);
    }

    @Bean
    public SessionPersistence rocksDBSessionPersistence(StorageOperations storageOperations) {
        log.info("创建RocksDB会话持久化Bean");
        return new RocksDBSessionPersistence(storageOperations);
    }

    @Bean
    public RetainedPersistence rocksDBRetainedPersistence(StorageOperations storageOperations) {
        log.info("创建RocksDB保留消息持久化Bean");
        return new RocksDBRetainedPersistence(storageOperations);
    }
}
