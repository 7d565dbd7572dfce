/**
 * RocksDB存储引擎配置
 *
 * @author zhenglin
 * @date 2026/10/15
 */
package com.mqdelivery.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * RocksDB配置类
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "mqdelivery.storage.rocksdb")
public class RocksDBConfig {

    /**
     * RocksDB数据目录
     */
    private String dataDir = "./data/rocksdb";

    /**
     * 是否创建目录（如果不存在）
     */
    private boolean createIfMissing = true;

    /**
     * 是否创建列族（如果不存在）
     */
    private boolean createMissingColumnFamilies = true;

    /**
     * 最大打开文件数
     */
    private int maxOpenFiles = 1000;

    /**
     * 写缓冲区大小（64MB）
     */
    private long writeBufferSize = 64L * 1024 * 1024;

    /**
     * 最大写缓冲区数量
     */
    private int maxWriteBufferNumber = 4;

    /**
     * 块缓存大小（64MB）
     */
    private long blockCacheSize = 64L * 1024 * 1024;

    /**
     * 是否启用布隆过滤器
     */
    private boolean enableBloomFilter = true;

    /**
     * 布隆过滤器位数/键
     */
    private double bloomFilterBitsPerKey = 10.0;

    /**
     * 压缩类型（NONE, SNAPPY, LZ4, ZSTD）
     */
    private String compressionType = "LZ4";

    /**
     * 是否同步写入
     * 会话状态写入后才回复PUBREC/PUBACK，默认同步落盘
     */
    private boolean syncWrites = true;
}
