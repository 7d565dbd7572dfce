/**
 * RocksDB存储引擎核心实现
 *
 * @author zhenglin
 * @date 2026/10/15
 */
package com.mqdelivery.backend.storage.engine;

import com.mqdelivery.backend.config.RocksDBConfig;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.Cache;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.CompressionType;
import org.rocksdb.DBOptions;
import org.rocksdb.LRUCache;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteOptions;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RocksDB存储引擎实现
 * 会话和保留消息各占一个列族
 */
@Slf4j
public class RocksDBStorageEngine {

    // 列族名称常量
    public static final String DEFAULT_CF = "default";
    public static final String SESSION_CF = "session";
    public static final String RETAINED_CF = "retained";

    private static final List<String> COLUMN_FAMILIES = List.of(DEFAULT_CF, SESSION_CF, RETAINED_CF);

    private final RocksDBConfig config;
    private final Map<String, ColumnFamilyHandle> columnFamilyHandles = new ConcurrentHashMap<>();
    private final AtomicBoolean initialized = new AtomicBoolean(false);

    private RocksDB db;
    private DBOptions dbOptions;
    private ColumnFamilyOptions cfOptions;
    private Cache blockCache;
    private WriteOptions writeOptions;

    public RocksDBStorageEngine(RocksDBConfig config) {
        this.config = config;
    }

    /**
     * 初始化RocksDB存储引擎
     */
    public void initialize() {
        if (initialized.get()) {
            return;
        }
        try {
            log.info("Initializing RocksDB storage engine...");
            RocksDB.loadLibrary();
            Files.createDirectories(Paths.get(config.getDataDir()));
            configureOptions();
            openDatabase();
            initialized.set(true);
            log.info("RocksDB storage engine initialized successfully at: {}", config.getDataDir());
        } catch (Exception e) {
            log.error("Failed to initialize RocksDB storage engine", e);
            shutdown();
            throw new IllegalStateException("RocksDB initialization failed", e);
        }
    }

    /**
     * 关闭存储引擎
     */
    public void shutdown() {
        log.info("Shutting down RocksDB storage engine...");
        columnFamilyHandles.values().forEach(ColumnFamilyHandle::close);
        columnFamilyHandles.clear();
        if (db != null) {
            db.close();
            db = null;
        }
        if (writeOptions != null) {
            writeOptions.close();
            writeOptions = null;
        }
        if (cfOptions != null) {
            cfOptions.close();
            cfOptions = null;
        }
        if (dbOptions != null) {
            dbOptions.close();
            dbOptions = null;
        }
        if (blockCache != null) {
            blockCache.close();
            blockCache = null;
        }
        initialized.set(false);
        log.info("RocksDB storage engine shutdown completed");
    }

    private void configureOptions() {
        dbOptions = new DBOptions()
                .setCreateIfMissing(config.isCreateIfMissing())
                .setCreateMissingColumnFamilies(config.isCreateMissingColumnFamilies())
                .setMaxOpenFiles(config.getMaxOpenFiles());

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig();
        blockCache = new LRUCache(config.getBlockCacheSize());
        tableConfig.setBlockCache(blockCache);
        if (config.isEnableBloomFilter()) {
            tableConfig.setFilterPolicy(new BloomFilter(config.getBloomFilterBitsPerKey()));
        }

        cfOptions = new ColumnFamilyOptions()
                .setWriteBufferSize(config.getWriteBufferSize())
                .setMaxWriteBufferNumber(config.getMaxWriteBufferNumber())
                .setCompressionType(compressionType(config.getCompressionType()))
                .setTableFormatConfig(tableConfig);

        writeOptions = new WriteOptions().setSync(config.isSyncWrites());

        log.info("RocksDB options configured with write buffer size: {}MB, block cache: {}MB, sync={}",
                config.getWriteBufferSize() / (1024 * 1024),
                config.getBlockCacheSize() / (1024 * 1024), config.isSyncWrites());
    }

    private static CompressionType compressionType(String name) {
        switch (name == null ? "" : name.toUpperCase()) {
            case "SNAPPY":
                return CompressionType.SNAPPY_COMPRESSION;
            case "LZ4":
                return CompressionType.LZ4_COMPRESSION;
            case "ZSTD":
                return CompressionType.ZSTD_COMPRESSION;
            default:
                return CompressionType.NO_COMPRESSION;
        }
    }

    private void openDatabase() throws RocksDBException {
        List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
        for (String cfName : COLUMN_FAMILIES) {
            cfDescriptors.add(new ColumnFamilyDescriptor(cfName.getBytes(StandardCharsets.UTF_8), cfOptions));
        }
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        db = RocksDB.open(dbOptions, config.getDataDir(), cfDescriptors, cfHandles);
        for (int i = 0; i < cfDescriptors.size(); i++) {
            columnFamilyHandles.put(COLUMN_FAMILIES.get(i), cfHandles.get(i));
        }
    }

    public ColumnFamilyHandle getColumnFamilyHandle(String cfName) {
        ColumnFamilyHandle handle = columnFamilyHandles.get(cfName);
        if (handle == null) {
            throw new IllegalArgumentException("Unknown column family: " + cfName);
        }
        return handle;
    }

    public void put(String cfName, String key, byte[] value) throws RocksDBException {
        checkInitialized();
        db.put(getColumnFamilyHandle(cfName), writeOptions, key.getBytes(StandardCharsets.UTF_8), value);
    }

    public byte[] get(String cfName, String key) throws RocksDBException {
        checkInitialized();
        return db.get(getColumnFamilyHandle(cfName), key.getBytes(StandardCharsets.UTF_8));
    }

    public void delete(String cfName, String key) throws RocksDBException {
        checkInitialized();
        db.delete(getColumnFamilyHandle(cfName), writeOptions, key.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 前缀扫描
     */
    public List<KeyValue> scanByPrefix(String cfName, String prefix) {
        checkInitialized();
        List<KeyValue> results = new ArrayList<>();
        try (RocksIterator iterator = db.newIterator(getColumnFamilyHandle(cfName))) {
            iterator.seek(prefix.getBytes(StandardCharsets.UTF_8));
            while (iterator.isValid()) {
                String key = new String(iterator.key(), StandardCharsets.UTF_8);
                if (!key.startsWith(prefix)) {
                    break;
                }
                results.add(new KeyValue(key, iterator.value()));
                iterator.next();
            }
        }
        return results;
    }

    private void checkInitialized() {
        if (!initialized.get()) {
            throw new IllegalStateException("RocksDB storage engine not initialized");
        }
    }

    public static class KeyValue {
        private final String key;
        private final byte[] value;

        public KeyValue(String key, byte[] value) {
            this.key = key;
            this.value = value;
        }

        public String getKey() { return key; }
        public byte[] getValue() { return value; }
    }
}
