/**
 * RocksDB存储键值空间定义
 *
 * @author zhenglin
 * @date 2026/10/15
 */
package com.mqdelivery.backend.storage;

import lombok.experimental.UtilityClass;

/**
 * 定义RocksDB中不同数据类型的键值空间规划
 * 采用前缀分离的方式，支持前缀扫描恢复
 */
@UtilityClass
public class StorageKeyspace {

    /**
     * 键分隔符
     */
    public static final String KEY_SEPARATOR = ":";

    /**
     * 会话快照前缀: session:{clientId}
     */
    public static final String SESSION_PREFIX = "session";

    /**
     * 保留消息前缀: retain:{topic}
     */
    public static final String RETAINED_MESSAGE_PREFIX = "retain";

    public static String sessionKey(String clientId) {
        return SESSION_PREFIX + KEY_SEPARATOR + clientId;
    }

    public static String sessionScanPrefix() {
        return SESSION_PREFIX + KEY_SEPARATOR;
    }

    /**
     * 主题中可以含有分隔符，只切掉第一个前缀
     */
    public static String retainedKey(String topic) {
        return RETAINED_MESSAGE_PREFIX + KEY_SEPARATOR + topic;
    }

    public static String retainedScanPrefix() {
        return RETAINED_MESSAGE_PREFIX + KEY_SEPARATOR;
    }
}
