/**
 * 存储异常
 *
 * @author zhenglin
 * @date 2026/10/15
 */
package com.mqdelivery.backend.storage;

/**
 * RocksDB读写或序列化失败
 */
public class StorageException extends Exception {
    private static final long serialVersionUID = 1L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
