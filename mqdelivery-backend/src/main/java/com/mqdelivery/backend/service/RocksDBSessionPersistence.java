/**
 * 会话持久化服务实现
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
import com.mqdelivery.common.model.SessionSnapshot;
import com.mqdelivery.common.store.SessionPersistence;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * 会话持久化服务
 * 每个持久会话存为一条快照：session:{clientId}
 */
@Slf4j
public class RocksDBSessionPersistence implements SessionPersistence {

    private final StorageOperations storageOperations;

    public RocksDBSessionPersistence(StorageOperations storageOperations) {
        this.storageOperations = storageOperations;
    }

    @Override
    public void save(SessionSnapshot snapshot) {
        try {
            storageOperations.put(RocksDBStorageEngine.SESSION_CF,
                    StorageKeyspace.sessionKey(snapshot.getClientId()), snapshot);
            log.debug("Session saved successfully: clientId={}, sessionId={}",
                    snapshot.getClientId(), snapshot.getSessionId());
        } catch (StorageException e) {
            throw new StoreException("Failed to save session: " + snapshot.getClientId(), e);
        }
    }

    @Override
    public Optional<SessionSnapshot> load(String clientId) {
        try {
            return storageOperations.get(RocksDBStorageEngine.SESSION_CF, StorageKeyspace.sessionKey(clientId),
                    SessionSnapshot.class);
        } catch (StorageException e) {
            throw new StoreException("Failed to load session: " + clientId, e);
        }
    }

    @Override
    public void delete(String clientId) {
        try {
            storageOperations.delete(RocksDBStorageEngine.SESSION_CF, StorageKeyspace.sessionKey(clientId));
            log.debug("Session deleted: clientId={}", clientId);
        } catch (StorageException e) {
            throw new StoreException("Failed to delete session: " + clientId, e);
        }
    }

    @Override
    public List<SessionSnapshot> loadAll() {
        List<SessionSnapshot> snapshots = storageOperations.scanByPrefix(RocksDBStorageEngine.SESSION_CF,
                StorageKeyspace.sessionScanPrefix(), SessionSnapshot.class);
        log.info("Loaded {} persisted sessions", snapshots.size());
        return snapshots;
    }
}
