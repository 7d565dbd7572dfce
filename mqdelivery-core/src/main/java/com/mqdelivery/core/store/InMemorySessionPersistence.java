/**
 * 内存会话持久化
 *
 * @author zhenglin
 * @date 2026/10/09
 */
package com.mqdelivery.core.store;

import com.mqdelivery.common.model.SessionSnapshot;
import com.mqdelivery.common.store.SessionPersistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内的会话持久化，mqdelivery.storage.type=memory 时使用，进程退出即丢失
 */
public class InMemorySessionPersistence implements SessionPersistence {

    private final Map<String, SessionSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(SessionSnapshot snapshot) {
        snapshots.put(snapshot.getClientId(), snapshot);
    }

    @Override
    public Optional<SessionSnapshot> load(String clientId) {
        return Optional.ofNullable(snapshots.get(clientId));
    }

    @Override
    public void delete(String clientId) {
        snapshots.remove(clientId);
    }

    @Override
    public List<SessionSnapshot> loadAll() {
        return new ArrayList<>(snapshots.values());
    }
}
