/**
 * 会话存储默认实现
 *
 * @author zhenglin
 * @date 2026/10/09
 */
package com.mqdelivery.core.session;

import com.mqdelivery.common.model.ClientSession;
import com.mqdelivery.common.model.SessionExpiry;
import com.mqdelivery.common.model.SessionSnapshot;
import com.mqdelivery.common.store.SessionPersistence;
import com.mqdelivery.common.util.MetricsUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 会话存储默认实现
 * 内存中保存全部会话，持久会话写穿透到 {@link SessionPersistence}
 */
@Slf4j
public class DefaultSessionStore implements SessionStore {

    private static final int CLIENT_LOCK_STRIPES = 256;

    /**
     * 会话存储：clientId -> ClientSession
     */
    private final ConcurrentHashMap<String, ClientSession> sessions = new ConcurrentHashMap<>();

    /**
     * 会话事件监听器集合
     */
    private final ConcurrentLinkedQueue<SessionEventListener> listeners = new ConcurrentLinkedQueue<>();

    private final ReentrantLock[] clientLocks = new ReentrantLock[CLIENT_LOCK_STRIPES];
    private final SessionPersistence persistence;
    private final Clock clock;

    public DefaultSessionStore(SessionPersistence persistence, Clock clock) {
        this.persistence = persistence;
        this.clock = clock;
        for (int i = 0; i < clientLocks.length; i++) {
            clientLocks[i] = new ReentrantLock();
        }
        MetricsUtils.createGauge("mqtt.sessions.count", "Number of sessions", sessions::size);
    }

    @Override
    public SessionResult resumeOrCreate(String clientId, boolean cleanStart, long sessionExpiryInterval) {
        Lock lock = clientLock(clientId);
        lock.lock();
        try {
            ClientSession existing = sessions.get(clientId);
            if (existing != null && !cleanStart && isPastDeadline(existing, clock.millis())) {
                log.info("会话已超过过期时间，按新会话处理: clientId={}", clientId);
                destroy(existing, ClientSession.SessionState.EXPIRED);
                existing = null;
            }
            if (existing != null) {
                if (cleanStart) {
                    log.info("清理现有会话: clientId={}, sessionId={}", clientId, existing.getSessionId());
                    destroy(existing, ClientSession.SessionState.CLEANED);
                } else {
                    existing.setState(ClientSession.SessionState.ACTIVE);
                    existing.setSessionExpiryInterval(sessionExpiryInterval);
                    existing.setDisconnectedAt(0L);
                    log.info("恢复会话成功: clientId={}, sessionId={}", clientId, existing.getSessionId());
                    triggerSessionResumed(existing);
                    return new SessionResult(existing, true);
                }
            }
            ClientSession created = new ClientSession(clientId, generateSessionId(), sessionExpiryInterval, clock.millis());
            sessions.put(clientId, created);
            MetricsUtils.recordSessionCreated();
            log.info("创建新会话成功: clientId={}, sessionId={}, expiry={}s", clientId, created.getSessionId(),
                    sessionExpiryInterval);
            triggerSessionCreated(created);
            return new SessionResult(created, false);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ClientSession> get(String clientId) {
        return Optional.ofNullable(sessions.get(clientId));
    }

    @Override
    public Collection<ClientSession> all() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    @Override
    public void destroy(String clientId) {
        Lock lock = clientLock(clientId);
        lock.lock();
        try {
            ClientSession session = sessions.get(clientId);
            if (session != null) {
                destroy(session, ClientSession.SessionState.CLEANED);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void persist(ClientSession session) {
        if (!session.isPersistent() || session.isTerminated()) {
            return;
        }
        session.lock();
        try {
            SessionSnapshot snapshot = session.toSnapshot();
            persistence.save(snapshot);
        } finally {
            session.unlock();
        }
    }

    @Override
    public List<String> expireSweep(long now) {
        List<String> expired = new ArrayList<>();
        for (ClientSession candidate : sessions.values()) {
            if (!isPastDeadline(candidate, now)) {
                continue;
            }
            Lock lock = clientLock(candidate.getClientId());
            lock.lock();
            try {
                // 加锁后复查，期间客户端可能已重连
                if (sessions.get(candidate.getClientId()) == candidate && isPastDeadline(candidate, now)) {
                    destroy(candidate, ClientSession.SessionState.EXPIRED);
                    MetricsUtils.recordSessionExpired();
                    expired.add(candidate.getClientId());
                }
            } finally {
                lock.unlock();
            }
        }
        if (!expired.isEmpty()) {
            log.info("会话过期清理完成: count={}", expired.size());
        }
        return expired;
    }

    @Override
    public Lock clientLock(String clientId) {
        return clientLocks[Math.floorMod(clientId.hashCode(), clientLocks.length)];
    }

    @Override
    public void recover() {
        List<SessionSnapshot> snapshots = persistence.loadAll();
        long now = clock.millis();
        for (SessionSnapshot snapshot : snapshots) {
            ClientSession session = ClientSession.fromSnapshot(snapshot);
            // 过期计时从恢复时刻开始
            session.setDisconnectedAt(now);
            if (sessions.putIfAbsent(session.getClientId(), session) == null) {
                triggerSessionRecovered(session);
            }
        }
        log.info("会话恢复完成: count={}", snapshots.size());
    }

    @Override
    public void addListener(SessionEventListener listener) {
        listeners.add(listener);
    }

    @Override
    public int size() {
        return sessions.size();
    }

    private boolean isPastDeadline(ClientSession session, long now) {
        if (session.isConnected() || session.getState() != ClientSession.SessionState.INACTIVE) {
            return false;
        }
        return now >= SessionExpiry.deadline(session.getDisconnectedAt(), session.getSessionExpiryInterval());
    }

    private void destroy(ClientSession session, ClientSession.SessionState reason) {
        sessions.remove(session.getClientId(), session);
        session.lock();
        try {
            session.setState(reason);
            session.clearDeliveryState();
        } finally {
            session.unlock();
        }
        log.info("销毁会话: clientId={}, sessionId={}, reason={}", session.getClientId(), session.getSessionId(), reason);
        triggerSessionDestroyed(session, reason);
        persistence.delete(session.getClientId());
    }

    private String generateSessionId() {
        return "sess_" + UUID.randomUUID().toString().replace("-", "");
    }

    private void triggerSessionCreated(ClientSession session) {
        listeners.forEach(listener -> {
            try {
                listener.onSessionCreated(session);
            } catch (RuntimeException e) {
                log.warn("会话事件监听器异常", e);
            }
        });
    }

    private void triggerSessionResumed(ClientSession session) {
        listeners.forEach(listener -> {
            try {
                listener.onSessionResumed(session);
            } catch (RuntimeException e) {
                log.warn("会话事件监听器异常", e);
            }
        });
    }

    private void triggerSessionRecovered(ClientSession session) {
        listeners.forEach(listener -> {
            try {
                listener.onSessionRecovered(session);
            } catch (RuntimeException e) {
                log.warn("会话事件监听器异常", e);
            }
        });
    }

    private void triggerSessionDestroyed(ClientSession session, ClientSession.SessionState reason) {
        listeners.forEach(listener -> {
            try {
                listener.onSessionDestroyed(session, reason);
            } catch (RuntimeException e) {
                log.warn("会话事件监听器异常", e);
            }
        });
    }
}
