/**
 * 保活监控
 *
 * @author zhenglin
 * @date 2026/10/10
 */
package com.mqdelivery.core.keepalive;

import com.mqdelivery.common.model.ClientConnection;
import com.mqdelivery.core.timer.EngineTimer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按连接跟踪保活
 *
 * 在 1.5 倍保活间隔内没有收到任何数据包（包括PINGREQ）即判定连接失效。
 * 收包只刷新时间戳，检查由定时器完成：到期时若期间有活动，按剩余时间重新布设。
 */
@Slf4j
public class KeepAliveMonitor {

    /**
     * 超时回调
     */
    @FunctionalInterface
    public interface TimeoutListener {
        void onKeepAliveTimeout(ClientConnection connection);
    }

    private final ConcurrentHashMap<String, EngineTimer.TimerHandle> checks = new ConcurrentHashMap<>();
    private final EngineTimer timer;
    private final Clock clock;
    private final double multiplier;
    private volatile TimeoutListener listener;

    public KeepAliveMonitor(EngineTimer timer, Clock clock, double multiplier) {
        this.timer = timer;
        this.clock = clock;
        this.multiplier = multiplier;
    }

    public void setTimeoutListener(TimeoutListener listener) {
        this.listener = listener;
    }

    /**
     * 开始监控连接，保活为0时不监控
     */
    public void register(ClientConnection connection) {
        connection.setLastActivity(clock.millis());
        if (connection.getKeepAliveSeconds() <= 0) {
            return;
        }
        scheduleCheck(connection, timeoutMillis(connection));
    }

    /**
     * 收到客户端任意数据包
     */
    public void touch(ClientConnection connection) {
        connection.setLastActivity(clock.millis());
    }

    public void unregister(ClientConnection connection) {
        EngineTimer.TimerHandle handle = checks.remove(connection.getConnectionId());
        if (handle != null) {
            handle.cancel();
        }
    }

    public boolean isMonitored(String connectionId) {
        return checks.containsKey(connectionId);
    }

    public long timeoutMillis(ClientConnection connection) {
        return (long) Math.ceil(connection.getKeepAliveSeconds() * 1000L * multiplier);
    }

    private void scheduleCheck(ClientConnection connection, long delayMillis) {
        EngineTimer.TimerHandle handle = timer.schedule(() -> check(connection), delayMillis);
        EngineTimer.TimerHandle previous = checks.put(connection.getConnectionId(), handle);
        if (previous != null) {
            previous.cancel();
        }
    }

    private void check(ClientConnection connection) {
        if (!checks.containsKey(connection.getConnectionId())) {
            return;
        }
        long deadline = connection.getLastActivity() + timeoutMillis(connection);
        long now = clock.millis();
        if (now < deadline) {
            EngineTimer.TimerHandle next = timer.schedule(() -> check(connection), deadline - now);
            if (checks.computeIfPresent(connection.getConnectionId(), (id, old) -> next) == null) {
                // 期间已注销
                next.cancel();
            }
            return;
        }
        if (checks.remove(connection.getConnectionId()) == null) {
            return;
        }
        log.info("保活超时: clientId={}, connectionId={}, keepAlive={}s", connection.getClientId(),
                connection.getConnectionId(), connection.getKeepAliveSeconds());
        TimeoutListener current = listener;
        if (current != null) {
            current.onKeepAliveTimeout(connection);
        }
    }
}
