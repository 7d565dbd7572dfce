package com.mqdelivery.core.keepalive;

import com.mqdelivery.common.model.ClientConnection;
import com.mqdelivery.core.support.ManualEngineTimer;
import com.mqdelivery.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeepAliveMonitorTest {

    private MutableClock clock;
    private ManualEngineTimer timer;
    private KeepAliveMonitor monitor;
    private final List<String> timedOut = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(0L);
        timer = new ManualEngineTimer(clock);
        monitor = new KeepAliveMonitor(timer, clock, 1.5);
        monitor.setTimeoutListener(connection -> timedOut.add(connection.getConnectionId()));
    }

    @Test
    void testTimeoutAfterOneAndHalfInterval() {
        ClientConnection connection = connection("conn-1", 10);
        monitor.register(connection);

        timer.advance(14_999);
        assertTrue(timedOut.isEmpty());
        timer.advance(1);
        assertEquals(List.of("conn-1"), timedOut);
        assertFalse(monitor.isMonitored("conn-1"));
    }

    @Test
    void testActivityExtendsDeadline() {
        ClientConnection connection = connection("conn-1", 10);
        monitor.register(connection);

        timer.advance(10_000);
        monitor.touch(connection);
        timer.advance(10_000);
        // 距上次活动10秒，未超时
        assertTrue(timedOut.isEmpty());
        timer.advance(5_000);
        assertEquals(List.of("conn-1"), timedOut);
    }

    @Test
    void testZeroKeepAliveNotMonitored() {
        ClientConnection connection = connection("conn-1", 0);
        monitor.register(connection);

        assertFalse(monitor.isMonitored("conn-1"));
        timer.advance(1_000_000);
        assertTrue(timedOut.isEmpty());
    }

    @Test
    void testUnregisterStopsMonitoring() {
        ClientConnection connection = connection("conn-1", 10);
        monitor.register(connection);
        monitor.unregister(connection);

        timer.advance(60_000);
        assertTrue(timedOut.isEmpty());
        assertEquals(0, timer.pendingCount());
    }

    @Test
    void testTimeoutMillis() {
        assertEquals(90_000, monitor.timeoutMillis(connection("c", 60)));
        assertEquals(0, monitor.timeoutMillis(connection("c", 0)));
    }

    private static ClientConnection connection(String connectionId, int keepAlive) {
        return ClientConnection.builder()
                .connectionId(connectionId)
                .clientId("client-" + connectionId)
                .keepAliveSeconds(keepAlive)
                .build();
    }
}
