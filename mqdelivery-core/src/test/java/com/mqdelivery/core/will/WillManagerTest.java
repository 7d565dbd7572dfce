package com.mqdelivery.core.will;

import com.mqdelivery.common.model.ClientSession;
import com.mqdelivery.common.model.SessionExpiry;
import com.mqdelivery.common.model.WillSpec;
import com.mqdelivery.common.protocol.MqttQos;
import com.mqdelivery.core.support.ManualEngineTimer;
import com.mqdelivery.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WillManagerTest {

    private MutableClock clock;
    private ManualEngineTimer timer;
    private WillManager willManager;
    private final List<String> published = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(0L);
        timer = new ManualEngineTimer(clock);
        willManager = new WillManager(timer);
        willManager.setPublisher((clientId, will) -> published.add(clientId + "->" + will.getTopic()));
    }

    @Test
    void testImmediateFireOnAbnormalTermination() {
        ClientSession session = session("c1", 60);
        willManager.arm(session, will(0));

        assertTrue(willManager.fireIfArmed(session, true));
        assertEquals(List.of("c1->status/c1"), published);
        assertFalse(willManager.isArmed("c1"));

        // 只发布一次
        assertFalse(willManager.fireIfArmed(session, true));
        assertEquals(1, published.size());
    }

    @Test
    void testGracefulDisconnectDisarms() {
        ClientSession session = session("c1", 60);
        willManager.arm(session, will(0));

        assertFalse(willManager.fireIfArmed(session, false));
        assertTrue(published.isEmpty());
        assertFalse(willManager.isArmed("c1"));
    }

    @Test
    void testDelayedFire() {
        ClientSession session = session("c1", 60);
        willManager.arm(session, will(10));

        assertTrue(willManager.fireIfArmed(session, true));
        assertTrue(willManager.isScheduled("c1"));
        timer.advance(9_999);
        assertTrue(published.isEmpty());
        timer.advance(1);
        assertEquals(List.of("c1->status/c1"), published);
    }

    @Test
    void testReconnectWithinDelayCancels() {
        ClientSession session = session("c1", 60);
        willManager.arm(session, will(10));
        willManager.fireIfArmed(session, true);

        timer.advance(5_000);
        assertTrue(willManager.disarm("c1"));
        timer.advance(10_000);

        assertTrue(published.isEmpty());
        assertEquals(0, timer.pendingCount());
    }

    @Test
    void testDelayCappedBySessionExpiry() {
        ClientSession session = session("c1", 3);
        willManager.arm(session, will(30));
        willManager.fireIfArmed(session, true);

        timer.advance(3_000);
        assertEquals(1, published.size());
    }

    @Test
    void testNeverExpiringSessionKeepsFullDelay() {
        ClientSession session = session("c1", SessionExpiry.NEVER);
        willManager.arm(session, will(30));
        willManager.fireIfArmed(session, true);

        timer.advance(29_999);
        assertTrue(published.isEmpty());
        timer.advance(1);
        assertEquals(1, published.size());
    }

    @Test
    void testSessionEndDuringDelayFiresNow() {
        ClientSession session = session("c1", 60);
        willManager.arm(session, will(30));
        willManager.fireIfArmed(session, true);

        willManager.onSessionEnded("c1");
        assertEquals(1, published.size());
        timer.advance(30_000);
        assertEquals(1, published.size());
    }

    @Test
    void testSessionEndWhileArmedDiscards() {
        ClientSession session = session("c1", 60);
        willManager.arm(session, will(0));

        willManager.onSessionEnded("c1");
        assertFalse(willManager.isArmed("c1"));
        assertTrue(published.isEmpty());
    }

    @Test
    void testArmReplacesPreviousWill() {
        ClientSession session = session("c1", 60);
        willManager.arm(session, will(0));
        willManager.arm(session, WillSpec.builder().topic("other").qos(MqttQos.AT_MOST_ONCE).build());

        willManager.fireIfArmed(session, true);
        assertEquals(List.of("c1->other"), published);
    }

    @Test
    void testDisarmRacingFireAtMostOnce() throws InterruptedException {
        Set<String> fired = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();
        willManager.setPublisher((clientId, will) -> {
            if (!fired.add(clientId)) {
                duplicates.incrementAndGet();
            }
        });
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 200; i++) {
                ClientSession session = session("c" + i, 60);
                willManager.arm(session, will(0));
                CountDownLatch start = new CountDownLatch(1);
                CountDownLatch done = new CountDownLatch(2);
                executor.submit(() -> {
                    await(start);
                    willManager.fireIfArmed(session, true);
                    done.countDown();
                });
                executor.submit(() -> {
                    await(start);
                    willManager.disarm(session.getClientId());
                    done.countDown();
                });
                start.countDown();
                assertTrue(done.await(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(0, duplicates.get());
        for (int i = 0; i < 200; i++) {
            assertFalse(willManager.isArmed("c" + i));
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ClientSession session(String clientId, long expiry) {
        return new ClientSession(clientId, "s-" + clientId, expiry, 0);
    }

    private static WillSpec will(long delaySeconds) {
        return WillSpec.builder()
                .topic("status/c1")
                .payload("offline".getBytes(StandardCharsets.UTF_8))
                .qos(MqttQos.AT_LEAST_ONCE)
                .delaySeconds(delaySeconds)
                .build();
    }
}
