package com.mqdelivery.core.retain;

import com.mqdelivery.common.exception.QuotaExceededException;
import com.mqdelivery.common.exception.StoreException;
import com.mqdelivery.common.model.PublishMessage;
import com.mqdelivery.common.model.RetainedEntry;
import com.mqdelivery.common.protocol.MqttQos;
import com.mqdelivery.common.store.RetainedPersistence;
import com.mqdelivery.common.topic.TopicFilter;
import com.mqdelivery.core.store.InMemoryRetainedPersistence;
import com.mqdelivery.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class RetainedMessageStoreTest {

    private MutableClock clock;
    private InMemoryRetainedPersistence persistence;
    private RetainedMessageStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
        persistence = new InMemoryRetainedPersistence();
        store = new RetainedMessageStore(persistence, clock, 3);
    }

    @Test
    void testSetReplacesAndEmptyPayloadDeletes() {
        store.set("status/a", bytes("1"), MqttQos.AT_LEAST_ONCE);
        store.set("status/a", bytes("2"), MqttQos.AT_MOST_ONCE);

        RetainedEntry entry = store.get("status/a").orElseThrow();
        assertArrayEquals(bytes("2"), entry.getPayload());
        assertEquals(MqttQos.AT_MOST_ONCE, entry.getQos());
        assertEquals(1, store.size());

        store.set("status/a", new byte[0], MqttQos.AT_MOST_ONCE);
        assertTrue(store.get("status/a").isEmpty());
        assertEquals(0, store.size());
        assertTrue(persistence.loadAll().isEmpty());
    }

    @Test
    void testScanWithWildcards() {
        store.set("status/a", bytes("a"), MqttQos.AT_MOST_ONCE);
        store.set("status/b", bytes("b"), MqttQos.AT_MOST_ONCE);
        store.set("other/c", bytes("c"), MqttQos.AT_MOST_ONCE);

        List<String> topics = store.scan(TopicFilter.parse("status/+")).stream()
                .map(RetainedEntry::getTopic).sorted().collect(Collectors.toList());
        assertEquals(List.of("status/a", "status/b"), topics);
        assertEquals(3, store.scan(TopicFilter.parse("#")).size());
        assertEquals(1, store.scan(TopicFilter.parse("other/c")).size());
    }

    @Test
    void testQuotaRejectsNewTopicsOnly() {
        store.set("t/1", bytes("1"), MqttQos.AT_MOST_ONCE);
        store.set("t/2", bytes("2"), MqttQos.AT_MOST_ONCE);
        store.set("t/3", bytes("3"), MqttQos.AT_MOST_ONCE);

        assertThrows(QuotaExceededException.class, () -> store.set("t/4", bytes("4"), MqttQos.AT_MOST_ONCE));
        // 已有主题仍可更新
        store.set("t/1", bytes("x"), MqttQos.AT_MOST_ONCE);
        assertEquals(3, store.size());
    }

    @Test
    void testExpiredEntriesAreInvisibleAndEvicted() {
        store.set(PublishMessage.builder().topic("t/exp").payload(bytes("x")).qos(MqttQos.AT_MOST_ONCE)
                .retain(true).expiresAt(clock.millis() + 1000).build());
        store.set("t/keep", bytes("k"), MqttQos.AT_MOST_ONCE);

        clock.advance(1000);

        assertTrue(store.get("t/exp").isEmpty());
        assertEquals(1, store.scan(TopicFilter.parse("t/#")).size());
        assertEquals(0, store.evictExpired());
        assertEquals(1, store.size());
        assertEquals(1, persistence.loadAll().size());
    }

    @Test
    void testRecoverSkipsExpired() {
        persistence.save(RetainedEntry.builder().topic("a").payload(bytes("a")).qos(MqttQos.AT_MOST_ONCE)
                .storedAt(0).build());
        persistence.save(RetainedEntry.builder().topic("b").payload(bytes("b")).qos(MqttQos.AT_MOST_ONCE)
                .storedAt(0).expiresAt(clock.millis() - 1).build());

        store.recover();

        assertEquals(1, store.size());
        assertTrue(store.get("a").isPresent());
        assertEquals(1, persistence.loadAll().size());
    }

    @Test
    void testBackendFailureLeavesPreviousValue() {
        RetainedPersistence failing = mock(RetainedPersistence.class);
        RetainedMessageStore failingStore = new RetainedMessageStore(failing, clock, 10);
        failingStore.set("t", bytes("old"), MqttQos.AT_MOST_ONCE);

        doThrow(new StoreException("disk full")).when(failing).save(any());

        assertThrows(StoreException.class, () -> failingStore.set("t", bytes("new"), MqttQos.AT_MOST_ONCE));
        assertThrows(StoreException.class, () -> failingStore.set("u", bytes("new"), MqttQos.AT_MOST_ONCE));
        assertArrayEquals(bytes("old"), failingStore.get("t").orElseThrow().getPayload());
        assertEquals(1, failingStore.size());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
