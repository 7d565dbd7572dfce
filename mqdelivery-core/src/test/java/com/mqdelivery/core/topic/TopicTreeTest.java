package com.mqdelivery.core.topic;

import com.mqdelivery.common.model.Subscription;
import com.mqdelivery.common.protocol.MqttQos;
import com.mqdelivery.common.topic.TopicFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TopicTreeTest {

    private TopicTree tree;

    @BeforeEach
    void setUp() {
        tree = new TopicTree();
    }

    @Test
    void testWildcardMatching() {
        subscribe("c1", "a/+/c");
        subscribe("c2", "a/#");
        subscribe("c3", "a/b/c");
        subscribe("c4", "#");
        subscribe("c5", "+/+");

        assertEquals(List.of("c1", "c2", "c3", "c4"), clients("a/b/c"));
        assertEquals(List.of("c2", "c4", "c5"), clients("a/x"));
        // a/# 同样匹配父级 a
        assertEquals(List.of("c2", "c4"), clients("a"));
        assertEquals(List.of("c4"), clients("b/c/d"));
    }

    @Test
    void testReservedTopicsSkipRootWildcards() {
        subscribe("c1", "#");
        subscribe("c2", "+/uptime");
        subscribe("c3", "$SYS/#");
        subscribe("c4", "$SYS/+");

        assertEquals(List.of("c3", "c4"), clients("$SYS/uptime"));
    }

    @Test
    void testEmptyLevelsAreDistinct() {
        subscribe("c1", "a//b");
        subscribe("c2", "a/+/b");
        subscribe("c3", "/a");
        subscribe("c4", "+/a");

        assertEquals(List.of("c1", "c2"), clients("a//b"));
        assertEquals(List.of("c2"), clients("a/x/b"));
        assertEquals(List.of("c3", "c4"), clients("/a"));
    }

    @Test
    void testResubscribeReplacesAndUnsubscribeRemoves() {
        subscribe("c1", "a/b", MqttQos.AT_MOST_ONCE);
        subscribe("c1", "a/b", MqttQos.EXACTLY_ONCE);

        List<Subscription> matched = tree.match("a/b");
        assertEquals(1, matched.size());
        assertEquals(MqttQos.EXACTLY_ONCE, matched.get(0).getQos());
        assertEquals(1, tree.size());

        assertTrue(tree.unsubscribe(TopicFilter.parse("a/b"), matched.get(0)));
        assertFalse(tree.unsubscribe(TopicFilter.parse("a/b"), matched.get(0)));
        assertTrue(tree.match("a/b").isEmpty());
        assertEquals(0, tree.size());
    }

    @Test
    void testSharedAndPlainSubscriptionsCoexist() {
        subscribe("c1", "a/+");
        subscribe("c1", "$share/g/a/+");

        List<Subscription> matched = tree.match("a/b");
        assertEquals(2, matched.size());
        assertEquals(1, matched.stream().filter(Subscription::isShared).count());
    }

    @Test
    void testSubscribeAfterPruneStillMatches() {
        subscribe("c1", "x/y/z");
        tree.unsubscribe(TopicFilter.parse("x/y/z"), tree.match("x/y/z").get(0));
        subscribe("c2", "x/y/z");

        assertEquals(List.of("c2"), clients("x/y/z"));
    }

    @Test
    void testConcurrentSubscribeAndUnsubscribe() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            String clientId = "c" + t;
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 500; i++) {
                        Subscription sub = subscribe(clientId, "s/" + (i % 5) + "/+");
                        tree.unsubscribe(TopicFilter.parse("s/" + (i % 5) + "/+"), sub);
                    }
                    subscribe(clientId, "s/1/+");
                } finally {
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        // 每个客户端最终保留一个订阅
        assertEquals(threads, tree.match("s/1/x").size());
        assertEquals(threads, tree.size());
    }

    private Subscription subscribe(String clientId, String rawFilter) {
        return subscribe(clientId, rawFilter, MqttQos.AT_LEAST_ONCE);
    }

    private Subscription subscribe(String clientId, String rawFilter, MqttQos qos) {
        TopicFilter filter = TopicFilter.parse(rawFilter);
        Subscription subscription = Subscription.builder()
                .clientId(clientId)
                .topicFilter(filter.getRaw())
                .filter(filter.getFilter())
                .shareGroup(filter.getShareGroup())
                .qos(qos)
                .build();
        tree.subscribe(filter, subscription);
        return subscription;
    }

    private List<String> clients(String topic) {
        return new ArrayList<>(tree.match(topic).stream()
                .map(Subscription::getClientId)
                .sorted()
                .collect(Collectors.toList()));
    }
}
