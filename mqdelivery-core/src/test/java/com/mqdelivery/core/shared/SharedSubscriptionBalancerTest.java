package com.mqdelivery.core.shared;

import com.mqdelivery.common.model.ClientConnection;
import com.mqdelivery.common.model.ClientSession;
import com.mqdelivery.common.model.Subscription;
import com.mqdelivery.common.protocol.MqttQos;
import com.mqdelivery.core.session.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SharedSubscriptionBalancerTest {

    @Mock
    private SessionStore sessionStore;

    private SharedSubscriptionBalancer balancer;
    private ClientSession alice;
    private ClientSession bob;
    private ClientSession carol;

    @BeforeEach
    void setUp() {
        balancer = new SharedSubscriptionBalancer(new RoundRobinLoadBalancer<>(), sessionStore);
        alice = session("alice", 60, true);
        bob = session("bob", 60, true);
        carol = session("carol", 0, true);
    }

    @Test
    void testRoundRobinInClientIdOrder() {
        // 传入顺序与客户端ID顺序不同
        List<Subscription> members = List.of(member("carol"), member("alice"), member("bob"));
        List<String> chosen = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            chosen.add(balancer.select("g/t", members, MqttQos.AT_LEAST_ONCE).orElseThrow().session().getClientId());
        }
        assertEquals(List.of("alice", "bob", "carol", "alice", "bob", "carol"), chosen);
    }

    @Test
    void testSkipsOfflineMember() {
        bob.setConnection(null);
        List<Subscription> members = List.of(member("alice"), member("bob"));

        assertEquals("alice", balancer.select("g/t", members, MqttQos.AT_LEAST_ONCE).orElseThrow().session().getClientId());
        // 轮到bob，但bob离线
        assertEquals("alice", balancer.select("g/t", members, MqttQos.AT_LEAST_ONCE).orElseThrow().session().getClientId());
    }

    @Test
    void testAllOfflineQueuesToPersistentMember() {
        alice.setConnection(null);
        bob.setConnection(null);
        List<Subscription> members = List.of(member("alice"), member("bob"));

        Optional<SharedSubscriptionBalancer.Selection> selection =
                balancer.select("g/t", members, MqttQos.AT_LEAST_ONCE);
        assertTrue(selection.isPresent());
        assertEquals("alice", selection.get().session().getClientId());
        assertFalse(selection.get().session().isConnected());

        // QoS0 不排队
        assertTrue(balancer.select("g/t", members, MqttQos.AT_MOST_ONCE).isEmpty());
    }

    @Test
    void testAllOfflineNonPersistentDropped() {
        carol.setConnection(null);
        assertTrue(balancer.select("g/t", List.of(member("carol")), MqttQos.EXACTLY_ONCE).isEmpty());
    }

    @Test
    void testGroupsBalanceIndependently() {
        List<Subscription> members = List.of(member("alice"), member("bob"));
        assertEquals("alice", balancer.select("g1/t", members, MqttQos.AT_LEAST_ONCE).orElseThrow().session().getClientId());
        assertEquals("alice", balancer.select("g2/t", members, MqttQos.AT_LEAST_ONCE).orElseThrow().session().getClientId());
        assertEquals("bob", balancer.select("g1/t", members, MqttQos.AT_LEAST_ONCE).orElseThrow().session().getClientId());
    }

    @Test
    void testGroupKey() {
        assertEquals("g/a/+", SharedSubscriptionBalancer.groupKey(member("alice")));
    }

    private ClientSession session(String clientId, long expiry, boolean online) {
        ClientSession session = new ClientSession(clientId, "s-" + clientId, expiry, 0);
        if (online) {
            session.setConnection(ClientConnection.builder().connectionId("conn-" + clientId).clientId(clientId).build());
        }
        when(sessionStore.get(clientId)).thenReturn(Optional.of(session));
        return session;
    }

    private static Subscription member(String clientId) {
        return Subscription.builder()
                .clientId(clientId)
                .topicFilter("$share/g/a/+")
                .filter("a/+")
                .shareGroup("g")
                .qos(MqttQos.EXACTLY_ONCE)
                .build();
    }
}
