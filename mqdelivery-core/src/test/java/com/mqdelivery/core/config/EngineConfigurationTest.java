/**
 * 引擎配置测试
 *
 * @author zhenglin
 * @date 2026/10/16
 */
package com.mqdelivery.core.config;

import com.mqdelivery.common.event.ConnectEvent;
import com.mqdelivery.common.event.PublishEvent;
import com.mqdelivery.common.event.SubscribeEvent;
import com.mqdelivery.common.model.ClientConnection;
import com.mqdelivery.common.protocol.MqttQos;
import com.mqdelivery.common.protocol.ReasonCode;
import com.mqdelivery.common.packet.SubAckPacket;
import com.mqdelivery.common.store.SessionPersistence;
import com.mqdelivery.common.util.MetricsUtils;
import com.mqdelivery.core.MqttDeliveryApplication;
import com.mqdelivery.core.delivery.MqttDeliveryEngine;
import com.mqdelivery.core.store.InMemorySessionPersistence;
import com.mqdelivery.core.support.RecordingClientChannel;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 内存存储下的完整Bean装配
 */
@SpringBootTest(classes = MqttDeliveryApplication.class)
@TestPropertySource(properties = {
    "mqdelivery.storage.type=memory",
    "mqdelivery.engine.retransmit-interval-ms=2000",
    "mqdelivery.engine.max-qos=1",
    "mqdelivery.engine.max-queued-messages=50"
})
class EngineConfigurationTest {

    @Autowired
    private EngineProperties properties;

    @Autowired
    private SessionPersistence sessionPersistence;

    @Autowired
    private MqttDeliveryEngine engine;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void testPropertiesBound() {
        assertEquals(2000, properties.getRetransmitIntervalMs());
        assertEquals(MqttQos.AT_LEAST_ONCE, properties.getMaximumQos());
        assertEquals(50, properties.getMaxQueuedMessages());
        // 未覆盖的取默认值
        assertEquals(1.5, properties.getKeepAliveMultiplier());
        assertEquals(100, properties.getReceiveMaximum());
    }

    @Test
    void testInMemoryPersistenceSelected() {
        assertInstanceOf(InMemorySessionPersistence.class, sessionPersistence);
    }

    @Test
    void testEngineWired() {
        RecordingClientChannel subChannel = new RecordingClientChannel();
        ClientConnection sub = engine.onConnect(subChannel, ConnectEvent.of("cfg-sub", true, 0, null));
        engine.onSubscribe(sub, SubscribeEvent.of(1, "cfg/#", MqttQos.EXACTLY_ONCE));
        assertEquals(List.of(ReasonCode.GRANTED_QOS_1), subChannel.ofType(SubAckPacket.class).get(0).reasonCodes());

        RecordingClientChannel pubChannel = new RecordingClientChannel();
        ClientConnection pub = engine.onConnect(pubChannel, ConnectEvent.of("cfg-pub", true, 0, null));
        engine.onPublish(pub, PublishEvent.of("cfg/1", "hello".getBytes(StandardCharsets.UTF_8),
                MqttQos.AT_MOST_ONCE, false, 0));

        assertEquals(1, subChannel.publishes().size());
    }

    @Test
    void testMetricsRecordedInContextRegistry() {
        assertSame(meterRegistry, MetricsUtils.getMeterRegistry());
        assertNotNull(meterRegistry.find("mqtt.sessions.count").gauge());

        double published = MetricsUtils.count("mqtt.messages.published");
        double created = MetricsUtils.count("mqtt.sessions.created");
        RecordingClientChannel channel = new RecordingClientChannel();
        ClientConnection pub = engine.onConnect(channel, ConnectEvent.of("cfg-metrics", true, 0, null));
        engine.onPublish(pub, PublishEvent.of("cfg/metrics", "m".getBytes(StandardCharsets.UTF_8),
                MqttQos.AT_MOST_ONCE, false, 0));

        assertEquals(created + 1, MetricsUtils.count("mqtt.sessions.created"));
        assertEquals(published + 1, MetricsUtils.count("mqtt.messages.published"));
    }
}
