package com.mqdelivery.core.config;

import com.mqdelivery.backend.service.RocksDBSessionPersistence;
import com.mqdelivery.common.event.ConnectEvent;
import com.mqdelivery.common.event.DisconnectEvent;
import com.mqdelivery.common.event.SubscribeEvent;
import com.mqdelivery.common.model.ClientConnection;
import com.mqdelivery.common.model.SessionSnapshot;
import com.mqdelivery.common.protocol.MqttQos;
import com.mqdelivery.common.store.SessionPersistence;
import com.mqdelivery.core.MqttDeliveryApplication;
import com.mqdelivery.core.delivery.MqttDeliveryEngine;
import com.mqdelivery.core.support.RecordingClientChannel;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RocksDB存储下的Bean装配和会话写穿
 */
@SpringBootTest(classes = MqttDeliveryApplication.class)
class RocksDBStorageConfigurationTest {

    private static final Path DATA_DIR = Path.of("target", "rocksdb-config-test-" + UUID.randomUUID());

    @DynamicPropertySource
    static void storageProperties(DynamicPropertyRegistry registry) {
        registry.add("mqdelivery.storage.type", () -> "rocksdb");
        registry.add("mqdelivery.storage.rocksdb.data-dir", DATA_DIR::toString);
    }

    @Autowired
    private SessionPersistence sessionPersistence;

    @Autowired
    private MqttDeliveryEngine engine;

    @Test
    void testPersistentSessionWrittenThrough() {
        assertInstanceOf(RocksDBSessionPersistence.class, sessionPersistence);

        RecordingClientChannel channel = new RecordingClientChannel();
        ClientConnection connection = engine.onConnect(channel,
                new ConnectEvent("rocks-client", false, 0, 3600L, null, null, true));
        engine.onSubscribe(connection, SubscribeEvent.of(1, "rocks/#", MqttQos.AT_LEAST_ONCE));
        engine.onDisconnect(connection, DisconnectEvent.normal());

        SessionSnapshot snapshot = sessionPersistence.load("rocks-client").orElseThrow();
        assertEquals(3600L, snapshot.getSessionExpiryInterval());
        assertEquals("rocks/#", snapshot.getSubscriptions().get(0).getTopicFilter());
    }
}
