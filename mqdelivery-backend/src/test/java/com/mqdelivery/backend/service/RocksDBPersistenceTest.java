package com.mqdelivery.backend.service;

import com.mqdelivery.backend.config.RocksDBConfig;
import com.mqdelivery.backend.storage.StorageOperations;
import com.mqdelivery.backend.storage.engine.RocksDBStorageEngine;
import com.mqdelivery.common.model.RetainedEntry;
import com.mqdelivery.common.model.SessionSnapshot;
import com.mqdelivery.common.protocol.MqttQos;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RocksDBPersistenceTest {

    @TempDir
    Path dataDir;

    private RocksDBConfig config;
    private RocksDBStorageEngine engine;
    private RocksDBSessionPersistence sessions;
    private RocksDBRetainedPersistence retained;

    @BeforeEach
    void setUp() {
        config = new RocksDBConfig();
        config.setDataDir(dataDir.toString());
        config.setCompressionType("NONE");
        open();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private void open() {
        engine = new RocksDBStorageEngine(config);
        engine.initialize();
        StorageOperations operations = new StorageOperations(engine);
        sessions = new RocksDBSessionPersistence(operations);
        retained = new RocksDBRetainedPersistence(operations);
    }

    @Test
    void testSessionSurvivesReopen() {
        sessions.save(snapshot("sensor1"));
        sessions.save(snapshot("sensor2"));

        // 重新打开数据库
        engine.shutdown();
        open();

        assertTrue(sessions.load("sensor1").isPresent());
        List<String> ids = sessions.loadAll().stream().map(SessionSnapshot::getClientId)
                .sorted().collect(Collectors.toList());
        assertEquals(List.of("sensor1", "sensor2"), ids);
    }

    @Test
    void testDeleteSession() {
        sessions.save(snapshot("sensor1"));
        sessions.delete("sensor1");

        assertFalse(sessions.load("sensor1").isPresent());
        assertTrue(sessions.loadAll().isEmpty());
    }

    @Test
    void testRetainedTopicsWithSeparators() {
        retained.save(entry("a/b:c"));
        retained.save(entry("$SYS/uptime"));

        List<String> topics = retained.loadAll().stream().map(RetainedEntry::getTopic)
                .sorted().collect(Collectors.toList());
        assertEquals(List.of("$SYS/uptime", "a/b:c"), topics);

        retained.delete("a/b:c");
        assertEquals(1, retained.loadAll().size());
    }

    @Test
    void testSessionsAndRetainedAreSeparated() {
        sessions.save(snapshot("retain:x"));
        retained.save(entry("session:y"));

        assertEquals(1, sessions.loadAll().size());
        assertEquals(1, retained.loadAll().size());
    }

    private SessionSnapshot snapshot(String clientId) {
        return SessionSnapshot.builder()
                .clientId(clientId)
                .sessionId("sess_" + clientId)
                .sessionExpiryInterval(60)
                .createdAt(1L)
                .nextPacketId(1)
                .build();
    }

    private RetainedEntry entry(String topic) {
        return RetainedEntry.builder()
                .topic(topic)
                .payload("v".getBytes(StandardCharsets.UTF_8))
                .qos(MqttQos.AT_LEAST_ONCE)
                .publisherId("pub")
                .storedAt(1L)
                .build();
    }
}
