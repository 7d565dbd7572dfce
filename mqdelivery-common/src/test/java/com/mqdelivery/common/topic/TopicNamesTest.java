package com.mqdelivery.common.topic;

import com.mqdelivery.common.exception.ProtocolViolationException;
import com.mqdelivery.common.protocol.ReasonCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopicNamesTest {

    @Test
    void testSplitKeepsEmptyLevels() {
        assertEquals(List.of("a", "", "b"), TopicNames.split("a//b"));
        assertEquals(List.of("", "a"), TopicNames.split("/a"));
        assertEquals(List.of("a", ""), TopicNames.split("a/"));
    }

    @Test
    void testValidateForPublish() {
        assertDoesNotThrow(() -> TopicNames.validateForPublish("home/kitchen/temp"));

        ProtocolViolationException wildcard = assertThrows(ProtocolViolationException.class,
                () -> TopicNames.validateForPublish("home/+/temp"));
        assertEquals(ReasonCode.TOPIC_NAME_INVALID, wildcard.getReasonCode());

        assertThrows(ProtocolViolationException.class, () -> TopicNames.validateForPublish(""));
        assertThrows(ProtocolViolationException.class, () -> TopicNames.validateForPublish("$SYS/clients"));
    }
}
