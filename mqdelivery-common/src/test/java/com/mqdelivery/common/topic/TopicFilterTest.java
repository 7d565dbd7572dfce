/**
 * 主题过滤器测试
 *
 * @author zhenglin
 * @date 2026/10/09
 */
package com.mqdelivery.common.topic;

import com.mqdelivery.common.exception.ProtocolViolationException;
import com.mqdelivery.common.protocol.ReasonCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopicFilterTest {

    @Test
    void testParsePlainFilter() {
        TopicFilter filter = TopicFilter.parse("home/+/temp");

        assertEquals("home/+/temp", filter.getRaw());
        assertEquals("home/+/temp", filter.getFilter());
        assertEquals(List.of("home", "+", "temp"), filter.getLevels());
        assertFalse(filter.isShared());
        assertTrue(filter.hasWildcard());
    }

    @Test
    void testParseSharedFilter() {
        TopicFilter filter = TopicFilter.parse("$share/workers/jobs/#");

        assertTrue(filter.isShared());
        assertEquals("workers", filter.getShareGroup());
        assertEquals("jobs/#", filter.getFilter());
        assertEquals("$share/workers/jobs/#", filter.getRaw());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a/#/b", "a/b#", "a+/b", "#/a", "$share/g", "$share//a", "$share/g+/a", "$share/g/"})
    void testRejectInvalidFilter(String raw) {
        ProtocolViolationException e = assertThrows(ProtocolViolationException.class, () -> TopicFilter.parse(raw));
        assertEquals(ReasonCode.TOPIC_FILTER_INVALID, e.getReasonCode());
    }

    @Test
    void testSingleLevelWildcard() {
        TopicFilter filter = TopicFilter.parse("a/+/c");

        assertTrue(filter.matches("a/b/c"));
        assertTrue(filter.matches("a//c"));
        assertFalse(filter.matches("a/b/b/c"));
        assertFalse(filter.matches("a/b"));
    }

    @Test
    void testMultiLevelWildcardMatchesParent() {
        TopicFilter filter = TopicFilter.parse("a/#");

        assertTrue(filter.matches("a"));
        assertTrue(filter.matches("a/b"));
        assertTrue(filter.matches("a/b/c"));
        assertFalse(filter.matches("b"));
    }

    @Test
    void testRootWildcardSkipsReservedTopics() {
        assertFalse(TopicFilter.parse("#").matches("$SYS/broker/uptime"));
        assertFalse(TopicFilter.parse("+/broker/uptime").matches("$SYS/broker/uptime"));
        assertTrue(TopicFilter.parse("$SYS/#").matches("$SYS/broker/uptime"));
    }

    @Test
    void testEmptyLevelsAreDistinct() {
        TopicFilter filter = TopicFilter.parse("a//b");

        assertTrue(filter.matches("a//b"));
        assertFalse(filter.matches("a/b"));
    }

    @Test
    void testMatchingIsCaseSensitive() {
        assertFalse(TopicFilter.parse("Home/temp").matches("home/temp"));
    }
}
