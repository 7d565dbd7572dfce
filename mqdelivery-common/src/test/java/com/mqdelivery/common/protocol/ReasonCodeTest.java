/**
 * 原因码测试
 *
 * @author zhenglin
 * @date 2026/10/09
 */
package com.mqdelivery.common.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReasonCodeTest {

    @Test
    void testCategories() {
        assertEquals(ReasonCode.Category.MALFORMED, ReasonCode.TOPIC_FILTER_INVALID.getCategory());
        assertEquals(ReasonCode.Category.QUOTA, ReasonCode.QUOTA_EXCEEDED.getCategory());
        assertEquals(ReasonCode.Category.NOT_AUTHORIZED, ReasonCode.NOT_AUTHORIZED.getCategory());
        assertEquals(ReasonCode.Category.UNSPECIFIED, ReasonCode.UNSPECIFIED_ERROR.getCategory());
    }

    @Test
    void testPermanentVersusTransient() {
        assertTrue(ReasonCode.NOT_AUTHORIZED.isPermanent());
        assertTrue(ReasonCode.PROTOCOL_ERROR.isPermanent());
        assertFalse(ReasonCode.QUOTA_EXCEEDED.isPermanent());
        assertFalse(ReasonCode.SERVER_BUSY.isPermanent());
    }

    @Test
    void testSuccessCodes() {
        assertTrue(ReasonCode.NO_MATCHING_SUBSCRIBERS.isSuccess());
        assertFalse(ReasonCode.UNSPECIFIED_ERROR.isSuccess());
        assertEquals(ReasonCode.GRANTED_QOS_2, ReasonCode.granted(MqttQos.EXACTLY_ONCE));
        assertEquals(ReasonCode.SUCCESS, ReasonCode.granted(MqttQos.AT_MOST_ONCE));
    }

    @Test
    void testV3ConnectReturnCodes() {
        assertEquals(0, ReasonCode.SUCCESS.toV3ConnectReturnCode());
        assertEquals(1, ReasonCode.UNSUPPORTED_PROTOCOL_VERSION.toV3ConnectReturnCode());
        assertEquals(2, ReasonCode.CLIENT_IDENTIFIER_NOT_VALID.toV3ConnectReturnCode());
        assertEquals(3, ReasonCode.SERVER_UNAVAILABLE.toV3ConnectReturnCode());
        assertEquals(4, ReasonCode.BAD_USER_NAME_OR_PASSWORD.toV3ConnectReturnCode());
        assertEquals(5, ReasonCode.NOT_AUTHORIZED.toV3ConnectReturnCode());
    }

    @Test
    void testFromValue() {
        assertEquals(ReasonCode.KEEP_ALIVE_TIMEOUT, ReasonCode.fromValue(0x8D));
        assertThrows(IllegalArgumentException.class, () -> ReasonCode.fromValue(0x7F));
    }
}
