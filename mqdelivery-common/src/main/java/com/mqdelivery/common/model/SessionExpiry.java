/**
 * 会话过期常量
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.model;

import lombok.experimental.UtilityClass;

@UtilityClass
public class SessionExpiry {

    /**
     * 连接断开即结束会话
     */
    public static final long ON_DISCONNECT = 0L;

    /**
     * 永不过期（MQTT 5.0 中的 0xFFFFFFFF）
     */
    public static final long NEVER = 0xFFFFFFFFL;

    /**
     * 计算会话的过期时间点
     *
     * @param disconnectedAt 断开时间（毫秒）
     * @param expirySeconds  过期间隔（秒）
     * @return 过期时间点，永不过期返回 Long.MAX_VALUE
     */
    public static long deadline(long disconnectedAt, long expirySeconds) {
        if (expirySeconds >= NEVER) {
            return Long.MAX_VALUE;
        }
        return disconnectedAt + expirySeconds * 1000L;
    }
}
