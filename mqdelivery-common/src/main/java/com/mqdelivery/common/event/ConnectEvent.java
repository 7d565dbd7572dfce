package com.mqdelivery.common.event;

import com.mqdelivery.common.model.WillSpec;

/**
 * 解码后的CONNECT
 *
 * @param clientId              客户端ID，可以为空字符串
 * @param cleanStart            清理会话标志
 * @param keepAliveSeconds      保活间隔，0表示不检测
 * @param sessionExpiryInterval 会话过期间隔（秒），null时按清理标志取默认值
 * @param receiveMaximum        客户端接收最大值，null表示不限制
 * @param will                  遗嘱，可以为null
 * @param authorized            外部认证结果
 */
public record ConnectEvent(String clientId, boolean cleanStart, int keepAliveSeconds,
                           Long sessionExpiryInterval, Integer receiveMaximum, WillSpec will,
                           boolean authorized) {

    public ConnectEvent {
        if (clientId == null) {
            clientId = "";
        }
        if (keepAliveSeconds < 0 || keepAliveSeconds > 65535) {
            throw new IllegalArgumentException("Invalid keep alive: " + keepAliveSeconds);
        }
    }

    /**
     * MQTT 3.1.1 形式的CONNECT
     */
    public static ConnectEvent of(String clientId, boolean cleanStart, int keepAliveSeconds, WillSpec will) {
        return new ConnectEvent(clientId, cleanStart, keepAliveSeconds, null, null, will, true);
    }
}
