package com.mqdelivery.common.event;

/**
 * 客户端断开
 *
 * @param graceful    收到DISCONNECT包为true，传输层异常为false
 * @param publishWill 客户端以“携带遗嘱断开”（0x04）请求发布遗嘱
 */
public record DisconnectEvent(boolean graceful, boolean publishWill) {

    public static DisconnectEvent normal() {
        return new DisconnectEvent(true, false);
    }

    public static DisconnectEvent gracefulWithWill() {
        return new DisconnectEvent(true, true);
    }

    public static DisconnectEvent transportError() {
        return new DisconnectEvent(false, true);
    }
}
