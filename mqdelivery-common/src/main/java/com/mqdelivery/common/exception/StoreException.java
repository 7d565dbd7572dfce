/**
 * 存储故障异常
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.exception;

import com.mqdelivery.common.protocol.ReasonCode;

/**
 * 持久化后端不可用
 * 不在本地恢复，受影响会话的连接会被断开
 */
public class StoreException extends MqttEngineException {

    public StoreException(String message) {
        super(ReasonCode.UNSPECIFIED_ERROR, message);
    }

    public StoreException(String message, Throwable cause) {
        super(ReasonCode.UNSPECIFIED_ERROR, message, cause);
    }
}
