/**
 * 投递引擎异常基类
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.exception;

import com.mqdelivery.common.protocol.ReasonCode;

/**
 * 投递引擎运行时异常，携带返回给客户端的原因码
 */
public class MqttEngineException extends RuntimeException {

    private final ReasonCode reasonCode;

    public MqttEngineException(ReasonCode reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public MqttEngineException(ReasonCode reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public ReasonCode getReasonCode() {
        return reasonCode;
    }
}
