/**
 * 资源配额超限异常
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.exception;

import com.mqdelivery.common.protocol.ReasonCode;

/**
 * 资源耗尽：包标识符用尽、飞行窗口已满、保留消息存储已满
 * 只拒绝当前操作，会话保持
 */
public class QuotaExceededException extends MqttEngineException {

    public QuotaExceededException(String message) {
        super(ReasonCode.QUOTA_EXCEEDED, message);
    }

    public QuotaExceededException(ReasonCode reasonCode, String message) {
        super(reasonCode, message);
    }
}
