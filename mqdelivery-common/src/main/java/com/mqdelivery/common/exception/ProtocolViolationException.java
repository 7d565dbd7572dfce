/**
 * 协议违规异常
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.exception;

import com.mqdelivery.common.protocol.ReasonCode;

/**
 * 协议违规：非法主题过滤器、保留主题写入、非法包标识符等
 * CONNECT阶段拒绝连接，连接建立后断开客户端
 */
public class ProtocolViolationException extends MqttEngineException {

    public ProtocolViolationException(ReasonCode reasonCode, String message) {
        super(reasonCode, message);
    }
}
