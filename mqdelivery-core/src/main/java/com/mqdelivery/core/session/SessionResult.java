package com.mqdelivery.core.session;

import com.mqdelivery.common.model.ClientSession;

/**
 * resumeOrCreate 的结果
 *
 * @param session        绑定到本次连接的会话
 * @param sessionPresent 是否恢复了已有会话，对应CONNACK中的Session Present
 */
public record SessionResult(ClientSession session, boolean sessionPresent) {
}
