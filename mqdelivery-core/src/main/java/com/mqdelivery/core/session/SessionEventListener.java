/**
 * 会话事件监听器
 *
 * @author zhenglin
 * @date 2026/10/09
 */
package com.mqdelivery.core.session;

import com.mqdelivery.common.model.ClientSession;

public interface SessionEventListener {

    /**
     * 会话创建事件
     *
     * @param session 会话信息
     */
    default void onSessionCreated(ClientSession session) {
    }

    /**
     * 已有会话被新连接恢复
     *
     * @param session 会话信息
     */
    default void onSessionResumed(ClientSession session) {
    }

    /**
     * 启动时从持久化后端恢复会话
     *
     * @param session 离线状态的会话
     */
    default void onSessionRecovered(ClientSession session) {
    }

    /**
     * 会话销毁事件
     *
     * @param session 会话信息
     * @param reason  EXPIRED 或 CLEANED
     */
    default void onSessionDestroyed(ClientSession session, ClientSession.SessionState reason) {
    }
}
