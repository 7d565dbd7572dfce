/**
 * 会话存储接口
 *
 * @author zhenglin
 * @date 2026/10/09
 */
package com.mqdelivery.core.session;

import com.mqdelivery.common.model.ClientSession;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * 会话存储
 * 客户端ID是主键，同一客户端ID最多一个存活会话
 */
public interface SessionStore {

    /**
     * 恢复或创建会话
     *
     * @param clientId              客户端ID
     * @param cleanStart            为true时丢弃已有会话
     * @param sessionExpiryInterval 本次连接协商的会话过期间隔（秒）
     * @return 会话和是否存在旧会话
     */
    SessionResult resumeOrCreate(String clientId, boolean cleanStart, long sessionExpiryInterval);

    Optional<ClientSession> get(String clientId);

    Collection<ClientSession> all();

    /**
     * 销毁会话并删除持久化记录
     */
    void destroy(String clientId);

    /**
     * 持久会话写入后端，非持久会话忽略
     *
     * @throws com.mqdelivery.common.exception.StoreException 后端不可用
     */
    void persist(ClientSession session);

    /**
     * 销毁离线时间超过过期间隔的会话
     *
     * @param now 当前时间（毫秒）
     * @return 被销毁的客户端ID
     */
    List<String> expireSweep(long now);

    /**
     * 串行化同一客户端ID的连接、断开、接管和过期处理
     */
    Lock clientLock(String clientId);

    /**
     * 启动时加载持久化的会话
     */
    void recover();

    void addListener(SessionEventListener listener);

    int size();
}
