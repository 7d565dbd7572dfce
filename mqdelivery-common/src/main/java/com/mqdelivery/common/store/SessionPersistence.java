/**
 * 会话持久化接口
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.store;

import com.mqdelivery.common.model.SessionSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * 持久会话的存储后端
 * 所有方法在后端不可用时抛出 {@link com.mqdelivery.common.exception.StoreException}
 */
public interface SessionPersistence {

    /**
     * 写入或覆盖会话快照，返回时数据必须已落盘
     */
    void save(SessionSnapshot snapshot);

    Optional<SessionSnapshot> load(String clientId);

    void delete(String clientId);

    /**
     * 读取全部快照，启动恢复时使用
     */
    List<SessionSnapshot> loadAll();
}
