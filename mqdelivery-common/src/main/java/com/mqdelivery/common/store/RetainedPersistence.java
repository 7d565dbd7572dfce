/**
 * 保留消息持久化接口
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.store;

import com.mqdelivery.common.model.RetainedEntry;

import java.util.List;

/**
 * 保留消息的存储后端
 * 所有方法在后端不可用时抛出 {@link com.mqdelivery.common.exception.StoreException}
 */
public interface RetainedPersistence {

    void save(RetainedEntry entry);

    void delete(String topic);

    List<RetainedEntry> loadAll();
}
