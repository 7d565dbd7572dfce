package com.mqdelivery.core.delivery;

import com.mqdelivery.common.exception.StoreException;
import com.mqdelivery.common.model.ClientSession;

/**
 * 持久化失败时的处理回调，受影响会话的连接需要断开
 */
@FunctionalInterface
public interface StoreFaultHandler {

    void onStoreFault(ClientSession session, StoreException cause);
}
