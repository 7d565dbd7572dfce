/**
 * 包标识符分配器
 *
 * @author zhenglin
 * @date 2026/10/10
 */
package com.mqdelivery.core.qos;

import com.mqdelivery.common.exception.QuotaExceededException;
import com.mqdelivery.common.model.ClientSession;

/**
 * 按会话顺序分配出站包标识符 1..65535，回绕时跳过仍在飞行中的标识符
 * 分配位置保存在会话中，随会话一起持久化
 */
public final class PacketIdAllocator {

    public static final int MAX_PACKET_ID = 65535;

    private PacketIdAllocator() {
    }

    /**
     * 分配下一个空闲标识符，调用方需持有会话锁
     *
     * @param session 会话
     * @return 包标识符
     * @throws QuotaExceededException 全部标识符都在使用中
     */
    public static int allocate(ClientSession session) {
        int candidate = normalize(session.getNextPacketId());
        for (int i = 0; i < MAX_PACKET_ID; i++) {
            if (!session.isPacketIdInUse(candidate)) {
                session.setNextPacketId(normalize(candidate + 1));
                return candidate;
            }
            candidate = normalize(candidate + 1);
        }
        throw new QuotaExceededException("All packet identifiers are in use for client " + session.getClientId());
    }

    private static int normalize(int id) {
        return id < 1 || id > MAX_PACKET_ID ? 1 : id;
    }
}
