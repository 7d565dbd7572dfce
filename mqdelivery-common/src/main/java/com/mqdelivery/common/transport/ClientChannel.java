/**
 * 客户端通道
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.transport;

import com.mqdelivery.common.packet.OutboundPacket;
import com.mqdelivery.common.protocol.ReasonCode;

/**
 * 传输层提供给引擎的出站通道，一个网络连接对应一个实例
 * 实现必须是线程安全的，多个发布线程可能同时向同一通道写入
 */
public interface ClientChannel {

    /**
     * 发送控制包
     *
     * @param packet 出站包
     */
    void send(OutboundPacket packet);

    /**
     * 关闭网络连接
     *
     * @param reason 关闭原因，需要通知客户端时引擎会先发送DISCONNECT
     */
    void close(ReasonCode reason);

    /**
     * 连接是否仍然可写
     */
    boolean isActive();
}
