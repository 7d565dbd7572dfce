/**
 * 出站控制包
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.packet;

import com.mqdelivery.common.protocol.PacketType;

/**
 * 引擎发往客户端的结构化控制包，由外部编码器转换为字节
 */
public interface OutboundPacket {

    PacketType type();
}
