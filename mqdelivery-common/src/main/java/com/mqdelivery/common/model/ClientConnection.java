/**
 * 客户端连接信息
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.model;

import com.mqdelivery.common.transport.ClientChannel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 客户端连接模型
 * 一个网络连接对应一个实例，会话通过它向客户端写包
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClientConnection {

    /**
     * 连接唯一标识，用于识别已被接管的旧连接
     */
    private String connectionId;

    /**
     * 客户端ID
     */
    private String clientId;

    /**
     * 出站通道
     */
    private ClientChannel channel;

    /**
     * 协商后的保活间隔（秒）
     */
    private int keepAliveSeconds;

    /**
     * 连接建立时间（毫秒）
     */
    private long connectedAt;

    /**
     * 最后一次收到客户端数据包的时间（毫秒）
     */
    private volatile long lastActivity;

    public boolean isActive() {
        return channel != null && channel.isActive();
    }
}
