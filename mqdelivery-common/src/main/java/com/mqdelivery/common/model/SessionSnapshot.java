/**
 * 会话持久化快照
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 会话在进程重启后仍需保留的全部内容，包括QoS 2状态机位置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSnapshot {

    private String clientId;

    private String sessionId;

    private long sessionExpiryInterval;

    private long createdAt;

    /**
     * 最近一次断开时间（毫秒），在线时为0
     */
    private long disconnectedAt;

    @Builder.Default
    private List<Subscription> subscriptions = new ArrayList<>();

    /**
     * 出站飞行表，按发送顺序
     */
    @Builder.Default
    private List<InflightMessage> outboundInflight = new ArrayList<>();

    /**
     * 入站QoS 2 RECEIVED标记
     */
    @Builder.Default
    private List<InflightMessage> inboundInflight = new ArrayList<>();

    @Builder.Default
    private List<QueuedMessage> queue = new ArrayList<>();

    private WillSpec will;

    /**
     * 包标识符分配器的下一个候选值
     */
    private int nextPacketId;
}
