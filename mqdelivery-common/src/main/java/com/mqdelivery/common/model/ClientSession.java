/**
 * 客户端会话信息
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 客户端会话模型
 *
 * 订阅表可以并发读取；飞行表、离线队列和包标识符位置由会话锁保护，
 * 调用方在访问这些结构前必须持有 {@link #lock()}。
 */
public class ClientSession {

    /**
     * 客户端ID，会话主键
     */
    @Getter
    private final String clientId;

    /**
     * 会话唯一标识，每次新建会话时生成
     */
    @Getter
    private final String sessionId;

    /**
     * 会话创建时间（毫秒）
     */
    @Getter
    private final long createdAt;

    /**
     * 会话过期间隔（秒），0表示随连接结束
     */
    @Getter
    @Setter
    private volatile long sessionExpiryInterval;

    @Getter
    @Setter
    private volatile SessionState state = SessionState.ACTIVE;

    /**
     * 当前绑定的连接，离线时为null
     */
    @Getter
    @Setter
    private volatile ClientConnection connection;

    /**
     * 最近一次断开时间（毫秒），在线时为0
     */
    @Getter
    @Setter
    private volatile long disconnectedAt;

    @Getter
    @Setter
    private volatile WillSpec will;

    /**
     * 发送窗口：同时未确认的出站QoS 1/2消息上限
     */
    @Getter
    @Setter
    private volatile int sendQuota = 65535;

    /**
     * 包标识符分配器的下一个候选值
     */
    @Getter
    @Setter
    private int nextPacketId = 1;

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final LinkedHashMap<Integer, InflightMessage> outboundInflight = new LinkedHashMap<>();
    private final Map<Integer, InflightMessage> inboundInflight = new HashMap<>();
    private final Deque<QueuedMessage> queue = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public ClientSession(String clientId, String sessionId, long sessionExpiryInterval, long createdAt) {
        this.clientId = clientId;
        this.sessionId = sessionId;
        this.sessionExpiryInterval = sessionExpiryInterval;
        this.createdAt = createdAt;
    }

    /**
     * 会话状态枚举
     */
    public enum SessionState {
        /**
         * 活跃状态
         */
        ACTIVE,

        /**
         * 非活跃状态（连接断开但会话保留）
         */
        INACTIVE,

        /**
         * 过期状态
         */
        EXPIRED,

        /**
         * 已清理状态
         */
        CLEANED
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /**
     * 断开后是否保留
     */
    public boolean isPersistent() {
        return sessionExpiryInterval > SessionExpiry.ON_DISCONNECT;
    }

    public boolean isConnected() {
        return connection != null;
    }

    /**
     * 会话当前是否绑定在指定连接上
     */
    public boolean isBoundTo(String connectionId) {
        ClientConnection current = connection;
        return current != null && current.getConnectionId().equals(connectionId);
    }

    public boolean isTerminated() {
        return state == SessionState.EXPIRED || state == SessionState.CLEANED;
    }

    // ==================== 订阅 ====================

    /**
     * 添加订阅，同一过滤器原文的旧订阅被替换
     *
     * @return 被替换的订阅，没有返回null
     */
    public Subscription addSubscription(Subscription subscription) {
        return subscriptions.put(subscription.getTopicFilter(), subscription);
    }

    public Subscription removeSubscription(String topicFilter) {
        return subscriptions.remove(topicFilter);
    }

    public Subscription getSubscription(String topicFilter) {
        return subscriptions.get(topicFilter);
    }

    public Collection<Subscription> getSubscriptions() {
        return Collections.unmodifiableCollection(subscriptions.values());
    }

    // ==================== 飞行表（需持有会话锁） ====================

    public void putOutbound(InflightMessage message) {
        outboundInflight.put(message.getPacketId(), message);
    }

    public InflightMessage getOutbound(int packetId) {
        return outboundInflight.get(packetId);
    }

    public InflightMessage removeOutbound(int packetId) {
        return outboundInflight.remove(packetId);
    }

    /**
     * 按发送顺序返回出站飞行消息
     */
    public List<InflightMessage> outboundInOrder() {
        return new ArrayList<>(outboundInflight.values());
    }

    public int outboundCount() {
        return outboundInflight.size();
    }

    public boolean isPacketIdInUse(int packetId) {
        return outboundInflight.containsKey(packetId);
    }

    public void putInbound(InflightMessage message) {
        inboundInflight.put(message.getPacketId(), message);
    }

    public InflightMessage getInbound(int packetId) {
        return inboundInflight.get(packetId);
    }

    public InflightMessage removeInbound(int packetId) {
        return inboundInflight.remove(packetId);
    }

    public int inboundCount() {
        return inboundInflight.size();
    }

    // ==================== 离线队列（需持有会话锁） ====================

    public void enqueue(QueuedMessage message) {
        queue.addLast(message);
    }

    /**
     * 取出后未能发送的队首消息放回队首
     */
    public void requeueFirst(QueuedMessage message) {
        queue.addFirst(message);
    }

    public QueuedMessage peekQueued() {
        return queue.peekFirst();
    }

    public QueuedMessage pollQueued() {
        return queue.pollFirst();
    }

    public int queueSize() {
        return queue.size();
    }

    public List<QueuedMessage> queuedMessages() {
        return new ArrayList<>(queue);
    }

    /**
     * 清空所有投递状态，会话被清理时调用
     */
    public void clearDeliveryState() {
        outboundInflight.clear();
        inboundInflight.clear();
        queue.clear();
    }

    // ==================== 持久化 ====================

    /**
     * 生成持久化快照，调用方需持有会话锁
     */
    public SessionSnapshot toSnapshot() {
        List<Subscription> subs = new ArrayList<>();
        subscriptions.values().forEach(s -> subs.add(s.toBuilder().build()));
        List<InflightMessage> outbound = new ArrayList<>();
        outboundInflight.values().forEach(m -> outbound.add(m.toBuilder().build()));
        List<InflightMessage> inbound = new ArrayList<>();
        inboundInflight.values().forEach(m -> inbound.add(m.toBuilder().build()));
        List<QueuedMessage> queued = new ArrayList<>();
        queue.forEach(m -> queued.add(m.toBuilder().build()));
        WillSpec currentWill = will;
        return SessionSnapshot.builder()
                .clientId(clientId)
                .sessionId(sessionId)
                .sessionExpiryInterval(sessionExpiryInterval)
                .createdAt(createdAt)
                .disconnectedAt(disconnectedAt)
                .subscriptions(subs)
                .outboundInflight(outbound)
                .inboundInflight(inbound)
                .queue(queued)
                .will(currentWill == null ? null : currentWill.toBuilder().build())
                .nextPacketId(nextPacketId)
                .build();
    }

    /**
     * 从快照恢复为离线会话
     */
    public static ClientSession fromSnapshot(SessionSnapshot snapshot) {
        ClientSession session = new ClientSession(snapshot.getClientId(), snapshot.getSessionId(),
                snapshot.getSessionExpiryInterval(), snapshot.getCreatedAt());
        session.state = SessionState.INACTIVE;
        session.disconnectedAt = snapshot.getDisconnectedAt();
        session.will = snapshot.getWill();
        session.nextPacketId = snapshot.getNextPacketId() <= 0 ? 1 : snapshot.getNextPacketId();
        snapshot.getSubscriptions().forEach(s -> session.subscriptions.put(s.getTopicFilter(), s.toBuilder().build()));
        snapshot.getOutboundInflight().forEach(m -> session.outboundInflight.put(m.getPacketId(), m.toBuilder().build()));
        snapshot.getInboundInflight().forEach(m -> session.inboundInflight.put(m.getPacketId(), m.toBuilder().build()));
        snapshot.getQueue().forEach(m -> session.queue.addLast(m.toBuilder().build()));
        return session;
    }

    @Override
    public String toString() {
        return "ClientSession{clientId='" + clientId + "', sessionId='" + sessionId + "', state=" + state
                + ", connected=" + isConnected() + '}';
    }
}
