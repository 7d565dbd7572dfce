/**
 * MQTT 交付引擎
 *
 * @author zhenglin
 * @date 2026/10/13
 */
package com.mqdelivery.core.delivery;

import com.mqdelivery.common.event.AckEvent;
import com.mqdelivery.common.event.ConnectEvent;
import com.mqdelivery.common.event.DisconnectEvent;
import com.mqdelivery.common.event.PublishEvent;
import com.mqdelivery.common.event.SubscribeEvent;
import com.mqdelivery.common.event.UnsubscribeEvent;
import com.mqdelivery.common.exception.ProtocolViolationException;
import com.mqdelivery.common.exception.StoreException;
import com.mqdelivery.common.model.ClientConnection;
import com.mqdelivery.common.model.ClientSession;
import com.mqdelivery.common.model.PublishMessage;
import com.mqdelivery.common.model.RetainedEntry;
import com.mqdelivery.common.model.SessionExpiry;
import com.mqdelivery.common.model.Subscription;
import com.mqdelivery.common.model.WillSpec;
import com.mqdelivery.common.packet.AckPacket;
import com.mqdelivery.common.packet.ConnAckPacket;
import com.mqdelivery.common.packet.DisconnectPacket;
import com.mqdelivery.common.packet.PingRespPacket;
import com.mqdelivery.common.packet.SubAckPacket;
import com.mqdelivery.common.packet.UnsubAckPacket;
import com.mqdelivery.common.protocol.MqttQos;
import com.mqdelivery.common.protocol.PacketType;
import com.mqdelivery.common.protocol.ReasonCode;
import com.mqdelivery.common.topic.TopicFilter;
import com.mqdelivery.common.topic.TopicNames;
import com.mqdelivery.common.transport.ClientChannel;
import com.mqdelivery.common.util.MetricsUtils;
import com.mqdelivery.core.config.EngineProperties;
import com.mqdelivery.core.keepalive.KeepAliveMonitor;
import com.mqdelivery.core.retain.RetainedStore;
import com.mqdelivery.core.session.SessionEventListener;
import com.mqdelivery.core.session.SessionResult;
import com.mqdelivery.core.session.SessionStore;
import com.mqdelivery.core.timer.EngineTimer;
import com.mqdelivery.core.topic.TopicTree;
import com.mqdelivery.core.will.WillManager;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;

/**
 * 交付引擎入口
 *
 * 传输层把解码后的事件交给引擎，引擎通过连接的 {@link ClientChannel} 写回出站包。
 * 同一客户端ID的连接、断开、接管和过期由 {@link SessionStore#clientLock(String)} 串行化；
 * 不再绑定在会话上的旧连接发来的事件一律忽略。
 */
@Slf4j
public class MqttDeliveryEngine {

    private static final String ASSIGNED_CLIENT_ID_PREFIX = "auto-";

    private final SessionStore sessionStore;
    private final TopicTree topicTree;
    private final RetainedStore retainedStore;
    private final MessageRoutingEngine routingEngine;
    private final QoSDeliveryManager deliveryManager;
    private final WillManager willManager;
    private final KeepAliveMonitor keepAliveMonitor;
    private final EngineTimer timer;
    private final EngineProperties properties;
    private final Clock clock;

    public MqttDeliveryEngine(SessionStore sessionStore, TopicTree topicTree, RetainedStore retainedStore,
                              MessageRoutingEngine routingEngine, QoSDeliveryManager deliveryManager,
                              WillManager willManager, KeepAliveMonitor keepAliveMonitor, EngineTimer timer,
                              EngineProperties properties, Clock clock) {
        this.sessionStore = sessionStore;
        this.topicTree = topicTree;
        this.retainedStore = retainedStore;
        this.routingEngine = routingEngine;
        this.deliveryManager = deliveryManager;
        this.willManager = willManager;
        this.keepAliveMonitor = keepAliveMonitor;
        this.timer = timer;
        this.properties = properties;
        this.clock = clock;

        willManager.setPublisher(this::publishWill);
        keepAliveMonitor.setTimeoutListener(this::onKeepAliveTimeout);
        deliveryManager.setStoreFaultHandler(this::onStoreFault);
        sessionStore.addListener(new SessionLifecycleListener());
    }

    /**
     * 启动：恢复保留消息和持久会话，为恢复出的离线会话重新布设遗嘱
     */
    public void start() {
        retainedStore.recover();
        sessionStore.recover();
        int wills = 0;
        for (ClientSession session : sessionStore.all()) {
            WillSpec will = session.getWill();
            if (will != null && !session.isConnected()) {
                willManager.arm(session, will);
                willManager.fireIfArmed(session, true);
                wills++;
            }
        }
        log.info("交付引擎启动完成: sessions={}, retained={}, pendingWills={}", sessionStore.size(),
                retainedStore.size(), wills);
    }

    // ==================== CONNECT ====================

    /**
     * 处理CONNECT
     *
     * @param channel 新连接的出站通道
     * @param event   CONNECT内容
     * @return 建立的连接；被拒绝时为null，此时已发送CONNACK并关闭通道
     */
    public ClientConnection onConnect(ClientChannel channel, ConnectEvent event) {
        if (!event.authorized()) {
            return refuse(channel, event.clientId(), ReasonCode.NOT_AUTHORIZED);
        }
        String clientId = event.clientId();
        String assignedClientId = null;
        if (clientId.isEmpty()) {
            if (!event.cleanStart()) {
                return refuse(channel, clientId, ReasonCode.CLIENT_IDENTIFIER_NOT_VALID);
            }
            clientId = ASSIGNED_CLIENT_ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
            assignedClientId = clientId;
        }
        WillSpec will = event.will();
        if (will != null) {
            try {
                TopicNames.validateForPublish(will.getTopic());
            } catch (ProtocolViolationException e) {
                return refuse(channel, clientId, e.getReasonCode());
            }
        }
        long expiry = negotiateSessionExpiry(event);
        long now = clock.millis();
        ClientConnection connection = ClientConnection.builder()
                .connectionId(UUID.randomUUID().toString())
                .clientId(clientId)
                .channel(channel)
                .keepAliveSeconds(event.keepAliveSeconds())
                .connectedAt(now)
                .lastActivity(now)
                .build();

        Lock lock = sessionStore.clientLock(clientId);
        lock.lock();
        try {
            Optional<ClientSession> existing = sessionStore.get(clientId);
            if (existing.isPresent() && existing.get().isConnected()) {
                takeOver(existing.get());
            }
            // 遗嘱延迟内重连，先撤销遗嘱，clean start清理旧会话时不再发布
            willManager.disarm(clientId);
            SessionResult result = sessionStore.resumeOrCreate(clientId, event.cleanStart(), expiry);
            ClientSession session = result.session();
            boolean sessionPresent = result.sessionPresent();
            int receiveMaximum = event.receiveMaximum() == null ? 65535 : event.receiveMaximum();
            session.lock();
            try {
                session.setConnection(connection);
                session.setState(ClientSession.SessionState.ACTIVE);
                session.setDisconnectedAt(0L);
                session.setSendQuota(Math.min(receiveMaximum, properties.getMaxInflightMessages()));
                session.setWill(will);
            } finally {
                session.unlock();
            }
            try {
                sessionStore.persist(session);
            } catch (StoreException e) {
                log.error("会话持久化失败，拒绝连接: clientId={}", clientId, e);
                unbind(session, connection);
                return refuse(channel, clientId, ReasonCode.SERVER_UNAVAILABLE);
            }
            if (will != null) {
                willManager.arm(session, will);
            }
            channel.send(new ConnAckPacket(sessionPresent, ReasonCode.SUCCESS, assignedClientId));
            keepAliveMonitor.register(connection);
            log.info("客户端连接成功: clientId={}, sessionPresent={}, cleanStart={}, expiry={}s, keepAlive={}s",
                    clientId, sessionPresent, event.cleanStart(), expiry, event.keepAliveSeconds());
            deliveryManager.resume(session);
        } finally {
            lock.unlock();
        }
        return connection;
    }

    private long negotiateSessionExpiry(ConnectEvent event) {
        long max = properties.getMaxSessionExpirySeconds();
        if (event.sessionExpiryInterval() != null) {
            return Math.min(event.sessionExpiryInterval(), max);
        }
        if (event.cleanStart()) {
            return SessionExpiry.ON_DISCONNECT;
        }
        return Math.min(properties.getDefaultSessionExpirySeconds(), max);
    }

    private ClientConnection refuse(ClientChannel channel, String clientId, ReasonCode reasonCode) {
        log.warn("拒绝连接: clientId={}, reason={}", clientId, reasonCode);
        channel.send(ConnAckPacket.refused(reasonCode));
        channel.close(reasonCode);
        return null;
    }

    /**
     * 接管：关闭旧连接，旧连接的遗嘱按异常断开处理，调用方持有客户端锁
     */
    private void takeOver(ClientSession session) {
        ClientConnection previous = session.getConnection();
        keepAliveMonitor.unregister(previous);
        deliveryManager.detach(session);
        unbind(session, previous);
        previous.getChannel().send(new DisconnectPacket(ReasonCode.SESSION_TAKEN_OVER));
        previous.getChannel().close(ReasonCode.SESSION_TAKEN_OVER);
        MetricsUtils.recordSessionTakeover();
        log.info("会话被接管: clientId={}, previousConnection={}", session.getClientId(),
                previous.getConnectionId());
        willManager.fireIfArmed(session, true);
        if (!session.isPersistent()) {
            sessionStore.destroy(session.getClientId());
        }
    }

    private void unbind(ClientSession session, ClientConnection connection) {
        session.lock();
        try {
            if (session.isBoundTo(connection.getConnectionId())) {
                session.setConnection(null);
                session.setDisconnectedAt(clock.millis());
                if (!session.isTerminated()) {
                    session.setState(ClientSession.SessionState.INACTIVE);
                }
            }
        } finally {
            session.unlock();
        }
    }

    // ==================== SUBSCRIBE / UNSUBSCRIBE ====================

    public void onSubscribe(ClientConnection connection, SubscribeEvent event) {
        ClientSession session = resolve(connection);
        if (session == null) {
            return;
        }
        List<ReasonCode> reasonCodes = new ArrayList<>();
        List<Subscription> forRetained = new ArrayList<>();
        for (SubscribeEvent.SubscriptionRequest request : event.requests()) {
            if (!request.authorized()) {
                log.warn("订阅未授权: clientId={}, filter={}", session.getClientId(), request.topicFilter());
                reasonCodes.add(ReasonCode.NOT_AUTHORIZED);
                continue;
            }
            TopicFilter filter;
            try {
                filter = TopicFilter.parse(request.topicFilter());
            } catch (ProtocolViolationException e) {
                log.warn("订阅过滤器非法: clientId={}, filter={}", session.getClientId(), request.topicFilter());
                reasonCodes.add(e.getReasonCode());
                continue;
            }
            MqttQos granted = request.qos().min(properties.getMaximumQos());
            Subscription subscription = Subscription.builder()
                    .clientId(session.getClientId())
                    .topicFilter(filter.getRaw())
                    .filter(filter.getFilter())
                    .shareGroup(filter.getShareGroup())
                    .qos(granted)
                    // 共享订阅不支持 No Local
                    .noLocal(request.noLocal() && !filter.isShared())
                    .retainAsPublished(request.retainAsPublished())
                    .retainHandling(request.retainHandling())
                    .subscriptionIdentifier(request.subscriptionIdentifier())
                    .build();
            Subscription previous;
            session.lock();
            try {
                previous = session.addSubscription(subscription);
            } finally {
                session.unlock();
            }
            topicTree.subscribe(filter, subscription);
            reasonCodes.add(ReasonCode.granted(granted));
            log.debug("订阅成功: clientId={}, filter={}, qos={}", session.getClientId(), filter, granted);
            if (wantsRetained(subscription, previous == null)) {
                forRetained.add(subscription);
            }
        }
        try {
            sessionStore.persist(session);
        } catch (StoreException e) {
            handleStoreFault(session, e);
            return;
        }
        connection.getChannel().send(new SubAckPacket(event.packetId(), reasonCodes));
        for (Subscription subscription : forRetained) {
            sendRetained(session, subscription);
        }
    }

    private boolean wantsRetained(Subscription subscription, boolean isNew) {
        if (subscription.isShared()) {
            return false;
        }
        switch (subscription.getRetainHandling()) {
            case SEND_ON_SUBSCRIBE:
                return true;
            case SEND_IF_NEW:
                return isNew;
            default:
                return false;
        }
    }

    private void sendRetained(ClientSession session, Subscription subscription) {
        List<RetainedEntry> entries = retainedStore.scan(TopicFilter.parse(subscription.getTopicFilter()));
        for (RetainedEntry entry : entries) {
            PublishMessage message = PublishMessage.builder()
                    .topic(entry.getTopic())
                    .payload(entry.getPayload())
                    .qos(entry.getQos())
                    .retain(true)
                    .publisherId(entry.getPublisherId())
                    .expiresAt(entry.getExpiresAt())
                    .build();
            deliveryManager.deliver(session, message, subscription, true);
        }
        if (!entries.isEmpty()) {
            log.debug("发送保留消息: clientId={}, filter={}, count={}", session.getClientId(),
                    subscription.getTopicFilter(), entries.size());
        }
    }

    public void onUnsubscribe(ClientConnection connection, UnsubscribeEvent event) {
        ClientSession session = resolve(connection);
        if (session == null) {
            return;
        }
        List<ReasonCode> reasonCodes = new ArrayList<>();
        for (String raw : event.topicFilters()) {
            TopicFilter filter;
            try {
                filter = TopicFilter.parse(raw);
            } catch (ProtocolViolationException e) {
                reasonCodes.add(e.getReasonCode());
                continue;
            }
            Subscription removed;
            session.lock();
            try {
                removed = session.removeSubscription(filter.getRaw());
            } finally {
                session.unlock();
            }
            if (removed == null) {
                reasonCodes.add(ReasonCode.NO_SUBSCRIPTION_EXISTED);
                continue;
            }
            topicTree.unsubscribe(filter, removed);
            reasonCodes.add(ReasonCode.SUCCESS);
            log.debug("取消订阅: clientId={}, filter={}", session.getClientId(), raw);
        }
        try {
            sessionStore.persist(session);
        } catch (StoreException e) {
            handleStoreFault(session, e);
            return;
        }
        connection.getChannel().send(new UnsubAckPacket(event.packetId(), reasonCodes));
    }

    // ==================== PUBLISH / ACK ====================

    public void onPublish(ClientConnection connection, PublishEvent event) {
        ClientSession session = resolve(connection);
        if (session == null) {
            return;
        }
        try {
            TopicNames.validateForPublish(event.topic());
            if (event.qos() != MqttQos.AT_MOST_ONCE && event.packetId() == 0) {
                throw new ProtocolViolationException(ReasonCode.MALFORMED_PACKET,
                        "QoS " + event.qos().getValue() + " PUBLISH without packet identifier");
            }
        } catch (ProtocolViolationException e) {
            disconnectForViolation(connection, e);
            return;
        }
        if (!event.authorized()) {
            log.warn("发布未授权: clientId={}, topic={}", session.getClientId(), event.topic());
            if (event.qos() == MqttQos.AT_LEAST_ONCE) {
                connection.getChannel().send(new AckPacket(PacketType.PUBACK, event.packetId(),
                        ReasonCode.NOT_AUTHORIZED));
            } else if (event.qos() == MqttQos.EXACTLY_ONCE) {
                connection.getChannel().send(new AckPacket(PacketType.PUBREC, event.packetId(),
                        ReasonCode.NOT_AUTHORIZED));
            }
            return;
        }
        Long expiry = event.messageExpiryInterval();
        PublishMessage message = PublishMessage.builder()
                .topic(event.topic())
                .payload(event.payload())
                .qos(event.qos())
                .retain(event.retain())
                .publisherId(session.getClientId())
                .expiresAt(expiry == null ? null : clock.millis() + expiry * 1000L)
                .build();
        try {
            deliveryManager.receive(session, event.packetId(), message, routingEngine::route);
        } catch (StoreException e) {
            handleStoreFault(session, e);
        }
    }

    /**
     * PUBACK / PUBREC / PUBCOMP（出站确认）和 PUBREL（入站QoS 2释放）
     */
    public void onAck(ClientConnection connection, AckEvent event) {
        ClientSession session = resolve(connection);
        if (session == null) {
            return;
        }
        try {
            if (event.type() == PacketType.PUBREL) {
                deliveryManager.release(session, event.packetId(), routingEngine::route);
            } else {
                deliveryManager.onAck(session, event);
            }
        } catch (StoreException e) {
            handleStoreFault(session, e);
        }
    }

    public void onPingReq(ClientConnection connection) {
        if (resolve(connection) != null) {
            connection.getChannel().send(PingRespPacket.INSTANCE);
        }
    }

    // ==================== 断开 ====================

    public void onDisconnect(ClientConnection connection, DisconnectEvent event) {
        terminate(connection, !event.graceful() || event.publishWill(), "disconnect");
    }

    /**
     * 传输层发现连接已断开（未收到DISCONNECT）
     */
    public void onConnectionLost(ClientConnection connection) {
        onDisconnect(connection, DisconnectEvent.transportError());
    }

    private void onKeepAliveTimeout(ClientConnection connection) {
        connection.getChannel().send(new DisconnectPacket(ReasonCode.KEEP_ALIVE_TIMEOUT));
        connection.getChannel().close(ReasonCode.KEEP_ALIVE_TIMEOUT);
        terminate(connection, true, "keepalive");
    }

    private void disconnectForViolation(ClientConnection connection, ProtocolViolationException e) {
        log.warn("协议违规，断开连接: clientId={}, reason={}, message={}", connection.getClientId(),
                e.getReasonCode(), e.getMessage());
        connection.getChannel().send(new DisconnectPacket(e.getReasonCode()));
        connection.getChannel().close(e.getReasonCode());
        terminate(connection, true, "violation");
    }

    /**
     * 投递路径上的持久化失败在会话锁内发现，放到定时器线程处理，避免在持有会话锁时再取客户端锁
     */
    private void onStoreFault(ClientSession session, StoreException cause) {
        timer.schedule(() -> handleStoreFault(session, cause), 0);
    }

    private void handleStoreFault(ClientSession session, StoreException cause) {
        log.error("会话持久化失败，断开连接: clientId={}", session.getClientId(), cause);
        ClientConnection connection = session.getConnection();
        if (connection == null) {
            return;
        }
        connection.getChannel().send(new DisconnectPacket(ReasonCode.UNSPECIFIED_ERROR));
        connection.getChannel().close(ReasonCode.UNSPECIFIED_ERROR);
        terminate(connection, true, "store_fault");
    }

    /**
     * 解绑连接并结束本次连接上的会话生命周期
     *
     * @param connection 要结束的连接
     * @param abnormal   异常断开时发布遗嘱
     * @param cause      日志用原因
     */
    private void terminate(ClientConnection connection, boolean abnormal, String cause) {
        keepAliveMonitor.unregister(connection);
        String clientId = connection.getClientId();
        Lock lock = sessionStore.clientLock(clientId);
        lock.lock();
        try {
            ClientSession session = sessionStore.get(clientId).orElse(null);
            if (session == null || !session.isBoundTo(connection.getConnectionId())) {
                log.debug("忽略已失效连接的断开: clientId={}, connectionId={}", clientId,
                        connection.getConnectionId());
                return;
            }
            deliveryManager.detach(session);
            unbind(session, connection);
            log.info("客户端断开: clientId={}, cause={}, abnormal={}, persistent={}", clientId, cause, abnormal,
                    session.isPersistent());
            if (abnormal) {
                willManager.fireIfArmed(session, true);
            } else {
                willManager.disarm(session);
            }
            if (!session.isPersistent()) {
                sessionStore.destroy(clientId);
                return;
            }
            try {
                sessionStore.persist(session);
            } catch (StoreException e) {
                log.error("断开时会话持久化失败: clientId={}", clientId, e);
            }
        } finally {
            lock.unlock();
        }
    }

    // ==================== 维护 ====================

    /**
     * 销毁过期会话
     *
     * @return 被销毁的客户端ID
     */
    public List<String> expireSessions() {
        return sessionStore.expireSweep(clock.millis());
    }

    /**
     * 清除过期保留消息
     */
    public int evictExpiredRetained() {
        return retainedStore.evictExpired();
    }

    private void publishWill(String clientId, WillSpec will) {
        routingEngine.route(will.toPublishMessage(clientId, clock.millis()));
        sessionStore.get(clientId).ifPresent(session -> {
            if (session.getWill() != will) {
                return;
            }
            session.setWill(null);
            try {
                sessionStore.persist(session);
            } catch (StoreException e) {
                log.error("遗嘱发布后会话持久化失败: clientId={}", clientId, e);
            }
        });
    }

    /**
     * 找到连接当前绑定的会话，旧连接返回null；同时刷新保活时间
     */
    private ClientSession resolve(ClientConnection connection) {
        ClientSession session = sessionStore.get(connection.getClientId()).orElse(null);
        if (session == null || !session.isBoundTo(connection.getConnectionId())) {
            log.debug("忽略已失效连接的数据包: clientId={}, connectionId={}", connection.getClientId(),
                    connection.getConnectionId());
            return null;
        }
        keepAliveMonitor.touch(connection);
        return session;
    }

    /**
     * 会话销毁时移除订阅和遗嘱，恢复时把订阅重新挂回主题树
     */
    private final class SessionLifecycleListener implements SessionEventListener {

        @Override
        public void onSessionRecovered(ClientSession session) {
            for (Subscription subscription : session.getSubscriptions()) {
                topicTree.subscribe(TopicFilter.parse(subscription.getTopicFilter()), subscription);
            }
        }

        @Override
        public void onSessionDestroyed(ClientSession session, ClientSession.SessionState reason) {
            for (Subscription subscription : session.getSubscriptions()) {
                topicTree.unsubscribe(TopicFilter.parse(subscription.getTopicFilter()), subscription);
            }
            deliveryManager.detach(session);
            willManager.onSessionEnded(session.getClientId());
        }
    }
}
