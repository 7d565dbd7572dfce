/**
 * QoS 交付管理器
 *
 * @author zhenglin
 * @date 2026/10/12
 */
package com.mqdelivery.core.delivery;

import com.mqdelivery.common.event.AckEvent;
import com.mqdelivery.common.exception.QuotaExceededException;
import com.mqdelivery.common.exception.StoreException;
import com.mqdelivery.common.model.ClientConnection;
import com.mqdelivery.common.model.ClientSession;
import com.mqdelivery.common.model.DeliveryState;
import com.mqdelivery.common.model.InflightMessage;
import com.mqdelivery.common.model.PublishMessage;
import com.mqdelivery.common.model.QueuedMessage;
import com.mqdelivery.common.model.Subscription;
import com.mqdelivery.common.packet.AckPacket;
import com.mqdelivery.common.packet.OutboundPacket;
import com.mqdelivery.common.packet.PublishPacket;
import com.mqdelivery.common.protocol.MqttQos;
import com.mqdelivery.common.protocol.PacketType;
import com.mqdelivery.common.protocol.ReasonCode;
import com.mqdelivery.common.util.MetricsUtils;
import com.mqdelivery.core.config.EngineProperties;
import com.mqdelivery.core.qos.InboundFlow;
import com.mqdelivery.core.qos.OutboundFlow;
import com.mqdelivery.core.qos.PacketIdAllocator;
import com.mqdelivery.core.qos.QosAction;
import com.mqdelivery.core.qos.QosEvent;
import com.mqdelivery.core.qos.Transition;
import com.mqdelivery.core.session.SessionStore;
import com.mqdelivery.core.timer.EngineTimer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * QoS 交付管理器
 * - 按接收者的有效 QoS 发送、排队或丢弃消息
 * - 驱动出站和入站状态机，处理 PUBACK/PUBREC/PUBREL/PUBCOMP
 * - 按会话定时重传未确认的 PUBLISH（带DUP）和 PUBREL
 * - 持久会话重连后先按原顺序重发飞行消息，再清空离线队列
 *
 * 同一会话的状态迁移都在会话锁内完成；出站包在锁内写入通道以保证顺序。
 */
@Slf4j
public class QoSDeliveryManager {

    private final SessionStore sessionStore;
    private final EngineProperties properties;
    private final EngineTimer timer;
    private final Clock clock;
    private final ConcurrentHashMap<String, RetransmitTask> retransmitTasks = new ConcurrentHashMap<>();
    private volatile StoreFaultHandler storeFaultHandler =
            (session, cause) -> log.error("会话持久化失败: clientId={}", session.getClientId(), cause);

    public QoSDeliveryManager(SessionStore sessionStore, EngineProperties properties, EngineTimer timer, Clock clock) {
        this.sessionStore = sessionStore;
        this.properties = properties;
        this.timer = timer;
        this.clock = clock;
    }

    public void setStoreFaultHandler(StoreFaultHandler storeFaultHandler) {
        this.storeFaultHandler = storeFaultHandler;
    }

    // ==================== 出站 ====================

    /**
     * 向一个订阅者投递消息
     *
     * @param session      接收者会话
     * @param message      发布消息
     * @param subscription 命中的订阅，决定有效QoS和订阅标识符
     * @param retainFlag   发给接收者的RETAIN标志
     * @return 投递结果
     */
    public DeliveryOutcome deliver(ClientSession session, PublishMessage message, Subscription subscription,
                                   boolean retainFlag) {
        long now = clock.millis();
        if (message.isExpired(now)) {
            MetricsUtils.recordDroppedMessage("expired");
            return DeliveryOutcome.DROPPED;
        }
        QueuedMessage queued = QueuedMessage.builder()
                .topic(message.getTopic())
                .payload(message.getPayload())
                .qos(subscription.getEffectiveQos(message.getQos()))
                .retain(retainFlag)
                .subscriptionIdentifier(subscription.getSubscriptionIdentifier())
                .queuedAt(now)
                .expiresAt(message.getExpiresAt())
                .build();
        DeliveryOutcome outcome;
        StoreException fault = null;
        session.lock();
        try {
            outcome = deliverLocked(session, queued, now);
        } catch (StoreException e) {
            fault = e;
            outcome = DeliveryOutcome.DROPPED;
        } finally {
            session.unlock();
        }
        if (fault != null) {
            storeFaultHandler.onStoreFault(session, fault);
        }
        return outcome;
    }

    private DeliveryOutcome deliverLocked(ClientSession session, QueuedMessage message, long now) {
        if (session.isTerminated()) {
            MetricsUtils.recordDroppedMessage("session_ended");
            return DeliveryOutcome.DROPPED;
        }
        ClientConnection connection = session.getConnection();
        if (connection == null) {
            if (!session.isPersistent()) {
                MetricsUtils.recordDroppedMessage("offline");
                return DeliveryOutcome.DROPPED;
            }
            if (message.getQos() == MqttQos.AT_MOST_ONCE && !properties.isQueueQos0WhenOffline()) {
                MetricsUtils.recordDroppedMessage("qos0_offline");
                return DeliveryOutcome.DROPPED;
            }
            return enqueue(session, message);
        }
        if (message.getQos() == MqttQos.AT_MOST_ONCE) {
            Transition transition = OutboundFlow.apply(MqttQos.AT_MOST_ONCE, null, QosEvent.SEND);
            if (transition.has(QosAction.SEND_PUBLISH)) {
                send(connection, new PublishPacket(message.getTopic(), message.getPayload(), MqttQos.AT_MOST_ONCE,
                        message.isRetain(), false, 0, message.getSubscriptionIdentifier()));
                MetricsUtils.recordDeliveredMessage();
            }
            return DeliveryOutcome.SENT;
        }
        // 队列里还有更早的消息或窗口已满时排队，保证顺序
        if (session.queueSize() > 0 || session.outboundCount() >= session.getSendQuota()) {
            return enqueue(session, message);
        }
        try {
            sendNew(session, connection, message, now);
        } catch (QuotaExceededException e) {
            log.warn("包标识符耗尽，消息排队: clientId={}", session.getClientId());
            return enqueue(session, message);
        }
        return DeliveryOutcome.SENT;
    }

    private DeliveryOutcome enqueue(ClientSession session, QueuedMessage message) {
        if (session.queueSize() >= properties.getMaxQueuedMessages()) {
            log.warn("会话队列已满，丢弃消息: clientId={}, topic={}, queueSize={}", session.getClientId(),
                    message.getTopic(), session.queueSize());
            MetricsUtils.recordDroppedMessage("queue_full");
            return DeliveryOutcome.DROPPED_QUOTA;
        }
        session.enqueue(message);
        MetricsUtils.recordQueuedMessage();
        sessionStore.persist(session);
        log.debug("消息入队: clientId={}, topic={}, qos={}", session.getClientId(), message.getTopic(),
                message.getQos());
        return DeliveryOutcome.QUEUED;
    }

    private void sendNew(ClientSession session, ClientConnection connection, QueuedMessage message, long now) {
        int packetId = PacketIdAllocator.allocate(session);
        InflightMessage entry = InflightMessage.builder()
                .packetId(packetId)
                .direction(InflightMessage.Direction.SEND)
                .topic(message.getTopic())
                .payload(message.getPayload())
                .qos(message.getQos())
                .retain(message.isRetain())
                .subscriptionIdentifier(message.getSubscriptionIdentifier())
                .expiresAt(message.getExpiresAt())
                .build();
        execute(session, connection, entry, OutboundFlow.apply(message.getQos(), null, QosEvent.SEND), now);
        MetricsUtils.recordDeliveredMessage();
    }

    /**
     * 处理订阅者发来的 PUBACK / PUBREC / PUBCOMP
     */
    public void onAck(ClientSession session, AckEvent ack) {
        session.lock();
        try {
            ClientConnection connection = session.getConnection();
            InflightMessage entry = session.getOutbound(ack.packetId());
            if (entry == null) {
                log.debug("{}对应消息未找到: clientId={}, packetId={}", ack.type(), session.getClientId(),
                        ack.packetId());
                if (ack.type() == PacketType.PUBREC && connection != null && ack.reasonCode().isSuccess()) {
                    send(connection, new AckPacket(PacketType.PUBREL, ack.packetId(),
                            ReasonCode.PACKET_IDENTIFIER_NOT_FOUND));
                }
                return;
            }
            QosEvent event;
            switch (ack.type()) {
                case PUBACK:
                    event = QosEvent.PUBACK;
                    break;
                case PUBREC:
                    event = ack.reasonCode().isSuccess() ? QosEvent.PUBREC : QosEvent.PUBREC_REJECTED;
                    break;
                case PUBCOMP:
                    event = QosEvent.PUBCOMP;
                    break;
                default:
                    throw new IllegalArgumentException("Not an outbound acknowledgement: " + ack.type());
            }
            Transition transition = OutboundFlow.apply(entry.getQos(), entry.getState(), event);
            if (transition.ignored()) {
                log.debug("忽略{}: clientId={}, packetId={}, state={}", ack.type(), session.getClientId(),
                        ack.packetId(), entry.getState());
                return;
            }
            long now = clock.millis();
            execute(session, connection, entry, transition, now);
            if (transition.has(QosAction.DISCARD) && connection != null) {
                drainQueue(session, connection, now);
            }
        } finally {
            session.unlock();
        }
    }

    /**
     * 重连后恢复投递：飞行消息按原顺序重发（PUBLISH带DUP或PUBREL），然后发送排队消息
     */
    public void resume(ClientSession session) {
        session.lock();
        try {
            ClientConnection connection = session.getConnection();
            if (connection == null) {
                return;
            }
            long now = clock.millis();
            int resent = 0;
            for (InflightMessage entry : session.outboundInOrder()) {
                Transition transition = OutboundFlow.apply(entry.getQos(), entry.getState(), QosEvent.RESUME);
                if (!transition.ignored()) {
                    execute(session, connection, entry, transition, now);
                    resent++;
                }
            }
            int queued = session.queueSize();
            drainQueue(session, connection, now);
            if (resent > 0 || queued > 0) {
                log.info("恢复会话投递: clientId={}, inflight={}, queued={}", session.getClientId(), resent, queued);
            }
        } finally {
            session.unlock();
        }
    }

    /**
     * 连接解绑时停止该会话的重传
     */
    public void detach(ClientSession session) {
        retransmitTasks.computeIfPresent(session.getClientId(), (clientId, task) -> {
            if (task.session != session) {
                return task;
            }
            task.handle.cancel();
            return null;
        });
    }

    private void drainQueue(ClientSession session, ClientConnection connection, long now) {
        QueuedMessage head;
        while ((head = session.peekQueued()) != null) {
            if (head.isExpired(now)) {
                session.pollQueued();
                MetricsUtils.recordDroppedMessage("expired");
                continue;
            }
            if (head.getQos() == MqttQos.AT_MOST_ONCE) {
                session.pollQueued();
                send(connection, new PublishPacket(head.getTopic(), head.getPayload(), MqttQos.AT_MOST_ONCE,
                        head.isRetain(), false, 0, head.getSubscriptionIdentifier()));
                MetricsUtils.recordDeliveredMessage();
                continue;
            }
            if (session.outboundCount() >= session.getSendQuota()) {
                break;
            }
            session.pollQueued();
            try {
                sendNew(session, connection, head, now);
            } catch (QuotaExceededException e) {
                log.warn("包标识符耗尽，停止发送排队消息: clientId={}", session.getClientId());
                session.requeueFirst(head);
                break;
            }
        }
    }

    // ==================== 入站 ====================

    /**
     * 处理发布者的PUBLISH
     * QoS 0/1 立即路由，QoS 1 回PUBACK；QoS 2 记录RECEIVED标记并在持久化后回PUBREC，
     * 路由推迟到PUBREL
     *
     * @param session  发布者会话
     * @param packetId 包标识符
     * @param message  发布消息
     * @param router   路由函数
     * @throws StoreException RECEIVED标记持久化失败，此时不回PUBREC
     */
    public void receive(ClientSession session, int packetId, PublishMessage message,
                        Function<PublishMessage, RouteResult> router) {
        MqttQos qos = message.getQos();
        if (qos != MqttQos.EXACTLY_ONCE) {
            Transition transition = InboundFlow.apply(qos, null, QosEvent.PUBLISH);
            RouteResult result = router.apply(message);
            if (transition.has(QosAction.SEND_PUBACK)) {
                sendToSession(session, new AckPacket(PacketType.PUBACK, packetId, result.reasonCode()));
            }
            return;
        }
        session.lock();
        try {
            InflightMessage marker = session.getInbound(packetId);
            Transition transition = InboundFlow.apply(qos, marker == null ? null : marker.getState(),
                    QosEvent.PUBLISH);
            ReasonCode reasonCode = ReasonCode.SUCCESS;
            if (transition.has(QosAction.STORE)) {
                if (session.inboundCount() >= properties.getReceiveMaximum()) {
                    log.warn("入站QoS 2超过接收上限: clientId={}, packetId={}", session.getClientId(), packetId);
                    reasonCode = ReasonCode.QUOTA_EXCEEDED;
                } else {
                    storeReceived(session, packetId, message);
                }
            } else {
                log.debug("重复的QoS 2 PUBLISH: clientId={}, packetId={}", session.getClientId(), packetId);
            }
            if (transition.has(QosAction.SEND_PUBREC)) {
                sendToSession(session, new AckPacket(PacketType.PUBREC, packetId, reasonCode));
            }
        } finally {
            session.unlock();
        }
    }

    private void storeReceived(ClientSession session, int packetId, PublishMessage message) {
        InflightMessage marker = InflightMessage.builder()
                .packetId(packetId)
                .direction(InflightMessage.Direction.RECEIVE)
                .state(DeliveryState.RECEIVED)
                .topic(message.getTopic())
                .payload(message.getPayload())
                .qos(message.getQos())
                .retain(message.isRetain())
                .publisherId(message.getPublisherId())
                .expiresAt(message.getExpiresAt())
                .lastSentAt(clock.millis())
                .build();
        session.putInbound(marker);
        try {
            sessionStore.persist(session);
        } catch (StoreException e) {
            session.removeInbound(packetId);
            throw e;
        }
    }

    /**
     * 处理发布者的PUBREL：有RECEIVED标记时路由一次并清除标记，然后回PUBCOMP
     *
     * @param session  发布者会话
     * @param packetId 包标识符
     * @param router   路由函数
     */
    public void release(ClientSession session, int packetId, Function<PublishMessage, RouteResult> router) {
        PublishMessage toRoute = null;
        InflightMessage marker;
        Transition transition;
        session.lock();
        try {
            marker = session.getInbound(packetId);
            transition = InboundFlow.apply(MqttQos.EXACTLY_ONCE, marker == null ? null : marker.getState(),
                    QosEvent.PUBREL);
            if (transition.has(QosAction.DELIVER)) {
                toRoute = PublishMessage.builder()
                        .topic(marker.getTopic())
                        .payload(marker.getPayload())
                        .qos(marker.getQos())
                        .retain(marker.isRetain())
                        .publisherId(marker.getPublisherId())
                        .expiresAt(marker.getExpiresAt())
                        .build();
            }
            if (transition.has(QosAction.DISCARD)) {
                session.removeInbound(packetId);
            }
        } finally {
            session.unlock();
        }
        if (toRoute != null) {
            try {
                router.apply(toRoute);
            } catch (RuntimeException e) {
                // 路由失败时恢复标记，客户端重发PUBREL后再次路由
                restoreMarker(session, marker);
                throw e;
            }
            sessionStore.persist(session);
        } else {
            log.debug("PUBREL对应标记不存在: clientId={}, packetId={}", session.getClientId(), packetId);
        }
        if (transition.has(QosAction.SEND_PUBCOMP)) {
            ReasonCode reasonCode = toRoute != null ? ReasonCode.SUCCESS : ReasonCode.PACKET_IDENTIFIER_NOT_FOUND;
            sendToSession(session, new AckPacket(PacketType.PUBCOMP, packetId, reasonCode));
        }
    }

    private void restoreMarker(ClientSession session, InflightMessage marker) {
        session.lock();
        try {
            if (!session.isTerminated() && session.getInbound(marker.getPacketId()) == null) {
                session.putInbound(marker);
            }
        } finally {
            session.unlock();
        }
    }

    // ==================== 状态迁移执行 ====================

    private void execute(ClientSession session, ClientConnection connection, InflightMessage entry,
                         Transition transition, long now) {
        if (transition.next() != null) {
            entry.setState(transition.next());
        }
        for (QosAction action : transition.actions()) {
            switch (action) {
                case STORE:
                    session.putOutbound(entry);
                    sessionStore.persist(session);
                    break;
                case SEND_PUBLISH:
                case SEND_PUBLISH_DUP:
                    boolean dup = action == QosAction.SEND_PUBLISH_DUP;
                    if (dup) {
                        entry.setRetryCount(entry.getRetryCount() + 1);
                        MetricsUtils.recordRetransmission();
                    }
                    if (connection != null) {
                        send(connection, new PublishPacket(entry.getTopic(), entry.getPayload(), entry.getQos(),
                                entry.isRetain(), dup, entry.getPacketId(), entry.getSubscriptionIdentifier()));
                        entry.setLastSentAt(now);
                    }
                    break;
                case SEND_PUBREL:
                    if (connection != null) {
                        send(connection, AckPacket.of(PacketType.PUBREL, entry.getPacketId()));
                        entry.setLastSentAt(now);
                    }
                    break;
                case DROP_PAYLOAD:
                    entry.dropPayload();
                    break;
                case DISCARD:
                    session.removeOutbound(entry.getPacketId());
                    sessionStore.persist(session);
                    break;
                case SCHEDULE_RETRANSMIT:
                    if (connection != null) {
                        ensureRetransmit(session);
                    }
                    break;
                case CANCEL_RETRANSMIT:
                    // 会话级重传任务在飞行表为空时自行停止
                    break;
                default:
                    throw new IllegalStateException("Unexpected outbound action: " + action);
            }
        }
    }

    // ==================== 重传 ====================

    private void ensureRetransmit(ClientSession session) {
        retransmitTasks.computeIfAbsent(session.getClientId(), clientId -> {
            RetransmitTask task = new RetransmitTask(session);
            task.handle = timer.schedule(task, properties.getRetransmitIntervalMs());
            return task;
        });
    }

    private void retransmit(RetransmitTask task) {
        ClientSession session = task.session;
        retransmitTasks.remove(session.getClientId(), task);
        StoreException fault = null;
        session.lock();
        try {
            ClientConnection connection = session.getConnection();
            if (connection == null || session.isTerminated()) {
                return;
            }
            long now = clock.millis();
            long interval = properties.getRetransmitIntervalMs();
            for (InflightMessage entry : session.outboundInOrder()) {
                if (now - entry.getLastSentAt() < interval) {
                    continue;
                }
                Transition transition = OutboundFlow.apply(entry.getQos(), entry.getState(),
                        QosEvent.RETRANSMIT_TIMEOUT);
                if (!transition.ignored()) {
                    log.debug("触发重传: clientId={}, packetId={}, state={}, retryCount={}", session.getClientId(),
                            entry.getPacketId(), entry.getState(), entry.getRetryCount());
                    execute(session, connection, entry, transition, now);
                }
            }
            if (session.outboundCount() > 0) {
                ensureRetransmit(session);
            }
        } catch (StoreException e) {
            fault = e;
        } finally {
            session.unlock();
        }
        if (fault != null) {
            storeFaultHandler.onStoreFault(session, fault);
        }
    }

    private void sendToSession(ClientSession session, OutboundPacket packet) {
        ClientConnection connection = session.getConnection();
        if (connection != null) {
            send(connection, packet);
        }
    }

    private void send(ClientConnection connection, OutboundPacket packet) {
        connection.getChannel().send(packet);
    }

    private final class RetransmitTask implements Runnable {
        final ClientSession session;
        volatile EngineTimer.TimerHandle handle;

        RetransmitTask(ClientSession session) {
            this.session = session;
        }

        @Override
        public void run() {
            retransmit(this);
        }
    }
}
