/**
 * 引擎配置类
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.mqdelivery.core.config;

import com.mqdelivery.common.model.Subscription;
import com.mqdelivery.common.store.RetainedPersistence;
import com.mqdelivery.common.store.SessionPersistence;
import com.mqdelivery.common.util.MetricsUtils;
import com.mqdelivery.core.delivery.MessageRoutingEngine;
import com.mqdelivery.core.delivery.MqttDeliveryEngine;
import com.mqdelivery.core.delivery.QoSDeliveryManager;
import com.mqdelivery.core.keepalive.KeepAliveMonitor;
import com.mqdelivery.core.retain.RetainedMessageStore;
import com.mqdelivery.core.retain.RetainedStore;
import com.mqdelivery.core.session.DefaultSessionStore;
import com.mqdelivery.core.session.SessionStore;
import com.mqdelivery.core.shared.LoadBalancer;
import com.mqdelivery.core.shared.RoundRobinLoadBalancer;
import com.mqdelivery.core.shared.SharedSubscriptionBalancer;
import com.mqdelivery.core.store.InMemoryRetainedPersistence;
import com.mqdelivery.core.store.InMemorySessionPersistence;
import com.mqdelivery.core.timer.EngineTimer;
import com.mqdelivery.core.timer.ScheduledEngineTimer;
import com.mqdelivery.core.topic.TopicTree;
import com.mqdelivery.core.will.WillManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * 交付引擎Bean配置
 * 所有组件都是普通对象，这里只负责按依赖顺序组装
 */
@Slf4j
@Configuration
@EnableScheduling
public class EngineConfiguration {

    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }

    /**
     * 进程内度量注册表，同时交给MetricsUtils，存储创建仪表盘之前完成
     */
    @Bean
    public MeterRegistry engineMeterRegistry() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MetricsUtils.setMeterRegistry(registry);
        log.info("创建度量注册表Bean: {}", registry.getClass().getSimpleName());
        return registry;
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledEngineTimer engineTimer(EngineProperties properties) {
        log.info("创建引擎定时器Bean: threads={}", properties.getTimerThreads());
        return new ScheduledEngineTimer(properties.getTimerThreads());
    }

    @Bean
    @ConditionalOnProperty(name = "mqdelivery.storage.type", havingValue = "memory", matchIfMissing = true)
    public SessionPersistence inMemorySessionPersistence() {
        log.info("创建内存会话持久化Bean");
        return new InMemorySessionPersistence();
    }

    @Bean
    @ConditionalOnProperty(name = "mqdelivery.storage.type", havingValue = "memory", matchIfMissing = true)
    public RetainedPersistence inMemoryRetainedPersistence() {
        log.info("创建内存保留消息持久化Bean");
        return new InMemoryRetainedPersistence();
    }

    @Bean
    public TopicTree topicTree() {
        log.info("创建主题树Bean");
        return new TopicTree();
    }

    @Bean
    @DependsOn("engineMeterRegistry")
    public RetainedStore retainedStore(RetainedPersistence persistence, Clock clock, EngineProperties properties) {
        log.info("创建保留消息存储Bean: max={}", properties.getMaxRetainedMessages());
        return new RetainedMessageStore(persistence, clock, properties.getMaxRetainedMessages());
    }

    @Bean
    @DependsOn("engineMeterRegistry")
    public SessionStore sessionStore(SessionPersistence persistence, Clock clock) {
        log.info("创建会话存储Bean");
        return new DefaultSessionStore(persistence, clock);
    }

    @Bean
    public SharedSubscriptionBalancer sharedSubscriptionBalancer(SessionStore sessionStore) {
        log.info("创建共享订阅均衡器Bean");
        LoadBalancer<Subscription> loadBalancer = new RoundRobinLoadBalancer<>();
        return new SharedSubscriptionBalancer(loadBalancer, sessionStore);
    }

    @Bean
    public QoSDeliveryManager qosDeliveryManager(SessionStore sessionStore, EngineProperties properties,
                                                 EngineTimer timer, Clock clock) {
        log.info("创建QoS交付管理器Bean: retransmitInterval={}ms", properties.getRetransmitIntervalMs());
        return new QoSDeliveryManager(sessionStore, properties, timer, clock);
    }

    @Bean
    public WillManager willManager(EngineTimer timer) {
        log.info("创建遗嘱管理器Bean");
        return new WillManager(timer);
    }

    @Bean
    public KeepAliveMonitor keepAliveMonitor(EngineTimer timer, Clock clock, EngineProperties properties) {
        log.info("创建保活监控Bean: multiplier={}", properties.getKeepAliveMultiplier());
        return new KeepAliveMonitor(timer, clock, properties.getKeepAliveMultiplier());
    }

    @Bean
    public MessageRoutingEngine messageRoutingEngine(TopicTree topicTree, RetainedStore retainedStore,
                                                     SharedSubscriptionBalancer sharedBalancer,
                                                     QoSDeliveryManager deliveryManager,
                                                     SessionStore sessionStore) {
        log.info("创建消息路由引擎Bean");
        return new MessageRoutingEngine(topicTree, retainedStore, sharedBalancer, deliveryManager, sessionStore);
    }

    @Bean(initMethod = "start")
    public MqttDeliveryEngine mqttDeliveryEngine(SessionStore sessionStore, TopicTree topicTree,
                                                 RetainedStore retainedStore, MessageRoutingEngine routingEngine,
                                                 QoSDeliveryManager deliveryManager, WillManager willManager,
                                                 KeepAliveMonitor keepAliveMonitor, EngineTimer timer,
                                                 EngineProperties properties, Clock clock) {
        log.info("创建交付引擎Bean");
        return new MqttDeliveryEngine(sessionStore, topicTree, retainedStore, routingEngine, deliveryManager,
                willManager, keepAliveMonitor, timer, properties, clock);
    }
}
