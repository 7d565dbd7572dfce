/**
 * 引擎维护任务
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.mqdelivery.core.config;

import com.mqdelivery.core.delivery.MqttDeliveryEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 定期清理过期会话和过期保留消息
 */
@Slf4j
@Component
public class EngineMaintenanceTask {

    private final MqttDeliveryEngine engine;

    public EngineMaintenanceTask(MqttDeliveryEngine engine) {
        this.engine = engine;
    }

    @Scheduled(fixedDelayString = "${mqdelivery.engine.maintenance-interval-ms:1000}")
    public void runMaintenance() {
        try {
            List<String> expired = engine.expireSessions();
            int evicted = engine.evictExpiredRetained();
            if (!expired.isEmpty() || evicted > 0) {
                log.debug("维护任务完成: expiredSessions={}, evictedRetained={}", expired.size(), evicted);
            }
        } catch (RuntimeException e) {
            log.error("维护任务执行失败", e);
        }
    }
}
