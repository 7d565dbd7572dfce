/**
 * MQTT交付引擎启动类
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.mqdelivery.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 交付引擎应用
 * 组装引擎对象图，传输层通过 {@link com.mqdelivery.core.delivery.MqttDeliveryEngine} 接入
 */
@Slf4j
@SpringBootApplication(scanBasePackages = "com.mqdelivery")
public class MqttDeliveryApplication {

    public static void main(String[] args) {
        try {
            log.info("启动MQTT交付引擎...");
            log.info("Java版本: {}", System.getProperty("java.version"));

            SpringApplication app = new SpringApplication(MqttDeliveryApplication.class);
            app.setLogStartupInfo(true);
            app.run(args);

            log.info("MQTT交付引擎启动成功!");
        } catch (Exception e) {
            log.error("MQTT交付引擎启动失败", e);
            System.exit(1);
        }
    }
}
