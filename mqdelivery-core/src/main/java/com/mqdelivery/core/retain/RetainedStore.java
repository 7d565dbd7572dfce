/**
 * 保留消息存储接口
 *
 * @author zhenglin
 * @date 2026/10/09
 */
package com.mqdelivery.core.retain;

import com.mqdelivery.common.model.PublishMessage;
import com.mqdelivery.common.model.RetainedEntry;
import com.mqdelivery.common.protocol.MqttQos;
import com.mqdelivery.common.topic.TopicFilter;

import java.util.List;
import java.util.Optional;

/**
 * 每个主题保存最近一条保留消息
 * set/get 对同一主题是线性一致的：保留发布之后新建的匹配订阅一定读到新值
 */
public interface RetainedStore {

    /**
     * 保存保留消息，负载为空时删除
     *
     * @throws com.mqdelivery.common.exception.QuotaExceededException 新增主题超出保留消息上限
     */
    void set(String topic, byte[] payload, MqttQos qos);

    /**
     * 保存带发布者和过期时间的保留消息，负载为空时删除
     */
    void set(PublishMessage message);

    Optional<RetainedEntry> get(String topic);

    /**
     * 查找与过滤器匹配的全部保留消息，新订阅建立时使用
     */
    List<RetainedEntry> scan(TopicFilter filter);

    /**
     * 清除已过期的保留消息
     *
     * @return 清除数量
     */
    int evictExpired();

    int size();

    /**
     * 从持久化后端加载
     */
    void recover();
}
