package com.mqdelivery.core.will;

import com.mqdelivery.common.model.WillSpec;

/**
 * 遗嘱发布回调，遗嘱消息通过它进入正常发布路径
 */
@FunctionalInterface
public interface WillPublisher {

    void publish(String clientId, WillSpec will);
}
