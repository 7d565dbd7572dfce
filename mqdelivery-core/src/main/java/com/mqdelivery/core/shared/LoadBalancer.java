package com.mqdelivery.core.shared;

import java.util.List;

/**
 * 负载均衡接口
 * 共享订阅以组键（共享组名/内层过滤器）作为key，每个共享组独立轮转
 */
public interface LoadBalancer<T> {
    /**
     * 从候选列表中选择一个目标
     *
     * @param candidates 候选列表，共享订阅按客户端ID排序传入，保证轮转顺序稳定
     * @param key        共享组键，同一组键共享一个轮转位置
     * @return 选中的目标，候选为空时返回null
     */
    T select(List<T> candidates, String key);
}
