package com.mqdelivery.core.delivery;

import com.mqdelivery.common.protocol.ReasonCode;

/**
 * 一次发布的路由统计
 *
 * @param matched        接收者数量（普通订阅按客户端去重，共享组各计一个）
 * @param sent           直接写入连接的数量
 * @param queued         进入会话队列的数量
 * @param dropped        丢弃数量
 * @param quotaExceeded  有接收者队列已满或保留消息存储已满
 */
public record RouteResult(int matched, int sent, int queued, int dropped, boolean quotaExceeded) {

    /**
     * 回给发布者的PUBACK原因码
     */
    public ReasonCode reasonCode() {
        if (quotaExceeded) {
            return ReasonCode.QUOTA_EXCEEDED;
        }
        if (matched == 0) {
            return ReasonCode.NO_MATCHING_SUBSCRIBERS;
        }
        return ReasonCode.SUCCESS;
    }
}
