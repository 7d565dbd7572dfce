/**
 * MQTT原因码
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.protocol;

/**
 * 引擎对外的结果码，数值与MQTT 5.0保持一致
 *
 * 每个原因码都归属一个类别，客户端据此区分永久性失败（不应重试）和暂时性失败（退避后重试）。
 * MQTT 3.1.1客户端只认识CONNACK返回码0-5，见 {@link #toV3ConnectReturnCode()}。
 */
public enum ReasonCode {
    SUCCESS(0x00, Category.SUCCESS),
    GRANTED_QOS_1(0x01, Category.SUCCESS),
    GRANTED_QOS_2(0x02, Category.SUCCESS),
    DISCONNECT_WITH_WILL_MESSAGE(0x04, Category.SUCCESS),
    NO_MATCHING_SUBSCRIBERS(0x10, Category.SUCCESS),
    NO_SUBSCRIPTION_EXISTED(0x11, Category.SUCCESS),

    UNSPECIFIED_ERROR(0x80, Category.UNSPECIFIED),
    MALFORMED_PACKET(0x81, Category.MALFORMED),
    PROTOCOL_ERROR(0x82, Category.MALFORMED),
    IMPLEMENTATION_SPECIFIC_ERROR(0x83, Category.UNSPECIFIED),
    UNSUPPORTED_PROTOCOL_VERSION(0x84, Category.MALFORMED),
    CLIENT_IDENTIFIER_NOT_VALID(0x85, Category.MALFORMED),
    BAD_USER_NAME_OR_PASSWORD(0x86, Category.NOT_AUTHORIZED),
    NOT_AUTHORIZED(0x87, Category.NOT_AUTHORIZED),
    SERVER_UNAVAILABLE(0x88, Category.UNSPECIFIED),
    SERVER_BUSY(0x89, Category.QUOTA),
    KEEP_ALIVE_TIMEOUT(0x8D, Category.UNSPECIFIED),
    SESSION_TAKEN_OVER(0x8E, Category.UNSPECIFIED),
    TOPIC_FILTER_INVALID(0x8F, Category.MALFORMED),
    TOPIC_NAME_INVALID(0x90, Category.MALFORMED),
    PACKET_IDENTIFIER_IN_USE(0x91, Category.QUOTA),
    PACKET_IDENTIFIER_NOT_FOUND(0x92, Category.UNSPECIFIED),
    RECEIVE_MAXIMUM_EXCEEDED(0x93, Category.QUOTA),
    QUOTA_EXCEEDED(0x97, Category.QUOTA);

    /**
     * 原因码类别
     */
    public enum Category {
        SUCCESS,
        MALFORMED,
        QUOTA,
        NOT_AUTHORIZED,
        UNSPECIFIED
    }

    private final int value;
    private final Category category;

    ReasonCode(int value, Category category) {
        this.value = value;
        this.category = category;
    }

    public int getValue() {
        return value;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isSuccess() {
        return value < 0x80;
    }

    /**
     * 永久性失败：同样的请求重发仍会失败
     */
    public boolean isPermanent() {
        return category == Category.MALFORMED || category == Category.NOT_AUTHORIZED;
    }

    /**
     * SUBACK中授予的QoS对应的原因码
     */
    public static ReasonCode granted(MqttQos qos) {
        switch (qos) {
            case AT_LEAST_ONCE:
                return GRANTED_QOS_1;
            case EXACTLY_ONCE:
                return GRANTED_QOS_2;
            default:
                return SUCCESS;
        }
    }

    public static ReasonCode fromValue(int value) {
        for (ReasonCode code : values()) {
            if (code.value == value) {
                return code;
            }
        }
        throw new IllegalArgumentException("Unknown reason code: " + value);
    }

    /**
     * 映射为MQTT 3.1.1 CONNACK返回码
     * 0 接受，1 协议版本不支持，2 标识符被拒绝，3 服务不可用，4 用户名或密码错误，5 未授权
     *
     * @return 3.1.1返回码
     */
    public int toV3ConnectReturnCode() {
        switch (this) {
            case SUCCESS:
                return 0;
            case UNSUPPORTED_PROTOCOL_VERSION:
                return 1;
            case CLIENT_IDENTIFIER_NOT_VALID:
                return 2;
            case BAD_USER_NAME_OR_PASSWORD:
                return 4;
            case NOT_AUTHORIZED:
                return 5;
            default:
                return 3;
        }
    }
}
