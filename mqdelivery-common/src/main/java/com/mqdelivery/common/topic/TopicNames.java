/**
 * 主题名工具类
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.topic;

import com.mqdelivery.common.exception.ProtocolViolationException;
import com.mqdelivery.common.protocol.ReasonCode;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * 主题名的拆分与校验
 */
@UtilityClass
public class TopicNames {

    public static final char LEVEL_SEPARATOR = '/';
    public static final String SINGLE_LEVEL_WILDCARD = "+";
    public static final String MULTI_LEVEL_WILDCARD = "#";
    public static final String RESERVED_PREFIX = "$";

    /**
     * 按 '/' 拆分层级，空层级保留为空字符串
     *
     * @param topic 主题名或过滤器
     * @return 层级列表
     */
    public static List<String> split(String topic) {
        List<String> levels = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < topic.length(); i++) {
            if (topic.charAt(i) == LEVEL_SEPARATOR) {
                levels.add(topic.substring(start, i));
                start = i + 1;
            }
        }
        levels.add(topic.substring(start));
        return levels;
    }

    /**
     * 是否为保留主题（以$开头，如$SYS、$share）
     */
    public static boolean isReserved(String topic) {
        return topic != null && topic.startsWith(RESERVED_PREFIX);
    }

    /**
     * 校验PUBLISH或遗嘱使用的主题名
     *
     * @param topic 主题名
     * @throws ProtocolViolationException 主题为空、包含通配符或写入保留主题
     */
    public static void validateForPublish(String topic) {
        if (topic == null || topic.isEmpty()) {
            throw new ProtocolViolationException(ReasonCode.TOPIC_NAME_INVALID, "Topic name must not be empty");
        }
        if (topic.indexOf('+') >= 0 || topic.indexOf('#') >= 0) {
            throw new ProtocolViolationException(ReasonCode.TOPIC_NAME_INVALID,
                    "Topic name must not contain wildcards: " + topic);
        }
        if (topic.indexOf('\u0000') >= 0) {
            throw new ProtocolViolationException(ReasonCode.TOPIC_NAME_INVALID,
                    "Topic name must not contain NUL: " + topic);
        }
        if (isReserved(topic)) {
            throw new ProtocolViolationException(ReasonCode.TOPIC_NAME_INVALID,
                    "Clients must not publish to reserved topic: " + topic);
        }
    }
}
