/**
 * 主题过滤器
 *
 * @author zhenglin
 * @date 2026/10/08
 */
package com.mqdelivery.common.topic;

import com.mqdelivery.common.exception.ProtocolViolationException;
import com.mqdelivery.common.protocol.ReasonCode;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 解析后的主题过滤器
 *
 * 支持 + 单层通配、# 多层通配（只能位于末尾）以及 $share/{group}/{filter} 共享订阅形式。
 * 实例不可变，解析一次后在主题树和保留消息扫描中复用。
 */
public final class TopicFilter {

    private static final String SHARE_PREFIX = "$share/";

    private final String raw;
    private final String shareGroup;
    private final String filter;
    private final List<String> levels;

    private TopicFilter(String raw, String shareGroup, String filter, List<String> levels) {
        this.raw = raw;
        this.shareGroup = shareGroup;
        this.filter = filter;
        this.levels = levels;
    }

    /**
     * 解析并校验过滤器
     *
     * @param raw 客户端提交的过滤器文本
     * @return 过滤器
     * @throws ProtocolViolationException 过滤器非法（TOPIC_FILTER_INVALID）
     */
    public static TopicFilter parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw invalid(raw, "empty filter");
        }
        String group = null;
        String inner = raw;
        if (raw.startsWith(SHARE_PREFIX)) {
            int slash = raw.indexOf(TopicNames.LEVEL_SEPARATOR, SHARE_PREFIX.length());
            if (slash < 0) {
                throw invalid(raw, "shared subscription without filter");
            }
            group = raw.substring(SHARE_PREFIX.length(), slash);
            inner = raw.substring(slash + 1);
            if (group.isEmpty() || group.contains("+") || group.contains("#")) {
                throw invalid(raw, "bad share group");
            }
            if (inner.isEmpty()) {
                throw invalid(raw, "shared subscription without filter");
            }
        }
        List<String> levels = TopicNames.split(inner);
        for (int i = 0; i < levels.size(); i++) {
            String level = levels.get(i);
            if (level.indexOf('\u0000') >= 0) {
                throw invalid(raw, "NUL character");
            }
            if (level.contains(TopicNames.MULTI_LEVEL_WILDCARD)) {
                if (!level.equals(TopicNames.MULTI_LEVEL_WILDCARD) || i != levels.size() - 1) {
                    throw invalid(raw, "'#' must occupy the last level alone");
                }
            } else if (level.contains(TopicNames.SINGLE_LEVEL_WILDCARD)
                    && !level.equals(TopicNames.SINGLE_LEVEL_WILDCARD)) {
                throw invalid(raw, "'+' must occupy a whole level");
            }
        }
        return new TopicFilter(raw, group, inner, Collections.unmodifiableList(levels));
    }

    private static ProtocolViolationException invalid(String raw, String reason) {
        return new ProtocolViolationException(ReasonCode.TOPIC_FILTER_INVALID,
                "Invalid topic filter '" + raw + "': " + reason);
    }

    /**
     * 客户端提交的原始文本，作为会话内订阅的键
     */
    public String getRaw() {
        return raw;
    }

    /**
     * 共享组名，非共享订阅返回null
     */
    public String getShareGroup() {
        return shareGroup;
    }

    /**
     * 去掉 $share/{group}/ 前缀后的过滤器
     */
    public String getFilter() {
        return filter;
    }

    public List<String> getLevels() {
        return levels;
    }

    public boolean isShared() {
        return shareGroup != null;
    }

    public boolean hasWildcard() {
        return levels.contains(TopicNames.SINGLE_LEVEL_WILDCARD) || levels.contains(TopicNames.MULTI_LEVEL_WILDCARD);
    }

    /**
     * 判断主题名是否被本过滤器匹配
     * 根层级的通配符不匹配以$开头的主题
     *
     * @param topic 主题名
     * @return 是否匹配
     */
    public boolean matches(String topic) {
        List<String> topicLevels = TopicNames.split(topic);
        if (TopicNames.isReserved(topic)) {
            String first = levels.get(0);
            if (first.equals(TopicNames.SINGLE_LEVEL_WILDCARD) || first.equals(TopicNames.MULTI_LEVEL_WILDCARD)) {
                return false;
            }
        }
        int i = 0;
        for (; i < levels.size(); i++) {
            String level = levels.get(i);
            if (level.equals(TopicNames.MULTI_LEVEL_WILDCARD)) {
                return true;
            }
            if (i >= topicLevels.size()) {
                return false;
            }
            if (!level.equals(TopicNames.SINGLE_LEVEL_WILDCARD) && !level.equals(topicLevels.get(i))) {
                return false;
            }
        }
        return i == topicLevels.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TopicFilter)) {
            return false;
        }
        return raw.equals(((TopicFilter) o).raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(raw);
    }

    @Override
    public String toString() {
        return raw;
    }
}
