/**
 * 主题订阅树
 *
 * @author zhenglin
 * @date 2026/10/09
 */
package com.mqdelivery.core.topic;

import com.mqdelivery.common.model.Subscription;
import com.mqdelivery.common.topic.TopicFilter;
import com.mqdelivery.common.topic.TopicNames;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 按层级索引的订阅树
 *
 * 每个节点有一个字面量子节点表和两个保留槽位（+ 和 #）。匹配沿发布主题逐层深度优先，
 * 复杂度与订阅总数无关。查询不加锁；订阅/退订只锁过滤器路径上的节点，
 * 嵌套加锁总是先父后子，空节点在退订时剪除。
 * 节点内订阅按（客户端ID，共享组）区分，同一会话可以同时持有同一过滤器的普通订阅和多个共享订阅。
 */
@Slf4j
public class TopicTree {

    private final Node root = new Node(null, null);
    private final AtomicInteger subscriptionCount = new AtomicInteger();

    /**
     * 添加或替换订阅
     *
     * @param filter       解析后的过滤器
     * @param subscription 订阅
     */
    public void subscribe(TopicFilter filter, Subscription subscription) {
        SubscriptionKey key = new SubscriptionKey(subscription.getClientId(), filter.getShareGroup());
        while (true) {
            Node node = root;
            for (String level : filter.getLevels()) {
                node = node.childForInsert(level);
                if (node == null) {
                    break;
                }
            }
            if (node == null) {
                // 路径上的节点刚被剪除，重新走一遍
                continue;
            }
            synchronized (node) {
                if (node.removed) {
                    continue;
                }
                if (node.subscriptions.put(key, subscription) == null) {
                    subscriptionCount.incrementAndGet();
                }
                log.debug("添加订阅: filter={}, clientId={}", filter, subscription.getClientId());
                return;
            }
        }
    }

    /**
     * 移除订阅
     *
     * @param filter       解析后的过滤器
     * @param subscription 要移除的订阅，按客户端ID和共享组定位
     * @return 是否确实移除了订阅
     */
    public boolean unsubscribe(TopicFilter filter, Subscription subscription) {
        SubscriptionKey key = new SubscriptionKey(subscription.getClientId(), filter.getShareGroup());
        Node node = root;
        for (String level : filter.getLevels()) {
            node = node.child(level);
            if (node == null) {
                return false;
            }
        }
        boolean removed;
        synchronized (node) {
            removed = node.subscriptions.remove(key) != null;
        }
        if (removed) {
            subscriptionCount.decrementAndGet();
            prune(node);
            log.debug("移除订阅: filter={}, clientId={}", filter, subscription.getClientId());
        }
        return removed;
    }

    /**
     * 查找与主题名匹配的全部订阅
     *
     * @param topic 发布主题名
     * @return 匹配的订阅，同一客户端可能出现多次
     */
    public List<Subscription> match(String topic) {
        List<String> levels = TopicNames.split(topic);
        List<Subscription> result = new ArrayList<>();
        collect(root, levels, 0, TopicNames.isReserved(topic), result);
        return result;
    }

    public int size() {
        return subscriptionCount.get();
    }

    private void collect(Node node, List<String> levels, int depth, boolean reserved, List<Subscription> out) {
        if (depth == levels.size()) {
            out.addAll(node.subscriptions.values());
            // a/# 同样匹配 a
            Node hash = node.hash;
            if (hash != null) {
                out.addAll(hash.subscriptions.values());
            }
            return;
        }
        boolean wildcardAllowed = depth > 0 || !reserved;
        if (wildcardAllowed) {
            Node hash = node.hash;
            if (hash != null) {
                out.addAll(hash.subscriptions.values());
            }
        }
        Node literal = node.literals.get(levels.get(depth));
        if (literal != null) {
            collect(literal, levels, depth + 1, reserved, out);
        }
        if (wildcardAllowed) {
            Node plus = node.plus;
            if (plus != null) {
                collect(plus, levels, depth + 1, reserved, out);
            }
        }
    }

    private void prune(Node node) {
        Node current = node;
        while (current.parent != null) {
            Node parent = current.parent;
            synchronized (parent) {
                synchronized (current) {
                    if (current.removed || !current.isEmpty()) {
                        return;
                    }
                    current.removed = true;
                    parent.detach(current);
                }
            }
            current = parent;
        }
    }

    private record SubscriptionKey(String clientId, String shareGroup) {
    }

    /**
     * 树节点：字面量子节点表加 + / # 两个保留槽位
     */
    private static final class Node {
        final Node parent;
        final String level;
        final Map<String, Node> literals = new ConcurrentHashMap<>();
        final Map<SubscriptionKey, Subscription> subscriptions = new ConcurrentHashMap<>();
        volatile Node plus;
        volatile Node hash;
        /**
         * 已从父节点摘除，受节点监视器保护
         */
        boolean removed;

        Node(Node parent, String level) {
            this.parent = parent;
            this.level = level;
        }

        Node child(String level) {
            if (TopicNames.SINGLE_LEVEL_WILDCARD.equals(level)) {
                return plus;
            }
            if (TopicNames.MULTI_LEVEL_WILDCARD.equals(level)) {
                return hash;
            }
            return literals.get(level);
        }

        /**
         * 取得或创建子节点，本节点已被剪除时返回null
         */
        synchronized Node childForInsert(String level) {
            if (removed) {
                return null;
            }
            Node existing = child(level);
            if (existing != null) {
                return existing;
            }
            Node created = new Node(this, level);
            if (TopicNames.SINGLE_LEVEL_WILDCARD.equals(level)) {
                plus = created;
            } else if (TopicNames.MULTI_LEVEL_WILDCARD.equals(level)) {
                hash = created;
            } else {
                literals.put(level, created);
            }
            return created;
        }

        void detach(Node child) {
            if (plus == child) {
                plus = null;
            } else if (hash == child) {
                hash = null;
            } else {
                literals.remove(child.level, child);
            }
        }

        boolean isEmpty() {
            return subscriptions.isEmpty() && literals.isEmpty() && plus == null && hash == null;
        }
    }
}
