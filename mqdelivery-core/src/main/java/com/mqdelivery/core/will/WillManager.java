/**
 * 遗嘱管理器
 *
 * @author zhenglin
 * @date 2026/10/10
 */
package com.mqdelivery.core.will;

import com.mqdelivery.common.model.ClientSession;
import com.mqdelivery.common.model.SessionExpiry;
import com.mqdelivery.common.model.WillSpec;
import com.mqdelivery.common.util.MetricsUtils;
import com.mqdelivery.core.timer.EngineTimer;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 遗嘱消息的布设、撤销和发布
 *
 * 每个客户端最多一个已布设的遗嘱。状态 ARMED -> SCHEDULED -> FIRED 或 -> DISARMED
 * 全部通过CAS迁移，重连撤销和延迟发布竞争时只有一方成功，遗嘱最多发布一次。
 * 有效延迟为 min(遗嘱延迟, 会话过期间隔)；延迟期间会话结束则立即发布。
 */
@Slf4j
public class WillManager {

    enum WillState {
        ARMED,
        SCHEDULED,
        FIRED,
        DISARMED
    }

    private final ConcurrentHashMap<String, ArmedWill> wills = new ConcurrentHashMap<>();
    private final EngineTimer timer;
    private volatile WillPublisher publisher;

    public WillManager(EngineTimer timer) {
        this.timer = timer;
    }

    public void setPublisher(WillPublisher publisher) {
        this.publisher = publisher;
    }

    /**
     * 布设遗嘱，替换该客户端之前的遗嘱
     */
    public void arm(ClientSession session, WillSpec will) {
        ArmedWill armed = new ArmedWill(session.getClientId(), will, session.getSessionExpiryInterval());
        ArmedWill previous = wills.put(session.getClientId(), armed);
        if (previous != null) {
            previous.disarm();
        }
        log.debug("布设遗嘱: clientId={}, topic={}, delay={}s", session.getClientId(), will.getTopic(),
                will.getDelaySeconds());
    }

    /**
     * 撤销遗嘱（正常断开或重连）
     *
     * @return 是否撤销了尚未发布的遗嘱
     */
    public boolean disarm(String clientId) {
        ArmedWill armed = wills.remove(clientId);
        if (armed == null) {
            return false;
        }
        boolean disarmed = armed.disarm();
        if (disarmed) {
            log.debug("撤销遗嘱: clientId={}", clientId);
        }
        return disarmed;
    }

    public boolean disarm(ClientSession session) {
        return disarm(session.getClientId());
    }

    /**
     * 会话终止时调用
     *
     * @param session  会话
     * @param abnormal 是否异常终止，正常终止只撤销
     * @return 遗嘱是否已发布或已进入延迟
     */
    public boolean fireIfArmed(ClientSession session, boolean abnormal) {
        if (!abnormal) {
            disarm(session.getClientId());
            return false;
        }
        ArmedWill armed = wills.get(session.getClientId());
        if (armed == null) {
            return false;
        }
        long delaySeconds = effectiveDelay(armed);
        if (delaySeconds <= 0) {
            return fire(armed, WillState.ARMED);
        }
        if (!armed.state.compareAndSet(WillState.ARMED, WillState.SCHEDULED)) {
            return false;
        }
        armed.handle = timer.schedule(() -> fire(armed, WillState.SCHEDULED), delaySeconds * 1000L);
        if (armed.state.get() == WillState.DISARMED) {
            armed.handle.cancel();
        }
        log.info("遗嘱延迟发布: clientId={}, delay={}s", armed.clientId, delaySeconds);
        return true;
    }

    /**
     * 会话已结束（过期或被清理），仍在延迟中的遗嘱立即发布
     */
    public void onSessionEnded(String clientId) {
        ArmedWill armed = wills.get(clientId);
        if (armed == null) {
            return;
        }
        if (armed.state.get() == WillState.SCHEDULED) {
            if (fire(armed, WillState.SCHEDULED) && armed.handle != null) {
                armed.handle.cancel();
            }
        } else {
            wills.remove(clientId, armed);
            armed.disarm();
        }
    }

    public boolean isArmed(String clientId) {
        return wills.containsKey(clientId);
    }

    /**
     * 遗嘱是否处于延迟发布中
     */
    public boolean isScheduled(String clientId) {
        return Optional.ofNullable(wills.get(clientId))
                .map(w -> w.state.get() == WillState.SCHEDULED)
                .orElse(false);
    }

    private long effectiveDelay(ArmedWill armed) {
        long delay = armed.will.getDelaySeconds();
        if (armed.sessionExpiryInterval >= SessionExpiry.NEVER) {
            return delay;
        }
        return Math.min(delay, armed.sessionExpiryInterval);
    }

    private boolean fire(ArmedWill armed, WillState expected) {
        if (!armed.state.compareAndSet(expected, WillState.FIRED)) {
            return false;
        }
        wills.remove(armed.clientId, armed);
        WillPublisher current = publisher;
        if (current == null) {
            log.warn("未设置遗嘱发布回调，丢弃遗嘱: clientId={}", armed.clientId);
            return false;
        }
        log.info("发布遗嘱: clientId={}, topic={}", armed.clientId, armed.will.getTopic());
        MetricsUtils.recordWillFired();
        current.publish(armed.clientId, armed.will);
        return true;
    }

    private static final class ArmedWill {
        final String clientId;
        final WillSpec will;
        final long sessionExpiryInterval;
        final AtomicReference<WillState> state = new AtomicReference<>(WillState.ARMED);
        volatile EngineTimer.TimerHandle handle;

        ArmedWill(String clientId, WillSpec will, long sessionExpiryInterval) {
            this.clientId = clientId;
            this.will = will;
            this.sessionExpiryInterval = sessionExpiryInterval;
        }

        boolean disarm() {
            if (state.compareAndSet(WillState.ARMED, WillState.DISARMED)) {
                return true;
            }
            if (state.compareAndSet(WillState.SCHEDULED, WillState.DISARMED)) {
                EngineTimer.TimerHandle h = handle;
                if (h != null) {
                    h.cancel();
                }
                return true;
            }
            return false;
        }
    }
}
