/**
 * 基于线程池的定时器
 *
 * @author zhenglin
 * @date 2026/10/09
 */
package com.mqdelivery.core.timer;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 使用守护线程的 ScheduledExecutorService 实现 {@link EngineTimer}
 */
@Slf4j
public class ScheduledEngineTimer implements EngineTimer {

    private final ScheduledExecutorService scheduler;

    public ScheduledEngineTimer(int threads) {
        AtomicInteger index = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "mqdelivery-timer-" + index.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public TimerHandle schedule(Runnable task, long delayMillis) {
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("定时任务执行失败", e);
            }
        }, Math.max(0, delayMillis), TimeUnit.MILLISECONDS);
        return new TimerHandle() {
            @Override
            public boolean cancel() {
                return future.cancel(false);
            }

            @Override
            public boolean isCancelled() {
                return future.isCancelled();
            }
        };
    }

    public void shutdown() {
        log.info("关闭引擎定时器");
        scheduler.shutdownNow();
    }
}
