/**
 * 引擎定时器
 *
 * @author zhenglin
 * @date 2026/10/09
 */
package com.mqdelivery.core.timer;

/**
 * 重传、保活和遗嘱延迟共用的定时器抽象，每个任务都可以单独取消
 */
public interface EngineTimer {

    /**
     * 延迟执行任务
     *
     * @param task        任务
     * @param delayMillis 延迟（毫秒）
     * @return 可取消的句柄
     */
    TimerHandle schedule(Runnable task, long delayMillis);

    /**
     * 定时任务句柄
     */
    interface TimerHandle {

        /**
         * 取消任务，已执行或已取消时返回false
         */
        boolean cancel();

        boolean isCancelled();
    }
}
