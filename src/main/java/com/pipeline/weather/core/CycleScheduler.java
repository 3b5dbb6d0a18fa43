package com.pipeline.weather.core;

import com.pipeline.weather.model.CycleState;
import com.pipeline.weather.model.CycleSummary;

/**
 * 周期调度器接口 —— ETL核心的生命周期管理者。
 *
 * 状态机：
 * <pre>
 * IDLE → EXTRACTING → TRANSFORMING → LOADING → SLEEPING → EXTRACTING ...
 *                 \______________\____________\→ ABORTING → SLEEPING
 * </pre>
 * 每个固定周期（起点到起点）执行一次；上一周期超时则立即开始下一周期，
 * 不补偿错过的周期。单个周期失败不会终止调度，连续失败时按指数退避延长等待。
 */
public interface CycleScheduler {

    /**
     * 启动后台调度线程，立即执行第一个周期
     *
     * @throws IllegalStateException 已经在运行时抛出
     */
    void start();

    /**
     * 停止调度，等待当前周期结束后释放资源
     */
    void shutdown();

    /**
     * 同步执行恰好一个周期并等待其结束，供测试和单次运行模式使用。
     * 调度循环运行期间不允许调用。
     *
     * @return 周期摘要；周期中止时摘要的 aborted 为true
     */
    CycleSummary runOnce();

    /**
     * @return 当前状态
     */
    CycleState getState();

    /**
     * 注册状态转换监听器
     */
    void addStateListener(CycleStateListener listener);
}
