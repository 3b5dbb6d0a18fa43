package com.pipeline.weather.core;

import com.pipeline.weather.model.CycleState;
import com.pipeline.weather.model.CycleSummary;

import java.util.function.Consumer;

/**
 * 周期执行器接口 —— 驱动一次完整的 抽取 → 转换 → 装载。
 *
 * 各阶段顺序执行，每个阶段消费上一阶段的全部输出。
 * 数据质量问题在阶段内部消化并计数；只有基础设施不可用时才向外抛出，
 * 此时执行器已将数据源回退到上次提交的位置。
 */
public interface CycleExecutor extends AutoCloseable {

    /**
     * 执行一个周期
     *
     * @param cycleNumber   周期序号，从1开始
     * @param phaseCallback 阶段切换回调，依次收到 EXTRACTING、TRANSFORMING、LOADING
     * @return 周期摘要
     * @throws WarehouseUnavailableException 仓库不可用
     * @throws CycleInterruptedException     执行线程被中断（软超时）
     */
    CycleSummary runCycle(long cycleNumber, Consumer<CycleState> phaseCallback);

    /**
     * 释放数据源等资源
     */
    @Override
    void close();
}
