package com.pipeline.weather.core;

import com.pipeline.weather.model.CycleState;

/**
 * 调度器状态转换监听器
 */
@FunctionalInterface
public interface CycleStateListener {

    void onTransition(CycleState from, CycleState to);
}
