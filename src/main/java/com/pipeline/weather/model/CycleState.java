package com.pipeline.weather.model;

/**
 * ETL周期调度器状态
 */
public enum CycleState {
    /** 进程启动后、首个周期开始前 */
    IDLE,
    /** 从各数据源抽取原始读数 */
    EXTRACTING,
    /** 校验、去重、异常检测 */
    TRANSFORMING,
    /** 写入事实表并重算小时聚合 */
    LOADING,
    /** 等待下一个周期 */
    SLEEPING,
    /** 本周期遇到不可恢复错误，放弃剩余工作 */
    ABORTING
}
