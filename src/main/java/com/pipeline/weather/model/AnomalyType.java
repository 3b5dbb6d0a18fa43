package com.pipeline.weather.model;

/**
 * 异常类型。声明顺序即规则的判定优先级。
 */
public enum AnomalyType {
    /** 统计尖峰：z-score超过阈值 */
    SPIKE,
    /** 卡死：连续多条读数温度完全相同 */
    STUCK,
    /** 掉线：与前一条读数的间隔超过最大预期间隔 */
    DROPOUT
}
