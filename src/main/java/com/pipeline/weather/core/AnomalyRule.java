package com.pipeline.weather.core;

import com.pipeline.weather.model.AnomalyType;
import com.pipeline.weather.model.ValidatedReading;

import java.util.List;

/**
 * 异常检测规则接口 —— 异常检测器中的最小执行单元。
 *
 * 每条规则针对一种异常类型，对单个传感器按时间排序后的读数序列
 * 逐条给出是否命中的判定。多条规则按异常类型的声明顺序
 * （SPIKE → STUCK → DROPOUT）依次评估，先命中者决定读数的异常类型。
 *
 * 实现约定：
 * - 必须是无状态、线程安全的
 * - 对格式正确的读数永不抛出异常；样本不足时返回全false
 */
public interface AnomalyRule {

    /**
     * @return 本规则检测的异常类型
     */
    AnomalyType getType();

    /**
     * 对一个传感器的读数序列做判定
     *
     * @param sortedGroup 同一传感器的读数，按时间戳升序
     * @return 与输入等长的判定数组，true表示该读数命中本规则
     */
    boolean[] evaluate(List<ValidatedReading> sortedGroup);
}
