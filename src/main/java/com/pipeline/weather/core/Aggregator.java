package com.pipeline.weather.core;

import com.pipeline.weather.model.AggregationResult;
import com.pipeline.weather.model.AnnotatedReading;

import java.util.List;

/**
 * 小时聚合器接口。
 *
 * 将读数按(传感器, 地点, UTC小时)分桶，计算各物理量的均值、极值、标准差
 * 以及读数数和异常数。聚合结果是派生数据，每次整体重算后覆盖写入。
 */
public interface Aggregator {

    /**
     * @param readings 需要聚合的读数，应包含所涉及小时桶内的全部读数
     * @return 计算成功的聚合及失败桶数；单个桶失败不影响其他桶
     */
    AggregationResult aggregate(List<AnnotatedReading> readings);
}
