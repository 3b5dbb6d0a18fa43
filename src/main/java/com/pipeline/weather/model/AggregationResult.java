package com.pipeline.weather.model;

import java.util.Collections;
import java.util.List;

/**
 * 聚合计算结果：成功计算的桶和被跳过的桶数量
 */
public class AggregationResult {
    private final List<HourlyAggregate> aggregates;
    private final int failedBuckets;

    public AggregationResult(List<HourlyAggregate> aggregates, int failedBuckets) {
        this.aggregates = Collections.unmodifiableList(aggregates);
        this.failedBuckets = failedBuckets;
    }

    public List<HourlyAggregate> getAggregates() { return aggregates; }
    public int getFailedBuckets() { return failedBuckets; }
}
