package com.pipeline.weather.operators;

import com.pipeline.weather.core.AnomalyRule;
import com.pipeline.weather.model.AnomalyType;
import com.pipeline.weather.model.ValidatedReading;

import java.time.Duration;
import java.util.List;

/**
 * 掉线检测算子。
 * 相邻两条读数的时间间隔超过最大期望间隔时，标记后一条读数。
 * 默认间隔为采集器标称周期(5秒)的3倍。
 */
public class DropoutDetectionOperator implements AnomalyRule {

    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(15);

    private final long maxIntervalMs;

    public DropoutDetectionOperator() {
        this(DEFAULT_MAX_INTERVAL);
    }

    public DropoutDetectionOperator(Duration maxInterval) {
        if (maxInterval.isNegative() || maxInterval.isZero()) {
            throw new IllegalArgumentException("Dropout interval must be positive, got: " + maxInterval);
        }
        this.maxIntervalMs = maxInterval.toMillis();
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.DROPOUT;
    }

    @Override
    public boolean[] evaluate(List<ValidatedReading> sortedGroup) {
        boolean[] flags = new boolean[sortedGroup.size()];
        for (int i = 1; i < sortedGroup.size(); i++) {
            long gap = sortedGroup.get(i).getEpochMillis() - sortedGroup.get(i - 1).getEpochMillis();
            if (gap > maxIntervalMs) {
                flags[i] = true;
            }
        }
        return flags;
    }

    public long getMaxIntervalMs() { return maxIntervalMs; }
}
