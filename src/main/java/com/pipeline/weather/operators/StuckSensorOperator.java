package com.pipeline.weather.operators;

import com.pipeline.weather.core.AnomalyRule;
import com.pipeline.weather.model.AnomalyType;
import com.pipeline.weather.model.ValidatedReading;

import java.util.List;

/**
 * 卡死检测算子。
 * 连续若干条读数的温度完全相同（逐位相等）时，判定传感器卡死，
 * 该段连续读数全部标记。
 *
 * 参数：
 * - runLength: 最短连续长度 (默认5)
 */
public class StuckSensorOperator implements AnomalyRule {

    public static final int DEFAULT_RUN_LENGTH = 5;

    private final int runLength;

    public StuckSensorOperator() {
        this(DEFAULT_RUN_LENGTH);
    }

    public StuckSensorOperator(int runLength) {
        if (runLength < 2) {
            throw new IllegalArgumentException("Stuck run length must be at least 2, got: " + runLength);
        }
        this.runLength = runLength;
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.STUCK;
    }

    @Override
    public boolean[] evaluate(List<ValidatedReading> sortedGroup) {
        boolean[] flags = new boolean[sortedGroup.size()];
        int runStart = 0;
        for (int i = 1; i <= sortedGroup.size(); i++) {
            boolean continues = i < sortedGroup.size()
                    && sameBits(sortedGroup.get(i).getTemperature(), sortedGroup.get(runStart).getTemperature());
            if (continues) continue;

            if (i - runStart >= runLength) {
                for (int j = runStart; j < i; j++) {
                    flags[j] = true;
                }
            }
            runStart = i;
        }
        return flags;
    }

    private boolean sameBits(double a, double b) {
        return Double.doubleToLongBits(a) == Double.doubleToLongBits(b);
    }

    public int getRunLength() { return runLength; }
}
