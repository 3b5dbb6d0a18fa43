package com.pipeline.weather.operators;

import com.pipeline.weather.core.AnomalyRule;
import com.pipeline.weather.model.AnomalyType;
import com.pipeline.weather.model.ValidatedReading;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * 尖峰检测算子。
 * 基于传感器分组内的统计特征进行异常检测。
 * 对温度、湿度、气压分别计算组内均值和总体标准差，
 * 任一物理量偏离均值达到指定倍数标准差即判定为尖峰。
 *
 * 参数：
 * - zScoreThreshold: 标准差倍数 (默认3.0)
 */
public class SpikeDetectionOperator implements AnomalyRule {

    public static final double DEFAULT_THRESHOLD = 3.0;

    private static final List<ToDoubleFunction<ValidatedReading>> METRICS = List.of(
            ValidatedReading::getTemperature,
            ValidatedReading::getHumidity,
            ValidatedReading::getPressure);

    private final double zScoreThreshold;

    public SpikeDetectionOperator() {
        this(DEFAULT_THRESHOLD);
    }

    public SpikeDetectionOperator(double zScoreThreshold) {
        if (!(zScoreThreshold > 0)) {
            throw new IllegalArgumentException("Z-score threshold must be positive, got: " + zScoreThreshold);
        }
        this.zScoreThreshold = zScoreThreshold;
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.SPIKE;
    }

    @Override
    public boolean[] evaluate(List<ValidatedReading> sortedGroup) {
        boolean[] flags = new boolean[sortedGroup.size()];
        if (sortedGroup.size() < 2) return flags;

        for (ToDoubleFunction<ValidatedReading> metric : METRICS) {
            double[] values = new double[sortedGroup.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = metric.applyAsDouble(sortedGroup.get(i));
            }

            double mean = computeMean(values);
            double std = computeStd(values, mean);

            // 标准差为0时不做检测
            if (std == 0.0) continue;

            for (int i = 0; i < values.length; i++) {
                if (Math.abs(values[i] - mean) / std >= zScoreThreshold) {
                    flags[i] = true;
                }
            }
        }
        return flags;
    }

    private double computeMean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    private double computeStd(double[] values, double mean) {
        double sumSquares = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquares += diff * diff;
        }
        return Math.sqrt(sumSquares / values.length);
    }

    public double getZScoreThreshold() { return zScoreThreshold; }
}
