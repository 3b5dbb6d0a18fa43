package com.pipeline.weather.model;

import java.io.Serializable;

/**
 * 单个物理量在一个聚合桶内的统计特征
 */
public class MetricStats implements Serializable {
    private final double mean;
    private final double min;
    private final double max;
    /** 总体标准差 */
    private final double stddev;

    public MetricStats(double mean, double min, double max, double stddev) {
        this.mean = mean;
        this.min = min;
        this.max = max;
        this.stddev = stddev;
    }

    /**
     * 计算一组取值的统计特征
     *
     * @throws IllegalArgumentException 取值为空或含非有限数时抛出
     */
    public static MetricStats of(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot compute statistics of an empty bucket");
        }
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("Non-finite value in bucket: " + v);
            }
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / values.length;
        double sumSquares = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquares += diff * diff;
        }
        return new MetricStats(mean, min, max, Math.sqrt(sumSquares / values.length));
    }

    public double getMean() { return mean; }
    public double getMin() { return min; }
    public double getMax() { return max; }
    public double getStddev() { return stddev; }

    @Override
    public String toString() {
        return String.format("{mean=%.3f, min=%.3f, max=%.3f, std=%.3f}", mean, min, max, stddev);
    }
}
