package com.pipeline.weather.model;

/**
 * 星型模型中的维度类别
 */
public enum DimensionKind {
    TIME,
    SENSOR,
    LOCATION,
    STATUS
}
