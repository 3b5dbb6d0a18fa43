package com.pipeline.weather.model;

import java.io.Serializable;

/**
 * 带异常标注的读数，事实装载器和聚合器的输入
 */
public class AnnotatedReading implements Serializable {
    private final ValidatedReading reading;
    private final AnomalyAnnotation annotation;

    public AnnotatedReading(ValidatedReading reading, AnomalyAnnotation annotation) {
        this.reading = reading;
        this.annotation = annotation;
    }

    public ValidatedReading getReading() { return reading; }
    public AnomalyAnnotation getAnnotation() { return annotation; }

    /**
     * 事实行使用的状态码：异常读数取异常类型，否则沿用读数自带的状态
     */
    public String effectiveStatusCode() {
        return annotation.isAnomaly() ? annotation.getType().name() : reading.getStatusCode();
    }

    @Override
    public String toString() {
        return "AnnotatedReading{" + reading + ", " + annotation + "}";
    }
}
