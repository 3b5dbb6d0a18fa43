package com.pipeline.weather.model;

import java.io.Serializable;

/**
 * 单条读数的异常标注。每条读数至多一个异常类型。
 */
public final class AnomalyAnnotation implements Serializable {

    private static final AnomalyAnnotation NONE = new AnomalyAnnotation(null);

    private final AnomalyType type;

    private AnomalyAnnotation(AnomalyType type) {
        this.type = type;
    }

    public static AnomalyAnnotation none() {
        return NONE;
    }

    public static AnomalyAnnotation of(AnomalyType type) {
        return type == null ? NONE : new AnomalyAnnotation(type);
    }

    public boolean isAnomaly() { return type != null; }

    /** @return 异常类型；正常读数返回null */
    public AnomalyType getType() { return type; }

    @Override
    public boolean equals(Object o) {
        return o instanceof AnomalyAnnotation && ((AnomalyAnnotation) o).type == type;
    }

    @Override
    public int hashCode() {
        return type == null ? 0 : type.hashCode();
    }

    @Override
    public String toString() {
        return isAnomaly() ? type.name() : "NONE";
    }
}
