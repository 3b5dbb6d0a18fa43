package com.pipeline.weather.core;

import com.pipeline.weather.model.DimensionKind;

/**
 * 维度解析失败：必填属性缺失或自然键非法。只影响当前读数。
 */
public class DimensionResolutionException extends RuntimeException {

    private final DimensionKind kind;

    public DimensionResolutionException(DimensionKind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }

    public DimensionKind getKind() {
        return kind;
    }
}
