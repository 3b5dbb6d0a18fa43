package com.pipeline.weather.model;

/**
 * 原始读数被校验器拒绝的原因
 */
public enum RejectionReason {
    /** 整条记录无法解析（JSON/CSV格式错误） */
    MALFORMED_RECORD,
    /** 时间戳无法解析或晚于当前时间 */
    MALFORMED_TIMESTAMP,
    /** 数值字段无法转换为有限浮点数 */
    MALFORMED_VALUE,
    /** 必填字段缺失 */
    MISSING_FIELD,
    /** 数值超出物理量程 */
    OUT_OF_RANGE_VALUE
}
