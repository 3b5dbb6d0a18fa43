package com.pipeline.weather.core;

import com.pipeline.weather.model.RawReading;
import com.pipeline.weather.model.ValidationResult;

/**
 * 记录校验器接口。
 *
 * 对单条原始读数做类型转换、必填检查和量程检查，
 * 返回校验通过的读数或拒绝原因。纯函数，无副作用；
 * 拒绝是正常结果而非异常，由调用方计数。
 */
public interface RecordValidator {

    /**
     * 校验一条原始读数
     *
     * @param raw 原始读数
     * @return 校验结果，不会为null
     */
    ValidationResult validate(RawReading raw);
}
