package com.pipeline.weather.core;

import com.pipeline.weather.model.AnnotatedReading;
import com.pipeline.weather.model.ValidatedReading;

import java.util.List;

/**
 * 异常检测器接口。
 *
 * 将本周期去重后的读数按传感器分组、组内按时间排序，
 * 依次应用各条 {@link AnomalyRule}，为每条读数给出唯一的异常标注。
 */
public interface AnomalyDetector {

    /**
     * @param readings 去重后的读数，顺序任意
     * @return 带标注的读数，按传感器分组、组内时间升序
     */
    List<AnnotatedReading> detect(List<ValidatedReading> readings);
}
