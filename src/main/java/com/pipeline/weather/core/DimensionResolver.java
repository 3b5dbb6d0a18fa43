package com.pipeline.weather.core;

import com.pipeline.weather.model.AnnotatedReading;
import com.pipeline.weather.model.DimensionKeys;
import com.pipeline.weather.model.DimensionKind;

import java.util.Map;

/**
 * 维度解析器接口 —— 自然键到代理键的映射。
 *
 * 维度行在首次出现时创建（"取或建"），之后复用：
 * - TIME：自然键为ISO-8601时间戳，日历字段由时间戳推导
 * - SENSOR：自然键为传感器标识，属性先写者胜，仅激活标志可单独修改
 * - LOCATION：自然键为城市名，属性先写者胜
 * - STATUS：自然键为状态码，预置固定集合，未知状态码按需创建
 *
 * 并发约定：创建采用 "INSERT ... ON CONFLICT DO NOTHING" 再查询的方式，
 * 依赖自然键唯一约束，避免并发写者产生重复维度行。
 */
public interface DimensionResolver {

    /**
     * 解析单个维度的代理键，不存在时创建
     *
     * @param kind       维度类别
     * @param naturalKey 自然键
     * @param attributes 维度属性（列名 -> 值），值为null视为缺失
     * @return 代理键
     * @throws DimensionResolutionException 必填属性缺失或自然键非法时抛出
     * @throws WarehouseException 存储访问失败时抛出
     */
    long resolve(DimensionKind kind, String naturalKey, Map<String, Object> attributes);

    /**
     * 解析一条读数引用的全部四个维度
     */
    DimensionKeys resolveAll(AnnotatedReading reading);

    /**
     * 修改传感器的激活标志（传感器维度唯一可变的属性）
     *
     * @return 传感器存在并已更新时返回true
     */
    boolean setSensorActive(String sensorId, boolean active);

    /**
     * 预置状态维度的固定状态码，重复调用无副作用
     */
    void seedStatuses();

    /**
     * 清空代理键缓存。所在批次回滚后必须调用，避免引用未提交的维度行。
     */
    void invalidateCache();
}
