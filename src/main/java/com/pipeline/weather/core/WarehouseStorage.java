package com.pipeline.weather.core;

import com.pipeline.weather.model.AnnotatedReading;
import com.pipeline.weather.model.DimensionKeys;
import com.pipeline.weather.model.DimensionKind;
import com.pipeline.weather.model.HourlyAggregate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 仓库存储接口 —— 星型模型的持久化层。
 *
 * 对上层暴露维度、事实、聚合三类表的原子操作，
 * 底层默认由SQLite引擎实现（WAL模式，与告警消费者、看板共享同一文件）。
 *
 * 事务约定：
 * - 默认自动提交
 * - beginBatch 与 commitBatch/rollbackBatch 之间的写操作属于同一事务
 * - 资源忙时抛出 transient 的 {@link WarehouseException}，由调用方决定是否重试
 */
public interface WarehouseStorage {

    // ==================== 维度 ====================

    /**
     * 按自然键查询维度代理键
     *
     * @return 代理键；不存在返回null
     */
    Long findDimensionId(DimensionKind kind, String naturalKey);

    /**
     * 插入维度行；自然键已存在时什么也不做（先写者胜）
     *
     * @param attributes 列名 -> 值，列名必须属于该维度表
     */
    void insertDimensionIfAbsent(DimensionKind kind, String naturalKey, Map<String, Object> attributes);

    /**
     * 修改传感器激活标志
     *
     * @return 传感器存在时返回true
     */
    boolean updateSensorActive(String sensorId, boolean active);

    /**
     * 维度表行数，供监控和测试使用
     */
    int countDimensionRows(DimensionKind kind);

    // ==================== 事实 ====================

    /**
     * 查询某传感器在时间窗口内已装载事实的毫秒时间戳
     *
     * @param fromMs 窗口起点（含）
     * @param toMs   窗口终点（含）
     */
    Set<Long> findExistingReadingTimes(String sensorId, long fromMs, long toMs);

    /**
     * 写入一条事实
     *
     * @return true表示写入；false表示(传感器, 时间)已存在，未写入
     */
    boolean insertFact(AnnotatedReading reading, DimensionKeys keys, Instant ingestedAt);

    /**
     * 事实表总行数
     */
    long countFacts();

    /**
     * 查询时间范围内的全部事实，还原为带标注的读数
     *
     * @param fromMs 起点（含）
     * @param toMs   终点（不含）
     */
    List<AnnotatedReading> queryReadings(long fromMs, long toMs);

    // ==================== 聚合 ====================

    /**
     * 覆盖写入一个小时聚合桶
     */
    void replaceAggregate(HourlyAggregate aggregate);

    /**
     * 查询全部小时聚合，按桶起点、传感器排序
     */
    List<HourlyAggregate> queryAggregates();

    // ==================== 事务与生命周期 ====================

    void beginBatch();

    void commitBatch();

    void rollbackBatch();

    /**
     * 检查仓库是否可访问，连接失效时尝试重建
     */
    boolean isAvailable();

    void shutdown();
}
