package com.pipeline.weather.core;

import com.pipeline.weather.model.AnnotatedReading;
import com.pipeline.weather.model.LoadResult;

import java.util.List;

/**
 * 事实装载器接口。
 *
 * 分批写入事实表，每批一个事务独立提交：后面批次失败不会回滚已提交的批次。
 * 单条读数的唯一约束冲突计为重复跳过，维度解析失败计为失败，均不中断装载。
 */
public interface FactLoader {

    /**
     * @param readings 去重并标注后的读数
     * @return 装载结果，inserted + conflicts + failed = readings.size()
     * @throws WarehouseUnavailableException 仓库整体不可用时抛出，周期应中止
     */
    LoadResult load(List<AnnotatedReading> readings);
}
