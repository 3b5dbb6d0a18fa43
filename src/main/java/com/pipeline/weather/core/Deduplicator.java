package com.pipeline.weather.core;

import com.pipeline.weather.model.DedupResult;
import com.pipeline.weather.model.ValidatedReading;

import java.util.List;

/**
 * 去重器接口。
 *
 * 以(传感器标识, 时间戳)为去重键，同时检查：
 * 1. 批内重复（同一读数同时出现在JSONL和CSV中，或文件被重复读取）
 * 2. 仓库中已存在的事实（上一周期或上一次运行已装载）
 *
 * 幂等保证：同一批数据处理两次，第二次不产生任何新事实。
 */
public interface Deduplicator {

    /**
     * @param batch 本周期校验通过的读数
     * @return 首次出现的读数（保持输入顺序）及重复计数
     */
    DedupResult deduplicate(List<ValidatedReading> batch);
}
