package com.pipeline.weather.core.imp;

import com.pipeline.weather.core.Deduplicator;
import com.pipeline.weather.core.WarehouseStorage;
import com.pipeline.weather.model.DedupKey;
import com.pipeline.weather.model.DedupResult;
import com.pipeline.weather.model.ValidatedReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 去重器默认实现。
 * 先做批内去重（保留首次出现），再按传感器查询仓库在本批时间窗口内已有的事实时刻。
 */
public class DefaultDeduplicator implements Deduplicator {

    private static final Logger log = LoggerFactory.getLogger(DefaultDeduplicator.class);

    private final WarehouseStorage storage;

    public DefaultDeduplicator(WarehouseStorage storage) {
        this.storage = storage;
    }

    @Override
    public DedupResult deduplicate(List<ValidatedReading> batch) {
        // 1. 批内去重
        Set<DedupKey> seen = new HashSet<>();
        List<ValidatedReading> unique = new ArrayList<>();
        int intraBatch = 0;
        for (ValidatedReading r : batch) {
            if (seen.add(r.dedupKey())) {
                unique.add(r);
            } else {
                intraBatch++;
            }
        }

        // 2. 按传感器计算时间窗口 [min, max]
        Map<String, long[]> windows = new LinkedHashMap<>();
        for (ValidatedReading r : unique) {
            long ts = r.getEpochMillis();
            long[] window = windows.computeIfAbsent(r.getSensorId(), k -> new long[]{ts, ts});
            window[0] = Math.min(window[0], ts);
            window[1] = Math.max(window[1], ts);
        }

        Map<String, Set<Long>> existing = new HashMap<>();
        for (Map.Entry<String, long[]> e : windows.entrySet()) {
            Set<Long> times = storage.findExistingReadingTimes(e.getKey(), e.getValue()[0], e.getValue()[1]);
            if (!times.isEmpty()) {
                existing.put(e.getKey(), times);
            }
        }

        // 3. 剔除仓库中已存在的读数
        List<ValidatedReading> fresh = new ArrayList<>(unique.size());
        int warehouse = 0;
        for (ValidatedReading r : unique) {
            Set<Long> times = existing.get(r.getSensorId());
            if (times != null && times.contains(r.getEpochMillis())) {
                warehouse++;
            } else {
                fresh.add(r);
            }
        }

        if (intraBatch > 0 || warehouse > 0) {
            log.debug("Dedup: {} in, {} fresh, {} intra-batch duplicates, {} already in warehouse",
                    batch.size(), fresh.size(), intraBatch, warehouse);
        }
        return new DedupResult(fresh, intraBatch, warehouse);
    }
}
