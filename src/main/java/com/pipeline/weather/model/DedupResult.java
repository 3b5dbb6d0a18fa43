package com.pipeline.weather.model;

import java.util.Collections;
import java.util.List;

/**
 * 去重结果：未出现过的读数以及两类重复的计数
 */
public class DedupResult {
    private final List<ValidatedReading> fresh;
    private final int intraBatchDuplicates;
    private final int warehouseDuplicates;

    public DedupResult(List<ValidatedReading> fresh, int intraBatchDuplicates, int warehouseDuplicates) {
        this.fresh = Collections.unmodifiableList(fresh);
        this.intraBatchDuplicates = intraBatchDuplicates;
        this.warehouseDuplicates = warehouseDuplicates;
    }

    public List<ValidatedReading> getFresh() { return fresh; }
    public int getIntraBatchDuplicates() { return intraBatchDuplicates; }
    public int getWarehouseDuplicates() { return warehouseDuplicates; }
}
