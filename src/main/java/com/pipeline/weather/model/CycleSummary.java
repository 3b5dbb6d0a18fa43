package com.pipeline.weather.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 单个ETL周期的运行摘要，用于日志和监控。
 *
 * 守恒关系：
 *   validated + rejected = read
 *   inserted + skippedDuplicates + failed = validated - intraBatchDuplicates
 */
public class CycleSummary {
    private final long cycleNumber;
    private final Instant startedAt;

    private int read;
    private int validated;
    private final Map<RejectionReason, Integer> rejections = new EnumMap<>(RejectionReason.class);
    private int intraBatchDuplicates;
    private int warehouseDuplicates;
    private int loadConflicts;
    private final Map<AnomalyType, Integer> anomalies = new EnumMap<>(AnomalyType.class);
    private int inserted;
    private int failed;
    private int aggregatesWritten;
    private int aggregateFailures;
    private long elapsedMs;
    private boolean aborted;
    private String abortReason;

    public CycleSummary(long cycleNumber, Instant startedAt) {
        this.cycleNumber = cycleNumber;
        this.startedAt = startedAt;
    }

    public void addRead(int count) { read += count; }
    public void recordValidated() { validated++; }
    public void recordRejected(RejectionReason reason) { rejections.merge(reason, 1, Integer::sum); }
    public void recordAnomaly(AnomalyType type) { anomalies.merge(type, 1, Integer::sum); }

    public void applyDedup(DedupResult result) {
        intraBatchDuplicates += result.getIntraBatchDuplicates();
        warehouseDuplicates += result.getWarehouseDuplicates();
    }

    public void applyLoad(LoadResult result) {
        inserted += result.getInserted();
        loadConflicts += result.getConflicts();
        failed += result.getFailed();
    }

    public void applyAggregation(int written, int failures) {
        aggregatesWritten += written;
        aggregateFailures += failures;
    }

    public void markAborted(String reason) {
        this.aborted = true;
        this.abortReason = reason;
    }

    public void setElapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; }

    public long getCycleNumber() { return cycleNumber; }
    public Instant getStartedAt() { return startedAt; }
    public int getRead() { return read; }
    public int getValidated() { return validated; }

    public int getRejected() {
        int total = 0;
        for (int c : rejections.values()) total += c;
        return total;
    }

    public int getRejected(RejectionReason reason) { return rejections.getOrDefault(reason, 0); }
    public Map<RejectionReason, Integer> getRejections() { return Collections.unmodifiableMap(rejections); }
    public int getIntraBatchDuplicates() { return intraBatchDuplicates; }
    public int getWarehouseDuplicates() { return warehouseDuplicates; }
    public int getLoadConflicts() { return loadConflicts; }

    /** 跳过的重复读数：仓库中已存在的 + 装载时唯一约束冲突的 */
    public int getSkippedDuplicates() { return warehouseDuplicates + loadConflicts; }

    public int getAnomalies() {
        int total = 0;
        for (int c : anomalies.values()) total += c;
        return total;
    }

    public int getAnomalies(AnomalyType type) { return anomalies.getOrDefault(type, 0); }
    public int getInserted() { return inserted; }
    public int getFailed() { return failed; }
    public int getAggregatesWritten() { return aggregatesWritten; }
    public int getAggregateFailures() { return aggregateFailures; }
    public long getElapsedMs() { return elapsedMs; }
    public boolean isAborted() { return aborted; }
    public String getAbortReason() { return abortReason; }

    @Override
    public String toString() {
        return "CycleSummary{#" + cycleNumber
                + ", read=" + read
                + ", validated=" + validated
                + ", rejected=" + getRejected() + rejections
                + ", intraBatchDuplicates=" + intraBatchDuplicates
                + ", duplicatesSkipped=" + getSkippedDuplicates()
                + ", anomalies=" + getAnomalies() + anomalies
                + ", inserted=" + inserted
                + ", failed=" + failed
                + ", aggregates=" + aggregatesWritten
                + (aggregateFailures > 0 ? ", aggregateFailures=" + aggregateFailures : "")
                + ", elapsed=" + elapsedMs + "ms"
                + (aborted ? ", ABORTED: " + abortReason : "")
                + "}";
    }
}
