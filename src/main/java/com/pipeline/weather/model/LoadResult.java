package com.pipeline.weather.model;

/**
 * 事实装载结果。inserted + conflicts + failed 等于交给装载器的读数数量。
 */
public class LoadResult {
    private int inserted;
    /** 唯一约束冲突（去重后仍与已有事实重复），按重复跳过处理 */
    private int conflicts;
    /** 维度解析失败或批次提交失败的读数 */
    private int failed;

    public void recordInserted() { inserted++; }
    public void recordConflict() { conflicts++; }
    public void recordFailed() { failed++; }
    public void recordFailed(int count) { failed += count; }

    /** 合并一个批次的结果 */
    public void merge(LoadResult other) {
        inserted += other.inserted;
        conflicts += other.conflicts;
        failed += other.failed;
    }

    public int getInserted() { return inserted; }
    public int getConflicts() { return conflicts; }
    public int getFailed() { return failed; }
    public int total() { return inserted + conflicts + failed; }

    @Override
    public String toString() {
        return "LoadResult{inserted=" + inserted + ", conflicts=" + conflicts + ", failed=" + failed + "}";
    }
}
