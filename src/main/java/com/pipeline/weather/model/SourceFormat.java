package com.pipeline.weather.model;

/**
 * 原始读数的来源格式
 */
public enum SourceFormat {
    /** 按行分隔的JSON事件文件 */
    JSONL,
    /** 扁平化的CSV文件 */
    CSV,
    /** Kafka Topic */
    KAFKA
}
