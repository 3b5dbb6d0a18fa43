package com.pipeline.weather.core;

import com.pipeline.weather.model.RawReading;

import java.io.IOException;
import java.util.List;

/**
 * 数据源接口 —— 原始读数的抽取适配层。
 *
 * 每种输入格式（JSONL文件、CSV文件、Kafka Topic）各有一个实现，
 * 全部收敛为统一的 {@link RawReading}，校验器不感知来源格式。
 *
 * 位置语义（至少一次）：
 *   readBatch → (commit | rewind)
 * readBatch 返回上次提交位置之后新增的全部记录；
 * 周期成功后调用 commit 使位置前移；周期中止时调用 rewind，
 * 下一周期将重新读取同一批记录，由去重保证幂等。
 */
public interface ReadingSource extends AutoCloseable {

    /**
     * 数据源名称，用于日志
     */
    String getName();

    /**
     * 读取自上次提交位置以来新增的原始读数。
     * 无法解析的记录以 {@link RawReading#malformed} 形式返回，不会被丢弃。
     *
     * @return 新增读数；无新数据时返回空列表（非null）
     * @throws IOException 数据源不可读时抛出
     */
    List<RawReading> readBatch() throws IOException;

    /**
     * 确认上一次 readBatch 的内容已处理完毕，前移读取位置
     */
    void commit();

    /**
     * 放弃上一次 readBatch 的内容，回到最近一次提交的位置
     */
    void rewind();

    @Override
    void close();
}
