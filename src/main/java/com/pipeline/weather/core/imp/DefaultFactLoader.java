package com.pipeline.weather.core.imp;

import com.pipeline.weather.core.*;
import com.pipeline.weather.model.AnnotatedReading;
import com.pipeline.weather.model.DimensionKeys;
import com.pipeline.weather.model.LoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 事实装载器默认实现。
 *
 * 每批一个事务：begin → (解析维度 + 插入事实)* → commit。
 * 提交失败的批次整体回滚并计为失败，维度缓存随之失效。
 * 单条失败后若发现仓库已不可用，立即抛出 {@link WarehouseUnavailableException}。
 */
public class DefaultFactLoader implements FactLoader {

    private static final Logger log = LoggerFactory.getLogger(DefaultFactLoader.class);

    public static final int DEFAULT_BATCH_SIZE = 100;

    private final WarehouseStorage storage;
    private final DimensionResolver resolver;
    private final WriteRetrier retrier;
    private final int batchSize;
    private final Clock clock;

    public DefaultFactLoader(WarehouseStorage storage, DimensionResolver resolver,
                             WriteRetrier retrier, int batchSize) {
        this(storage, resolver, retrier, batchSize, Clock.systemUTC());
    }

    public DefaultFactLoader(WarehouseStorage storage, DimensionResolver resolver,
                             WriteRetrier retrier, int batchSize, Clock clock) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got: " + batchSize);
        }
        this.storage = storage;
        this.resolver = resolver;
        this.retrier = retrier;
        this.batchSize = batchSize;
        this.clock = clock;
    }

    @Override
    public LoadResult load(List<AnnotatedReading> readings) {
        LoadResult total = new LoadResult();
        for (int from = 0; from < readings.size(); from += batchSize) {
            List<AnnotatedReading> batch = readings.subList(from, Math.min(from + batchSize, readings.size()));
            total.merge(loadBatch(batch, from / batchSize + 1));
        }
        if (!readings.isEmpty()) {
            log.debug("Loaded {} readings: {}", readings.size(), total);
        }
        return total;
    }

    private LoadResult loadBatch(List<AnnotatedReading> batch, int batchNumber) {
        LoadResult result = new LoadResult();
        retrier.run("begin batch", storage::beginBatch);

        for (AnnotatedReading reading : batch) {
            try {
                DimensionKeys keys = retrier.execute("resolve dimensions", () -> resolver.resolveAll(reading));
                Instant ingestedAt = Instant.now(clock);
                boolean inserted = retrier.execute("insert fact",
                        () -> storage.insertFact(reading, keys, ingestedAt));
                if (inserted) {
                    result.recordInserted();
                } else {
                    log.debug("Fact {} already present, skipped", reading.getReading().dedupKey());
                    result.recordConflict();
                }
            } catch (DimensionResolutionException e) {
                log.warn("Skipping reading {}: {}", reading.getReading().dedupKey(), e.getMessage());
                result.recordFailed();
            } catch (WarehouseException e) {
                if (e instanceof WarehouseUnavailableException || !storage.isAvailable()) {
                    abandon(batchNumber);
                    throw unavailable(e);
                }
                log.error("Failed to load reading {}: {}", reading.getReading().dedupKey(), e.getMessage());
                result.recordFailed();
            } catch (RuntimeException e) {
                // 中断或意外错误：事务不能悬挂，否则写锁一直被占用
                abandon(batchNumber);
                throw e;
            }
        }

        try {
            retrier.run("commit batch", storage::commitBatch);
            return result;
        } catch (WarehouseException e) {
            log.error("Commit of batch {} failed, rolling back {} readings: {}",
                    batchNumber, batch.size(), e.getMessage());
            abandon(batchNumber);
            if (e instanceof WarehouseUnavailableException || !storage.isAvailable()) {
                throw unavailable(e);
            }
            LoadResult failed = new LoadResult();
            failed.recordFailed(batch.size());
            return failed;
        } catch (RuntimeException e) {
            abandon(batchNumber);
            throw e;
        }
    }

    /**
     * 回滚当前批次，丢弃可能引用未提交维度行的缓存
     */
    private void abandon(int batchNumber) {
        try {
            storage.rollbackBatch();
        } catch (WarehouseException e) {
            log.warn("Rollback of batch {} failed: {}", batchNumber, e.getMessage());
        } finally {
            resolver.invalidateCache();
        }
    }

    private WarehouseUnavailableException unavailable(WarehouseException cause) {
        if (cause instanceof WarehouseUnavailableException) {
            return (WarehouseUnavailableException) cause;
        }
        return new WarehouseUnavailableException("Warehouse became unavailable during load", cause);
    }

    public int getBatchSize() { return batchSize; }
}
