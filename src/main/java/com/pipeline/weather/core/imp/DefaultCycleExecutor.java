package com.pipeline.weather.core.imp;

import com.pipeline.weather.core.*;
import com.pipeline.weather.model.*;
import com.pipeline.weather.storage.AggregateCsvExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;

/**
 * 周期执行器默认实现。
 * 在单一线程上顺序驱动 抽取 → 转换 → 装载 → 聚合，产出周期摘要。
 *
 * 数据源位移只在周期成功后提交；任一阶段抛出异常时全部数据源回退，
 * 下一周期重新读取，由去重保证不会重复装载。
 */
public class DefaultCycleExecutor implements CycleExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultCycleExecutor.class);

    private final List<ReadingSource> sources;
    private final RecordValidator validator;
    private final Deduplicator deduplicator;
    private final AnomalyDetector detector;
    private final FactLoader factLoader;
    private final Aggregator aggregator;
    private final WarehouseStorage storage;
    /** 可为null，表示不导出 */
    private final AggregateCsvExporter exporter;
    private final Clock clock;

    public DefaultCycleExecutor(List<ReadingSource> sources,
                                RecordValidator validator,
                                Deduplicator deduplicator,
                                AnomalyDetector detector,
                                FactLoader factLoader,
                                Aggregator aggregator,
                                WarehouseStorage storage,
                                AggregateCsvExporter exporter,
                                Clock clock) {
        this.sources = new ArrayList<>(sources);
        this.validator = validator;
        this.deduplicator = deduplicator;
        this.detector = detector;
        this.factLoader = factLoader;
        this.aggregator = aggregator;
        this.storage = storage;
        this.exporter = exporter;
        this.clock = clock;

        log.info("CycleExecutor initialized with {} sources: {}", this.sources.size(), sourceNames());
    }

    @Override
    public CycleSummary runCycle(long cycleNumber, Consumer<CycleState> phaseCallback) {
        CycleSummary summary = new CycleSummary(cycleNumber, Instant.now(clock));
        long startMs = clock.millis();
        Set<ReadingSource> failedSources = new HashSet<>();

        try {
            // 1. 抽取
            phaseCallback.accept(CycleState.EXTRACTING);
            if (!storage.isAvailable()) {
                throw new WarehouseUnavailableException("Warehouse is not reachable", null);
            }
            List<RawReading> raw = extract(failedSources);
            summary.addRead(raw.size());
            checkInterrupted("extract");

            // 2. 转换：校验 → 去重 → 异常检测
            phaseCallback.accept(CycleState.TRANSFORMING);
            List<ValidatedReading> validated = validate(raw, summary);
            DedupResult dedup = deduplicator.deduplicate(validated);
            summary.applyDedup(dedup);
            List<AnnotatedReading> annotated = detector.detect(dedup.getFresh());
            for (AnnotatedReading r : annotated) {
                if (r.getAnnotation().isAnomaly()) {
                    summary.recordAnomaly(r.getAnnotation().getType());
                }
            }
            checkInterrupted("transform");

            // 3. 装载：事实 → 小时聚合
            phaseCallback.accept(CycleState.LOADING);
            LoadResult loadResult = factLoader.load(annotated);
            summary.applyLoad(loadResult);
            checkInterrupted("load");
            if (loadResult.getInserted() > 0) {
                refreshAggregates(annotated, summary);
            }
        } catch (RuntimeException e) {
            rewindAll();
            throw e;
        }

        // 4. 提交数据源位移
        for (ReadingSource source : sources) {
            if (failedSources.contains(source)) {
                source.rewind();
            } else {
                source.commit();
            }
        }

        summary.setElapsedMs(clock.millis() - startMs);
        log.info("Cycle {} completed: {}", cycleNumber, summary);
        return summary;
    }

    private List<RawReading> extract(Set<ReadingSource> failedSources) {
        List<RawReading> raw = new ArrayList<>();
        for (ReadingSource source : sources) {
            try {
                List<RawReading> batch = source.readBatch();
                if (!batch.isEmpty()) {
                    log.debug("{} returned {} records", source.getName(), batch.size());
                }
                raw.addAll(batch);
            } catch (IOException e) {
                failedSources.add(source);
                log.error("Failed to read from {}: {}", source.getName(), e.getMessage(), e);
            }
        }
        return raw;
    }

    private List<ValidatedReading> validate(List<RawReading> raw, CycleSummary summary) {
        List<ValidatedReading> validated = new ArrayList<>(raw.size());
        for (RawReading r : raw) {
            ValidationResult result = validator.validate(r);
            if (result.isValid()) {
                summary.recordValidated();
                validated.add(result.getReading());
            } else {
                summary.recordRejected(result.getReason());
                log.debug("Rejected {}: {} {}", r.getSourceRef(), result.getReason(), result.getMessage());
            }
        }
        return validated;
    }

    /**
     * 按本周期涉及的小时桶，从事实表读取整小时的读数重算聚合
     */
    private void refreshAggregates(List<AnnotatedReading> annotated, CycleSummary summary) {
        SortedSet<Long> hours = new TreeSet<>();
        for (AnnotatedReading r : annotated) {
            hours.add(DefaultAggregator.hourStart(r.getReading().getEpochMillis()));
        }

        List<AnnotatedReading> hourReadings = new ArrayList<>();
        for (long hour : hours) {
            hourReadings.addAll(storage.queryReadings(hour, hour + DefaultAggregator.HOUR_MS));
        }

        AggregationResult result = aggregator.aggregate(hourReadings);
        int written = 0;
        int failures = result.getFailedBuckets();
        for (HourlyAggregate agg : result.getAggregates()) {
            try {
                storage.replaceAggregate(agg);
                written++;
            } catch (WarehouseUnavailableException e) {
                throw e;
            } catch (WarehouseException e) {
                failures++;
                log.error("Failed to write aggregate {}/{}@{}: {}",
                        agg.getSensorId(), agg.getCity(), agg.getBucketStart(), e.getMessage());
            }
        }
        summary.applyAggregation(written, failures);

        if (exporter != null && written > 0) {
            try {
                exporter.export(storage.queryAggregates());
            } catch (IOException e) {
                log.error("Failed to export hourly aggregates to {}: {}", exporter.getTarget(), e.getMessage());
            }
        }
    }

    private void rewindAll() {
        for (ReadingSource source : sources) {
            try {
                source.rewind();
            } catch (RuntimeException e) {
                log.warn("Failed to rewind {}: {}", source.getName(), e.getMessage());
            }
        }
    }

    private void checkInterrupted(String stage) {
        if (Thread.interrupted()) {
            throw new CycleInterruptedException("Cycle interrupted after " + stage);
        }
    }

    private List<String> sourceNames() {
        List<String> names = new ArrayList<>();
        for (ReadingSource source : sources) {
            names.add(source.getName());
        }
        return names;
    }

    @Override
    public void close() {
        for (ReadingSource source : sources) {
            try {
                source.close();
            } catch (RuntimeException e) {
                log.warn("Error closing {}: {}", source.getName(), e.getMessage());
            }
        }
        log.info("CycleExecutor closed.");
    }
}
