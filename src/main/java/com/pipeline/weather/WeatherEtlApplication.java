package com.pipeline.weather;

import com.pipeline.weather.collector.CsvReadingSource;
import com.pipeline.weather.collector.JsonLinesReadingSource;
import com.pipeline.weather.collector.KafkaReadingSource;
import com.pipeline.weather.core.*;
import com.pipeline.weather.core.imp.*;
import com.pipeline.weather.model.CycleSummary;
import com.pipeline.weather.operators.DropoutDetectionOperator;
import com.pipeline.weather.operators.SpikeDetectionOperator;
import com.pipeline.weather.operators.StuckSensorOperator;
import com.pipeline.weather.storage.AggregateCsvExporter;
import com.pipeline.weather.storage.SQLiteWarehouseStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 系统启动引导类。
 * 一条命令完成全部初始化：打开仓库、预置状态维度、组装数据源和各阶段、启动调度。
 *
 * 用法：java -jar weather-etl.jar [配置文件路径] [--once]
 */
public class WeatherEtlApplication {

    private static final Logger log = LoggerFactory.getLogger(WeatherEtlApplication.class);

    static final String DEFAULT_CONFIG_PATH = "config/etl.properties";

    private SQLiteWarehouseStorage storage;
    private DefaultCycleScheduler scheduler;

    /**
     * 组装全部组件，不启动调度
     */
    public CycleScheduler build(AppConfig config) {
        log.info("=== IoT Weather ETL ===");
        log.info("Starting with config: {}", config);
        Clock clock = Clock.systemUTC();

        // 1. 初始化仓库
        storage = new SQLiteWarehouseStorage(config.getWarehousePath());
        DefaultDimensionResolver resolver = new DefaultDimensionResolver(storage);
        resolver.seedStatuses();

        // 2. 数据源
        List<ReadingSource> sources = new ArrayList<>();
        Path inputDir = Paths.get(config.getInputDir());
        sources.add(new JsonLinesReadingSource(inputDir.resolve(config.getInputJsonlFile()), clock,
                config.getInputMaxReadBytes()));
        sources.add(new CsvReadingSource(inputDir.resolve(config.getInputCsvFile()), clock,
                config.getInputMaxReadBytes()));
        if (config.isKafkaEnabled()) {
            sources.add(new KafkaReadingSource(config.getKafkaBootstrapServers(),
                    config.getKafkaTopic(), config.getKafkaGroupId()));
        }

        // 3. 异常检测规则
        List<AnomalyRule> rules = List.of(
                new SpikeDetectionOperator(config.getAnomalyZScoreThreshold()),
                new StuckSensorOperator(config.getAnomalyStuckRunLength()),
                new DropoutDetectionOperator(Duration.ofSeconds(config.getAnomalyDropoutMaxIntervalSeconds())));

        // 4. 周期执行器
        WriteRetrier retrier = new WriteRetrier(config.getLoadRetryAttempts(), config.getLoadRetryBackoffMs());
        AggregateCsvExporter exporter = config.getAggregateExportPath().isEmpty()
                ? null
                : new AggregateCsvExporter(Paths.get(config.getAggregateExportPath()));
        CycleExecutor executor = new DefaultCycleExecutor(
                sources,
                new DefaultRecordValidator(clock, Duration.ofSeconds(config.getValidationClockSkewSeconds())),
                new DefaultDeduplicator(storage),
                new DefaultAnomalyDetector(rules),
                new DefaultFactLoader(storage, resolver, retrier, config.getLoadBatchSize(), clock),
                new DefaultAggregator(clock),
                storage,
                exporter,
                clock);

        // 5. 调度器
        scheduler = new DefaultCycleScheduler(executor,
                config.getCyclePeriodSeconds() * 1000L,
                config.getCycleSoftTimeoutSeconds() * 1000L,
                config.getCycleBackoffMaxSeconds() * 1000L,
                clock);
        scheduler.addStateListener((from, to) -> log.debug("ETL state {} -> {}", from, to));
        return scheduler;
    }

    public void start(AppConfig config) {
        build(config);

        // 注册JVM关闭钩子
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown hook triggered, performing graceful shutdown...");
            shutdown();
        }, "shutdown-hook"));

        scheduler.start();
        log.info("=== ETL scheduler started ===");
    }

    public CycleSummary runOnce(AppConfig config) {
        build(config);
        try {
            return scheduler.runOnce();
        } finally {
            shutdown();
        }
    }

    public synchronized void shutdown() {
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
        }
        if (storage != null) {
            storage.shutdown();
            storage = null;
        }
        log.info("=== ETL shut down ===");
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        String configPath = DEFAULT_CONFIG_PATH;
        boolean once = false;
        for (String arg : args) {
            if ("--once".equals(arg)) {
                once = true;
            } else {
                configPath = arg;
            }
        }

        AppConfig config = AppConfig.load(configPath);
        WeatherEtlApplication app = new WeatherEtlApplication();
        if (once) {
            CycleSummary summary = app.runOnce(config);
            if (summary.isAborted()) {
                log.error("Single cycle aborted: {}", summary.getAbortReason());
                System.exit(1);
            }
        } else {
            app.start(config);
        }
    }
}
