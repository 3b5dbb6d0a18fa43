package com.pipeline.weather;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的系统级参数，所有键均可省略。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    // ---- 周期调度 ----
    private long cyclePeriodSeconds = 60;
    private long cycleSoftTimeoutSeconds = 300;
    private long cycleBackoffMaxSeconds = 600;

    // ---- 输入 ----
    private String inputDir = "output";
    private String inputJsonlFile = "sensor_data.jsonl";
    private String inputCsvFile = "sensor_data.csv";
    /** 每个文件源单次读取的字节上限，积压分多个周期消费 */
    private int inputMaxReadBytes = 64 * 1024 * 1024;

    // ---- 仓库 ----
    private String warehousePath = "database/iot_warehouse.db";
    private String aggregateExportPath = "processed/hourly_aggregates.csv";
    private int loadBatchSize = 100;
    private int loadRetryAttempts = 3;
    private long loadRetryBackoffMs = 200;

    // ---- 校验与异常检测 ----
    private long validationClockSkewSeconds = 300;
    private double anomalyZScoreThreshold = 3.0;
    private int anomalyStuckRunLength = 5;
    private long anomalyDropoutMaxIntervalSeconds = 15;

    // ---- Kafka ----
    private boolean kafkaEnabled = false;
    private String kafkaBootstrapServers = "localhost:9092";
    private String kafkaTopic = "sensor_data";
    private String kafkaGroupId = "weather-etl";

    /**
     * 从文件加载配置；文件不存在或不可读时使用默认值
     *
     * @throws IllegalArgumentException 配置值非法
     */
    public static AppConfig load(String configPath) {
        Path path = Paths.get(configPath);
        Properties props = new Properties();
        if (!Files.exists(path)) {
            log.warn("Config file {} not found, using defaults.", configPath);
            return fromProperties(props);
        }
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Failed to read config from {}, using defaults. Error: {}", configPath, e.getMessage());
            return fromProperties(new Properties());
        }
        log.info("Loaded config from {}", configPath);
        return fromProperties(props);
    }

    /**
     * @throws IllegalArgumentException 配置值非法
     */
    public static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();

        config.cyclePeriodSeconds = positiveLong(props, "cycle.period.seconds", config.cyclePeriodSeconds);
        config.cycleSoftTimeoutSeconds = positiveLong(props, "cycle.soft.timeout.seconds",
                config.cycleSoftTimeoutSeconds);
        config.cycleBackoffMaxSeconds = positiveLong(props, "cycle.backoff.max.seconds",
                config.cycleBackoffMaxSeconds);
        if (config.cycleBackoffMaxSeconds < config.cyclePeriodSeconds) {
            throw new IllegalArgumentException("cycle.backoff.max.seconds (" + config.cycleBackoffMaxSeconds
                    + ") must not be shorter than cycle.period.seconds (" + config.cyclePeriodSeconds + ")");
        }

        config.inputDir = text(props, "input.dir", config.inputDir);
        config.inputJsonlFile = text(props, "input.jsonl.file", config.inputJsonlFile);
        config.inputCsvFile = text(props, "input.csv.file", config.inputCsvFile);
        long maxReadBytes = positiveLong(props, "input.max.read.bytes", config.inputMaxReadBytes);
        if (maxReadBytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("input.max.read.bytes must not exceed " + Integer.MAX_VALUE
                    + ", got: " + maxReadBytes);
        }
        config.inputMaxReadBytes = (int) maxReadBytes;

        config.warehousePath = text(props, "warehouse.path", config.warehousePath);
        config.aggregateExportPath = props.getProperty("aggregate.export.path", config.aggregateExportPath).trim();
        config.loadBatchSize = (int) positiveLong(props, "load.batch.size", config.loadBatchSize);
        config.loadRetryAttempts = (int) nonNegativeLong(props, "load.retry.attempts", config.loadRetryAttempts);
        config.loadRetryBackoffMs = nonNegativeLong(props, "load.retry.backoff.ms", config.loadRetryBackoffMs);

        config.validationClockSkewSeconds = nonNegativeLong(props, "validation.clock.skew.seconds",
                config.validationClockSkewSeconds);
        config.anomalyZScoreThreshold = positiveDouble(props, "anomaly.zscore.threshold",
                config.anomalyZScoreThreshold);
        config.anomalyStuckRunLength = (int) positiveLong(props, "anomaly.stuck.run.length",
                config.anomalyStuckRunLength);
        if (config.anomalyStuckRunLength < 2) {
            throw new IllegalArgumentException("anomaly.stuck.run.length must be at least 2");
        }
        config.anomalyDropoutMaxIntervalSeconds = positiveLong(props, "anomaly.dropout.max.interval.seconds",
                config.anomalyDropoutMaxIntervalSeconds);

        config.kafkaEnabled = Boolean.parseBoolean(text(props, "kafka.enabled", "false"));
        config.kafkaBootstrapServers = text(props, "kafka.bootstrap.servers", config.kafkaBootstrapServers);
        config.kafkaTopic = text(props, "kafka.topic", config.kafkaTopic);
        config.kafkaGroupId = text(props, "kafka.group.id", config.kafkaGroupId);
        return config;
    }

    private static String text(Properties props, String key, String defaultValue) {
        String value = props.getProperty(key);
        if (value == null) return defaultValue;
        value = value.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Config key '" + key + "' must not be empty");
        }
        return value;
    }

    private static long positiveLong(Properties props, String key, long defaultValue) {
        long value = parseLong(props, key, defaultValue);
        if (value <= 0) {
            throw new IllegalArgumentException("Config key '" + key + "' must be positive, got: " + value);
        }
        return value;
    }

    private static long nonNegativeLong(Properties props, String key, long defaultValue) {
        long value = parseLong(props, key, defaultValue);
        if (value < 0) {
            throw new IllegalArgumentException("Config key '" + key + "' must not be negative, got: " + value);
        }
        return value;
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key '" + key + "' is not an integer: '" + value + "'", e);
        }
    }

    private static double positiveDouble(Properties props, String key, double defaultValue) {
        String value = props.getProperty(key);
        if (value == null) return defaultValue;
        double parsed;
        try {
            parsed = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key '" + key + "' is not a number: '" + value + "'", e);
        }
        if (!(parsed > 0) || Double.isInfinite(parsed)) {
            throw new IllegalArgumentException("Config key '" + key + "' must be positive, got: " + value);
        }
        return parsed;
    }

    // ---- Getters ----
    public long getCyclePeriodSeconds() { return cyclePeriodSeconds; }
    public long getCycleSoftTimeoutSeconds() { return cycleSoftTimeoutSeconds; }
    public long getCycleBackoffMaxSeconds() { return cycleBackoffMaxSeconds; }
    public String getInputDir() { return inputDir; }
    public String getInputJsonlFile() { return inputJsonlFile; }
    public String getInputCsvFile() { return inputCsvFile; }
    public int getInputMaxReadBytes() { return inputMaxReadBytes; }
    public String getWarehousePath() { return warehousePath; }
    /** 为空表示不导出 */
    public String getAggregateExportPath() { return aggregateExportPath; }
    public int getLoadBatchSize() { return loadBatchSize; }
    public int getLoadRetryAttempts() { return loadRetryAttempts; }
    public long getLoadRetryBackoffMs() { return loadRetryBackoffMs; }
    public long getValidationClockSkewSeconds() { return validationClockSkewSeconds; }
    public double getAnomalyZScoreThreshold() { return anomalyZScoreThreshold; }
    public int getAnomalyStuckRunLength() { return anomalyStuckRunLength; }
    public long getAnomalyDropoutMaxIntervalSeconds() { return anomalyDropoutMaxIntervalSeconds; }
    public boolean isKafkaEnabled() { return kafkaEnabled; }
    public String getKafkaBootstrapServers() { return kafkaBootstrapServers; }
    public String getKafkaTopic() { return kafkaTopic; }
    public String getKafkaGroupId() { return kafkaGroupId; }

    @Override
    public String toString() {
        return "AppConfig{period=" + cyclePeriodSeconds + "s"
                + ", softTimeout=" + cycleSoftTimeoutSeconds + "s"
                + ", input='" + inputDir + "'"
                + ", warehouse='" + warehousePath + "'"
                + ", batchSize=" + loadBatchSize
                + ", kafka=" + (kafkaEnabled ? "'" + kafkaBootstrapServers + "/" + kafkaTopic + "'" : "disabled")
                + "}";
    }
}
