package com.pipeline.weather.storage;

import com.pipeline.weather.core.WarehouseException;
import com.pipeline.weather.core.WarehouseStorage;
import com.pipeline.weather.core.WarehouseUnavailableException;
import com.pipeline.weather.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.*;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.*;

/**
 * 基于SQLite的星型模型仓库实现。
 *
 * 核心设计：
 * - 四张维度表均以自然键唯一约束兜底，"取或建"采用 ON CONFLICT DO NOTHING
 * - 事实表以(sensor_key, time_id)唯一约束保证同一传感器同一时刻至多一行
 * - WAL模式 + busy_timeout，允许告警消费者和看板并发访问同一文件
 * - 单连接，所有访问串行化
 */
public class SQLiteWarehouseStorage implements WarehouseStorage {

    private static final Logger log = LoggerFactory.getLogger(SQLiteWarehouseStorage.class);

    /** SQLite主结果码：资源忙 / 表被锁 */
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private static final int BUSY_TIMEOUT_MS = 5000;

    /** 维度表结构描述 */
    private static final Map<DimensionKind, DimensionTable> DIMENSION_TABLES = new EnumMap<>(DimensionKind.class);

    static {
        DIMENSION_TABLES.put(DimensionKind.TIME, new DimensionTable("dim_time", "time_id", "ts_epoch_ms", true,
                Set.of("ts_iso", "date", "year", "month", "day", "hour", "minute", "second",
                        "day_of_week", "is_weekend")));
        DIMENSION_TABLES.put(DimensionKind.SENSOR, new DimensionTable("dim_sensor", "sensor_key", "sensor_id", false,
                Set.of("sensor_type", "sensor_model", "manufacturer", "firmware_version", "is_active")));
        DIMENSION_TABLES.put(DimensionKind.LOCATION, new DimensionTable("dim_location", "location_id", "city_name", false,
                Set.of("region", "country", "lat", "lon", "altitude", "location_code")));
        DIMENSION_TABLES.put(DimensionKind.STATUS, new DimensionTable("dim_status", "status_id", "status_code", false,
                Set.of("description")));
    }

    private static final String[] SCHEMA = {
            "CREATE TABLE IF NOT EXISTS dim_time ("
                    + "time_id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "ts_epoch_ms INTEGER NOT NULL UNIQUE, "
                    + "ts_iso TEXT NOT NULL, "
                    + "date TEXT NOT NULL, "
                    + "year INTEGER NOT NULL, "
                    + "month INTEGER NOT NULL, "
                    + "day INTEGER NOT NULL, "
                    + "hour INTEGER NOT NULL, "
                    + "minute INTEGER NOT NULL, "
                    + "second INTEGER NOT NULL, "
                    + "day_of_week INTEGER NOT NULL, "
                    + "is_weekend INTEGER NOT NULL)",
            "CREATE TABLE IF NOT EXISTS dim_sensor ("
                    + "sensor_key INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "sensor_id TEXT NOT NULL UNIQUE, "
                    + "sensor_type TEXT NOT NULL, "
                    + "sensor_model TEXT, "
                    + "manufacturer TEXT, "
                    + "firmware_version TEXT, "
                    + "is_active INTEGER NOT NULL DEFAULT 1)",
            "CREATE TABLE IF NOT EXISTS dim_location ("
                    + "location_id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "city_name TEXT NOT NULL UNIQUE, "
                    + "region TEXT, "
                    + "country TEXT NOT NULL, "
                    + "lat REAL NOT NULL, "
                    + "lon REAL NOT NULL, "
                    + "altitude REAL, "
                    + "location_code TEXT)",
            "CREATE TABLE IF NOT EXISTS dim_status ("
                    + "status_id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "status_code TEXT NOT NULL UNIQUE, "
                    + "description TEXT)",
            "CREATE TABLE IF NOT EXISTS fact_weather_reading ("
                    + "reading_id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "time_id INTEGER NOT NULL REFERENCES dim_time(time_id), "
                    + "sensor_key INTEGER NOT NULL REFERENCES dim_sensor(sensor_key), "
                    + "location_id INTEGER NOT NULL REFERENCES dim_location(location_id), "
                    + "status_id INTEGER NOT NULL REFERENCES dim_status(status_id), "
                    + "temperature REAL NOT NULL, "
                    + "humidity REAL NOT NULL, "
                    + "pressure REAL NOT NULL, "
                    + "wind_speed REAL NOT NULL, "
                    + "wind_direction TEXT NOT NULL, "
                    + "rainfall REAL NOT NULL DEFAULT 0.0, "
                    + "unit TEXT NOT NULL, "
                    + "is_anomaly INTEGER NOT NULL DEFAULT 0, "
                    + "anomaly_type TEXT, "
                    + "source_format TEXT, "
                    + "is_simulated INTEGER NOT NULL DEFAULT 0, "
                    + "signal_strength REAL, "
                    + "reading_quality REAL, "
                    + "ingestion_ts TEXT NOT NULL, "
                    + "processing_latency_ms INTEGER, "
                    + "UNIQUE (sensor_key, time_id))",
            "CREATE INDEX IF NOT EXISTS idx_fact_time ON fact_weather_reading (time_id)",
            "CREATE INDEX IF NOT EXISTS idx_fact_location ON fact_weather_reading (location_id)",
            "CREATE TABLE IF NOT EXISTS agg_hourly_weather ("
                    + "sensor_id TEXT NOT NULL, "
                    + "city_name TEXT NOT NULL, "
                    + "bucket_start_ms INTEGER NOT NULL, "
                    + "bucket_start TEXT NOT NULL, "
                    + "readings_count INTEGER NOT NULL, "
                    + "anomaly_count INTEGER NOT NULL, "
                    + "avg_temperature REAL, min_temperature REAL, max_temperature REAL, std_temperature REAL, "
                    + "avg_humidity REAL, min_humidity REAL, max_humidity REAL, std_humidity REAL, "
                    + "avg_pressure REAL, min_pressure REAL, max_pressure REAL, std_pressure REAL, "
                    + "avg_wind_speed REAL, min_wind_speed REAL, max_wind_speed REAL, std_wind_speed REAL, "
                    + "total_rainfall REAL, "
                    + "computed_at TEXT NOT NULL, "
                    + "PRIMARY KEY (sensor_id, city_name, bucket_start_ms))"
    };

    private static final String READING_QUERY = "SELECT t.ts_iso, s.sensor_id, s.sensor_type, s.sensor_model, "
            + "s.manufacturer, s.firmware_version, l.city_name, l.region, l.country, l.lat, l.lon, l.altitude, "
            + "st.status_code, f.temperature, f.humidity, f.pressure, f.wind_speed, f.wind_direction, "
            + "f.rainfall, f.unit, f.anomaly_type, f.source_format, f.is_simulated, "
            + "f.signal_strength, f.reading_quality "
            + "FROM fact_weather_reading f "
            + "JOIN dim_time t ON f.time_id = t.time_id "
            + "JOIN dim_sensor s ON f.sensor_key = s.sensor_key "
            + "JOIN dim_location l ON f.location_id = l.location_id "
            + "JOIN dim_status st ON f.status_id = st.status_id "
            + "WHERE t.ts_epoch_ms >= ? AND t.ts_epoch_ms < ? "
            + "ORDER BY s.sensor_id, t.ts_epoch_ms";

    /** 仓库文件路径 */
    private final String databasePath;

    private Connection connection;

    private volatile boolean closed = false;

    public SQLiteWarehouseStorage(String databasePath) {
        this.databasePath = databasePath;

        File parent = new File(databasePath).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new WarehouseUnavailableException("Failed to create warehouse directory: " + parent, null);
        }

        try {
            connection = openConnection();
            initSchema();
        } catch (SQLException e) {
            throw new WarehouseUnavailableException("Failed to initialize warehouse at " + databasePath, e);
        }
        log.info("SQLiteWarehouseStorage initialized at: {}", databasePath);
    }

    // ==================== 维度 ====================

    @Override
    public synchronized Long findDimensionId(DimensionKind kind, String naturalKey) {
        DimensionTable table = DIMENSION_TABLES.get(kind);
        String sql = "SELECT " + table.idColumn + " FROM " + table.name + " WHERE " + table.keyColumn + " = ?";
        try (PreparedStatement stmt = connection().prepareStatement(sql)) {
            bindNaturalKey(stmt, 1, table, naturalKey);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : null;
            }
        } catch (SQLException e) {
            throw translate("find " + kind + " '" + naturalKey + "'", e);
        }
    }

    @Override
    public synchronized void insertDimensionIfAbsent(DimensionKind kind, String naturalKey,
                                                     Map<String, Object> attributes) {
        DimensionTable table = DIMENSION_TABLES.get(kind);
        List<String> columns = new ArrayList<>(attributes.keySet());
        for (String column : columns) {
            if (!table.attributeColumns.contains(column)) {
                throw new IllegalArgumentException("Unknown column '" + column + "' for " + table.name);
            }
        }

        StringBuilder sql = new StringBuilder("INSERT INTO ").append(table.name)
                .append(" (").append(table.keyColumn);
        for (String column : columns) {
            sql.append(", ").append(column);
        }
        sql.append(") VALUES (?");
        for (int i = 0; i < columns.size(); i++) {
            sql.append(", ?");
        }
        sql.append(") ON CONFLICT (").append(table.keyColumn).append(") DO NOTHING");

        try (PreparedStatement stmt = connection().prepareStatement(sql.toString())) {
            bindNaturalKey(stmt, 1, table, naturalKey);
            for (int i = 0; i < columns.size(); i++) {
                bindValue(stmt, i + 2, attributes.get(columns.get(i)));
            }
            if (stmt.executeUpdate() > 0) {
                log.debug("Created {} row for '{}'", kind, naturalKey);
            }
        } catch (SQLException e) {
            throw translate("insert " + kind + " '" + naturalKey + "'", e);
        }
    }

    @Override
    public synchronized boolean updateSensorActive(String sensorId, boolean active) {
        try (PreparedStatement stmt = connection().prepareStatement(
                "UPDATE dim_sensor SET is_active = ? WHERE sensor_id = ?")) {
            stmt.setInt(1, active ? 1 : 0);
            stmt.setString(2, sensorId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw translate("update sensor '" + sensorId + "'", e);
        }
    }

    @Override
    public synchronized int countDimensionRows(DimensionKind kind) {
        return (int) count("SELECT COUNT(*) FROM " + DIMENSION_TABLES.get(kind).name);
    }

    // ==================== 事实 ====================

    @Override
    public synchronized Set<Long> findExistingReadingTimes(String sensorId, long fromMs, long toMs) {
        String sql = "SELECT t.ts_epoch_ms FROM fact_weather_reading f "
                + "JOIN dim_time t ON f.time_id = t.time_id "
                + "JOIN dim_sensor s ON f.sensor_key = s.sensor_key "
                + "WHERE s.sensor_id = ? AND t.ts_epoch_ms BETWEEN ? AND ?";
        Set<Long> result = new HashSet<>();
        try (PreparedStatement stmt = connection().prepareStatement(sql)) {
            stmt.setString(1, sensorId);
            stmt.setLong(2, fromMs);
            stmt.setLong(3, toMs);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getLong(1));
                }
            }
            return result;
        } catch (SQLException e) {
            throw translate("query existing readings of '" + sensorId + "'", e);
        }
    }

    @Override
    public synchronized boolean insertFact(AnnotatedReading annotated, DimensionKeys keys, Instant ingestedAt) {
        ValidatedReading r = annotated.getReading();
        String sql = "INSERT INTO fact_weather_reading (time_id, sensor_key, location_id, status_id, "
                + "temperature, humidity, pressure, wind_speed, wind_direction, rainfall, unit, "
                + "is_anomaly, anomaly_type, source_format, is_simulated, signal_strength, reading_quality, "
                + "ingestion_ts, processing_latency_ms) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
                + "ON CONFLICT (sensor_key, time_id) DO NOTHING";
        try (PreparedStatement stmt = connection().prepareStatement(sql)) {
            stmt.setLong(1, keys.getTimeId());
            stmt.setLong(2, keys.getSensorKey());
            stmt.setLong(3, keys.getLocationId());
            stmt.setLong(4, keys.getStatusId());
            stmt.setDouble(5, r.getTemperature());
            stmt.setDouble(6, r.getHumidity());
            stmt.setDouble(7, r.getPressure());
            stmt.setDouble(8, r.getWindSpeed());
            stmt.setString(9, r.getWindDirection());
            stmt.setDouble(10, r.getRainfall());
            stmt.setString(11, r.getUnit());
            stmt.setInt(12, annotated.getAnnotation().isAnomaly() ? 1 : 0);
            bindValue(stmt, 13, annotated.getAnnotation().isAnomaly()
                    ? annotated.getAnnotation().getType().name() : null);
            bindValue(stmt, 14, r.getSource() != null ? r.getSource().name() : null);
            stmt.setInt(15, r.isSimulated() ? 1 : 0);
            bindValue(stmt, 16, r.getSignalStrength());
            bindValue(stmt, 17, r.getReadingQuality());
            stmt.setString(18, ingestedAt.toString());
            bindValue(stmt, 19, r.getReceivedAt() != null
                    ? Math.max(0L, ingestedAt.toEpochMilli() - r.getReceivedAt().toEpochMilli()) : null);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw translate("insert fact " + r.dedupKey(), e);
        }
    }

    @Override
    public synchronized long countFacts() {
        return count("SELECT COUNT(*) FROM fact_weather_reading");
    }

    @Override
    public synchronized List<AnnotatedReading> queryReadings(long fromMs, long toMs) {
        List<AnnotatedReading> result = new ArrayList<>();
        try (PreparedStatement stmt = connection().prepareStatement(READING_QUERY)) {
            stmt.setLong(1, fromMs);
            stmt.setLong(2, toMs);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(mapResultSetToReading(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw translate("query readings", e);
        }
    }

    // ==================== 聚合 ====================

    @Override
    public synchronized void replaceAggregate(HourlyAggregate agg) {
        String sql = "INSERT OR REPLACE INTO agg_hourly_weather (sensor_id, city_name, bucket_start_ms, "
                + "bucket_start, readings_count, anomaly_count, "
                + "avg_temperature, min_temperature, max_temperature, std_temperature, "
                + "avg_humidity, min_humidity, max_humidity, std_humidity, "
                + "avg_pressure, min_pressure, max_pressure, std_pressure, "
                + "avg_wind_speed, min_wind_speed, max_wind_speed, std_wind_speed, "
                + "total_rainfall, computed_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = connection().prepareStatement(sql)) {
            stmt.setString(1, agg.getSensorId());
            stmt.setString(2, agg.getCity());
            stmt.setLong(3, agg.getBucketStart().toEpochMilli());
            stmt.setString(4, agg.getBucketStart().toString());
            stmt.setInt(5, agg.getReadingsCount());
            stmt.setInt(6, agg.getAnomalyCount());
            bindStats(stmt, 7, agg.getTemperature());
            bindStats(stmt, 11, agg.getHumidity());
            bindStats(stmt, 15, agg.getPressure());
            bindStats(stmt, 19, agg.getWindSpeed());
            stmt.setDouble(23, agg.getTotalRainfall());
            stmt.setString(24, agg.getComputedAt().toString());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw translate("replace aggregate " + agg.getSensorId() + "@" + agg.getBucketStart(), e);
        }
    }

    @Override
    public synchronized List<HourlyAggregate> queryAggregates() {
        List<HourlyAggregate> result = new ArrayList<>();
        try (Statement stmt = connection().createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT * FROM agg_hourly_weather ORDER BY bucket_start_ms, sensor_id, city_name")) {
            while (rs.next()) {
                result.add(mapResultSetToAggregate(rs));
            }
            return result;
        } catch (SQLException e) {
            throw translate("query aggregates", e);
        }
    }

    // ==================== 事务与生命周期 ====================

    @Override
    public synchronized void beginBatch() {
        try {
            connection().setAutoCommit(false);
        } catch (SQLException e) {
            throw translate("begin batch", e);
        }
    }

    @Override
    public synchronized void commitBatch() {
        try {
            connection().commit();
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            throw translate("commit batch", e);
        }
    }

    @Override
    public synchronized void rollbackBatch() {
        try {
            connection().rollback();
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            throw translate("rollback batch", e);
        }
    }

    @Override
    public synchronized boolean isAvailable() {
        if (closed) {
            return false;
        }
        try {
            if (connection == null || connection.isClosed() || !connection.isValid(2)) {
                log.warn("Warehouse connection lost, reopening {}", databasePath);
                connection = openConnection();
            }
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("SELECT 1 FROM dim_status LIMIT 1");
            }
            return true;
        } catch (SQLException e) {
            log.error("Warehouse {} is not available: {}", databasePath, e.getMessage());
            return false;
        }
    }

    /** 关闭连接 */
    @Override
    public synchronized void shutdown() {
        closed = true;
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Error closing warehouse connection: {}", e.getMessage());
            }
        }
        log.info("SQLiteWarehouseStorage shut down.");
    }

    // ==================== 内部工具方法 ====================

    private Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + databasePath);
        conn.setAutoCommit(true);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");
            stmt.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
            stmt.execute("PRAGMA foreign_keys=ON");
        }
        return conn;
    }

    private void initSchema() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            for (String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
        }
    }

    private Connection connection() {
        if (closed || connection == null) {
            throw new WarehouseUnavailableException("Warehouse " + databasePath + " is closed", null);
        }
        return connection;
    }

    private long count(String sql) {
        try (Statement stmt = connection().createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw translate("count", e);
        }
    }

    private WarehouseException translate(String operation, SQLException e) {
        int code = e.getErrorCode() & 0xff;
        boolean busy = code == SQLITE_BUSY || code == SQLITE_LOCKED;
        return new WarehouseException("Failed to " + operation + ": " + e.getMessage(), e, busy);
    }

    private void bindNaturalKey(PreparedStatement stmt, int index, DimensionTable table, String naturalKey)
            throws SQLException {
        if (table.numericKey) {
            stmt.setLong(index, Long.parseLong(naturalKey));
        } else {
            stmt.setString(index, naturalKey);
        }
    }

    private void bindValue(PreparedStatement stmt, int index, Object value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.NULL);
        } else if (value instanceof Boolean) {
            stmt.setInt(index, (Boolean) value ? 1 : 0);
        } else if (value instanceof Double || value instanceof Float) {
            stmt.setDouble(index, ((Number) value).doubleValue());
        } else if (value instanceof Number) {
            stmt.setLong(index, ((Number) value).longValue());
        } else {
            stmt.setString(index, value.toString());
        }
    }

    private void bindStats(PreparedStatement stmt, int index, MetricStats stats) throws SQLException {
        stmt.setDouble(index, stats.getMean());
        stmt.setDouble(index + 1, stats.getMin());
        stmt.setDouble(index + 2, stats.getMax());
        stmt.setDouble(index + 3, stats.getStddev());
    }

    private AnnotatedReading mapResultSetToReading(ResultSet rs) throws SQLException {
        ValidatedReading r = new ValidatedReading();
        r.setTimestamp(OffsetDateTime.parse(rs.getString("ts_iso")));
        r.setSensorId(rs.getString("sensor_id"));
        r.setSensorType(rs.getString("sensor_type"));
        r.setSensorModel(rs.getString("sensor_model"));
        r.setManufacturer(rs.getString("manufacturer"));
        r.setFirmwareVersion(rs.getString("firmware_version"));
        r.setCity(rs.getString("city_name"));
        r.setRegion(rs.getString("region"));
        r.setCountry(rs.getString("country"));
        r.setLatitude(rs.getDouble("lat"));
        r.setLongitude(rs.getDouble("lon"));
        r.setAltitude(nullableDouble(rs, "altitude"));
        r.setStatusCode(rs.getString("status_code"));
        r.setTemperature(rs.getDouble("temperature"));
        r.setHumidity(rs.getDouble("humidity"));
        r.setPressure(rs.getDouble("pressure"));
        r.setWindSpeed(rs.getDouble("wind_speed"));
        r.setWindDirection(rs.getString("wind_direction"));
        r.setRainfall(rs.getDouble("rainfall"));
        r.setUnit(rs.getString("unit"));
        String source = rs.getString("source_format");
        r.setSource(source != null ? SourceFormat.valueOf(source) : null);
        r.setSimulated(rs.getInt("is_simulated") == 1);
        r.setSignalStrength(nullableDouble(rs, "signal_strength"));
        r.setReadingQuality(nullableDouble(rs, "reading_quality"));

        String anomalyType = rs.getString("anomaly_type");
        AnomalyAnnotation annotation = anomalyType != null
                ? AnomalyAnnotation.of(AnomalyType.valueOf(anomalyType))
                : AnomalyAnnotation.none();
        return new AnnotatedReading(r, annotation);
    }

    private HourlyAggregate mapResultSetToAggregate(ResultSet rs) throws SQLException {
        HourlyAggregate agg = new HourlyAggregate();
        agg.setSensorId(rs.getString("sensor_id"));
        agg.setCity(rs.getString("city_name"));
        agg.setBucketStart(Instant.ofEpochMilli(rs.getLong("bucket_start_ms")));
        agg.setReadingsCount(rs.getInt("readings_count"));
        agg.setAnomalyCount(rs.getInt("anomaly_count"));
        agg.setTemperature(mapStats(rs, "temperature"));
        agg.setHumidity(mapStats(rs, "humidity"));
        agg.setPressure(mapStats(rs, "pressure"));
        agg.setWindSpeed(mapStats(rs, "wind_speed"));
        agg.setTotalRainfall(rs.getDouble("total_rainfall"));
        agg.setComputedAt(Instant.parse(rs.getString("computed_at")));
        return agg;
    }

    private MetricStats mapStats(ResultSet rs, String metric) throws SQLException {
        return new MetricStats(rs.getDouble("avg_" + metric), rs.getDouble("min_" + metric),
                rs.getDouble("max_" + metric), rs.getDouble("std_" + metric));
    }

    private Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * 维度表结构
     */
    static final class DimensionTable {
        final String name;
        final String idColumn;
        final String keyColumn;
        /** 自然键为整数（时间维度的毫秒时间戳） */
        final boolean numericKey;
        final Set<String> attributeColumns;

        DimensionTable(String name, String idColumn, String keyColumn, boolean numericKey,
                       Set<String> attributeColumns) {
            this.name = name;
            this.idColumn = idColumn;
            this.keyColumn = keyColumn;
            this.numericKey = numericKey;
            this.attributeColumns = attributeColumns;
        }
    }
}
