package com.pipeline.weather.storage;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.pipeline.weather.model.HourlyAggregate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 小时聚合CSV导出。
 * 先写同目录下的临时文件再原子替换，读者不会看到写了一半的文件。
 */
public class AggregateCsvExporter {

    private static final Logger log = LoggerFactory.getLogger(AggregateCsvExporter.class);

    static final String[] COLUMNS = {
            "sensor_id", "city", "bucket_start", "readings_count", "anomaly_count",
            "avg_temperature", "min_temperature", "max_temperature", "stddev_temperature",
            "avg_humidity", "min_humidity", "max_humidity", "stddev_humidity",
            "avg_pressure", "min_pressure", "max_pressure", "stddev_pressure",
            "avg_wind_speed", "max_wind_speed", "total_rainfall"
    };

    private final Path target;
    private final CsvMapper mapper = new CsvMapper();
    private final CsvSchema schema;

    public AggregateCsvExporter(Path target) {
        this.target = target;
        CsvSchema.Builder builder = CsvSchema.builder();
        for (String column : COLUMNS) {
            builder.addColumn(column);
        }
        this.schema = builder.build().withHeader();
    }

    /**
     * 覆盖写出全部聚合
     *
     * @throws IOException 目录不可写或替换失败
     */
    public void export(List<HourlyAggregate> aggregates) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 SequenceWriter rows = mapper.writer(schema).writeValues(out)) {
                for (HourlyAggregate agg : aggregates) {
                    rows.write(toRow(agg));
                }
            }
            moveIntoPlace(temp);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Exported {} hourly aggregates to {}", aggregates.size(), target);
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Map<String, Object> toRow(HourlyAggregate agg) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("sensor_id", agg.getSensorId());
        row.put("city", agg.getCity());
        row.put("bucket_start", agg.getBucketStart().toString());
        row.put("readings_count", agg.getReadingsCount());
        row.put("anomaly_count", agg.getAnomalyCount());
        row.put("avg_temperature", agg.getTemperature().getMean());
        row.put("min_temperature", agg.getTemperature().getMin());
        row.put("max_temperature", agg.getTemperature().getMax());
        row.put("stddev_temperature", agg.getTemperature().getStddev());
        row.put("avg_humidity", agg.getHumidity().getMean());
        row.put("min_humidity", agg.getHumidity().getMin());
        row.put("max_humidity", agg.getHumidity().getMax());
        row.put("stddev_humidity", agg.getHumidity().getStddev());
        row.put("avg_pressure", agg.getPressure().getMean());
        row.put("min_pressure", agg.getPressure().getMin());
        row.put("max_pressure", agg.getPressure().getMax());
        row.put("stddev_pressure", agg.getPressure().getStddev());
        row.put("avg_wind_speed", agg.getWindSpeed().getMean());
        row.put("max_wind_speed", agg.getWindSpeed().getMax());
        row.put("total_rainfall", agg.getTotalRainfall());
        return row;
    }

    public Path getTarget() { return target; }
}
