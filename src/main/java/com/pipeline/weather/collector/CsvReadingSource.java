package com.pipeline.weather.collector;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.pipeline.weather.core.ReadingSource;
import com.pipeline.weather.model.RawReading;
import com.pipeline.weather.model.SourceFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * CSV文件数据源：第一个非空行为表头，之后每行一条读数，按列名映射。
 */
public class CsvReadingSource implements ReadingSource {

    private static final Logger log = LoggerFactory.getLogger(CsvReadingSource.class);

    private final ObjectReader rowReader;
    private final AppendOnlyFileTailer tailer;
    private final String fileName;
    private final Clock clock;

    /** 当前表头；文件从头读取时重新解析 */
    private String[] header;

    public CsvReadingSource(Path file) {
        this(file, Clock.systemUTC());
    }

    public CsvReadingSource(Path file, Clock clock) {
        this(file, clock, AppendOnlyFileTailer.DEFAULT_MAX_READ_BYTES);
    }

    public CsvReadingSource(Path file, Clock clock, int maxReadBytes) {
        CsvMapper csvMapper = new CsvMapper();
        this.rowReader = csvMapper.readerFor(String[].class).with(CsvParser.Feature.WRAP_AS_ARRAY);
        this.tailer = new AppendOnlyFileTailer(file, maxReadBytes);
        this.fileName = file.getFileName().toString();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "csv:" + fileName;
    }

    @Override
    public List<RawReading> readBatch() throws IOException {
        List<AppendOnlyFileTailer.Line> lines = tailer.readNewLines();
        Instant receivedAt = Instant.now(clock);
        List<RawReading> readings = new ArrayList<>(lines.size());
        if (tailer.isReadFromStart()) {
            header = null;
        }
        for (AppendOnlyFileTailer.Line line : lines) {
            String ref = fileName + ":" + line.getNumber();
            String[] cells = parseRow(line.getText());

            if (header == null) {
                if (cells == null) {
                    throw new IOException("Unreadable CSV header in " + fileName + " at line " + line.getNumber());
                }
                header = trimAll(cells);
                continue;
            }

            if (cells == null) {
                readings.add(RawReading.malformed(SourceFormat.CSV, ref, receivedAt, "Unparseable CSV row"));
            } else if (cells.length != header.length) {
                readings.add(RawReading.malformed(SourceFormat.CSV, ref, receivedAt,
                        "Expected " + header.length + " columns, got " + cells.length));
            } else {
                Map<String, String> row = new HashMap<>();
                for (int i = 0; i < header.length; i++) {
                    row.put(header[i], cells[i]);
                }
                readings.add(RawReadingMapper.fromColumns(row, SourceFormat.CSV, ref, receivedAt));
            }
        }
        return readings;
    }

    private String[] parseRow(String text) {
        try (MappingIterator<String[]> rows = rowReader.readValues(text)) {
            return rows.hasNextValue() ? rows.nextValue() : null;
        } catch (IOException e) {
            log.warn("{}: unparseable row: {}", getName(), e.getMessage());
            return null;
        }
    }

    private static String[] trimAll(String[] cells) {
        String[] trimmed = new String[cells.length];
        for (int i = 0; i < cells.length; i++) {
            trimmed[i] = cells[i].trim();
        }
        return trimmed;
    }

    @Override
    public void commit() {
        tailer.commit();
    }

    @Override
    public void rewind() {
        tailer.rewind();
    }

    @Override
    public void close() {
        log.debug("{} closed at offset {}", getName(), tailer.getCommittedOffset());
    }
}
