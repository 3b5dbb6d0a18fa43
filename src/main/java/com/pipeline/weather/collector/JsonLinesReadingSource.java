package com.pipeline.weather.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.weather.core.ReadingSource;
import com.pipeline.weather.model.RawReading;
import com.pipeline.weather.model.SourceFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSONL文件数据源：每行一个JSON事件。
 */
public class JsonLinesReadingSource implements ReadingSource {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesReadingSource.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AppendOnlyFileTailer tailer;
    private final String fileName;
    private final Clock clock;

    public JsonLinesReadingSource(Path file) {
        this(file, Clock.systemUTC());
    }

    public JsonLinesReadingSource(Path file, Clock clock) {
        this(file, clock, AppendOnlyFileTailer.DEFAULT_MAX_READ_BYTES);
    }

    public JsonLinesReadingSource(Path file, Clock clock, int maxReadBytes) {
        this.tailer = new AppendOnlyFileTailer(file, maxReadBytes);
        this.fileName = file.getFileName().toString();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "jsonl:" + fileName;
    }

    @Override
    public List<RawReading> readBatch() throws IOException {
        List<AppendOnlyFileTailer.Line> lines = tailer.readNewLines();
        Instant receivedAt = Instant.now(clock);
        List<RawReading> readings = new ArrayList<>(lines.size());
        int malformed = 0;
        for (AppendOnlyFileTailer.Line line : lines) {
            String ref = fileName + ":" + line.getNumber();
            try {
                JsonNode event = objectMapper.readTree(line.getText());
                readings.add(RawReadingMapper.fromJson(event, SourceFormat.JSONL, ref, receivedAt));
            } catch (JsonProcessingException e) {
                malformed++;
                readings.add(RawReading.malformed(SourceFormat.JSONL, ref, receivedAt,
                        "Invalid JSON: " + e.getOriginalMessage()));
            }
        }
        if (malformed > 0) {
            log.warn("{}: {} of {} lines are not valid JSON", getName(), malformed, lines.size());
        }
        return readings;
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
