package com.pipeline.weather.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.weather.core.ReadingSource;
import com.pipeline.weather.model.RawReading;
import com.pipeline.weather.model.SourceFormat;
import org.apache.kafka.clients.consumer.*;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Kafka数据源。
 * 从Kafka Topic消费采集端推送的JSON事件，消息格式与JSONL文件的行一致。
 *
 * 位移管理：关闭自动提交，周期成功后同步提交本批位移；
 * 周期中止时回退到已提交位移，下一周期重新消费。
 */
public class KafkaReadingSource implements ReadingSource {

    private static final Logger log = LoggerFactory.getLogger(KafkaReadingSource.class);

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    private final Consumer<String, String> consumer;
    private final String topic;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /** 本批每个分区的下一个位移，commit 时提交 */
    private final Map<TopicPartition, OffsetAndMetadata> pendingOffsets = new HashMap<>();

    public KafkaReadingSource(String bootstrapServers, String topic, String groupId) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "10000");

        this.consumer = new KafkaConsumer<>(props);
        this.consumer.subscribe(Collections.singletonList(topic));
        this.topic = topic;
        this.clock = Clock.systemUTC();
        log.info("KafkaReadingSource subscribed. Topic: {}, Group: {}", topic, groupId);
    }

    KafkaReadingSource(Consumer<String, String> consumer, String topic, Clock clock) {
        this.consumer = consumer;
        this.topic = topic;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "kafka:" + topic;
    }

    @Override
    public List<RawReading> readBatch() throws IOException {
        pendingOffsets.clear();
        ConsumerRecords<String, String> records;
        try {
            records = consumer.poll(POLL_TIMEOUT);
        } catch (KafkaException e) {
            throw new IOException("Failed to poll topic " + topic, e);
        }

        Instant receivedAt = Instant.now(clock);
        List<RawReading> readings = new ArrayList<>(records.count());
        for (ConsumerRecord<String, String> record : records) {
            String ref = record.topic() + "-" + record.partition() + "@" + record.offset();
            try {
                readings.add(RawReadingMapper.fromJson(objectMapper.readTree(record.value()),
                        SourceFormat.KAFKA, ref, receivedAt));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.error("Failed to parse Kafka record at offset {}: {}", record.offset(), e.getMessage());
                readings.add(RawReading.malformed(SourceFormat.KAFKA, ref, receivedAt,
                        "Invalid JSON: " + e.getMessage()));
            }
            pendingOffsets.put(new TopicPartition(record.topic(), record.partition()),
                    new OffsetAndMetadata(record.offset() + 1));
        }
        return readings;
    }

    @Override
    public void commit() {
        if (pendingOffsets.isEmpty()) return;
        consumer.commitSync(new HashMap<>(pendingOffsets));
        log.debug("{} committed offsets {}", getName(), pendingOffsets);
        pendingOffsets.clear();
    }

    @Override
    public void rewind() {
        pendingOffsets.clear();
        Set<TopicPartition> assignment = consumer.assignment();
        if (assignment.isEmpty()) return;

        Map<TopicPartition, OffsetAndMetadata> committed = consumer.committed(assignment);
        List<TopicPartition> uncommitted = new ArrayList<>();
        for (TopicPartition partition : assignment) {
            OffsetAndMetadata offset = committed.get(partition);
            if (offset != null) {
                consumer.seek(partition, offset.offset());
            } else {
                uncommitted.add(partition);
            }
        }
        if (!uncommitted.isEmpty()) {
            consumer.seekToBeginning(uncommitted);
        }
        log.info("{} rewound to last committed offsets", getName());
    }

    @Override
    public void close() {
        consumer.close();
        log.info("KafkaReadingSource for topic {} closed.", topic);
    }
}
