package com.pipeline.weather.core.imp;

import com.pipeline.weather.core.Aggregator;
import com.pipeline.weather.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * 小时聚合器默认实现。纯计算，不访问仓库。
 */
public class DefaultAggregator implements Aggregator {

    private static final Logger log = LoggerFactory.getLogger(DefaultAggregator.class);

    static final long HOUR_MS = 3_600_000L;

    private final Clock clock;

    public DefaultAggregator() {
        this(Clock.systemUTC());
    }

    public DefaultAggregator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public AggregationResult aggregate(List<AnnotatedReading> readings) {
        Map<BucketKey, List<AnnotatedReading>> buckets = new TreeMap<>();
        for (AnnotatedReading r : readings) {
            ValidatedReading v = r.getReading();
            BucketKey key = new BucketKey(v.getSensorId(), v.getCity(), hourStart(v.getEpochMillis()));
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }

        Instant computedAt = Instant.now(clock);
        List<HourlyAggregate> aggregates = new ArrayList<>(buckets.size());
        int failed = 0;
        for (Map.Entry<BucketKey, List<AnnotatedReading>> e : buckets.entrySet()) {
            try {
                aggregates.add(computeBucket(e.getKey(), e.getValue(), computedAt));
            } catch (RuntimeException ex) {
                failed++;
                log.error("Skipping aggregate bucket {}: {}", e.getKey(), ex.getMessage());
            }
        }
        return new AggregationResult(aggregates, failed);
    }

    private HourlyAggregate computeBucket(BucketKey key, List<AnnotatedReading> bucket, Instant computedAt) {
        int n = bucket.size();
        double[] temperature = new double[n];
        double[] humidity = new double[n];
        double[] pressure = new double[n];
        double[] windSpeed = new double[n];
        double rainfall = 0;
        int anomalies = 0;

        for (int i = 0; i < n; i++) {
            AnnotatedReading r = bucket.get(i);
            ValidatedReading v = r.getReading();
            temperature[i] = v.getTemperature();
            humidity[i] = v.getHumidity();
            pressure[i] = v.getPressure();
            windSpeed[i] = v.getWindSpeed();
            rainfall += v.getRainfall();
            if (r.getAnnotation().isAnomaly()) anomalies++;
        }

        HourlyAggregate agg = new HourlyAggregate();
        agg.setSensorId(key.sensorId);
        agg.setCity(key.city);
        agg.setBucketStart(Instant.ofEpochMilli(key.bucketStartMs));
        agg.setReadingsCount(n);
        agg.setAnomalyCount(anomalies);
        agg.setTemperature(MetricStats.of(temperature));
        agg.setHumidity(MetricStats.of(humidity));
        agg.setPressure(MetricStats.of(pressure));
        agg.setWindSpeed(MetricStats.of(windSpeed));
        agg.setTotalRainfall(rainfall);
        agg.setComputedAt(computedAt);
        return agg;
    }

    /** 对齐到UTC整点 */
    static long hourStart(long epochMillis) {
        return Math.floorDiv(epochMillis, HOUR_MS) * HOUR_MS;
    }

    /**
     * 聚合桶键：(传感器, 城市, 小时起点)
     */
    static final class BucketKey implements Comparable<BucketKey> {
        final String sensorId;
        final String city;
        final long bucketStartMs;

        BucketKey(String sensorId, String city, long bucketStartMs) {
            this.sensorId = sensorId;
            this.city = city;
            this.bucketStartMs = bucketStartMs;
        }

        @Override
        public int compareTo(BucketKey o) {
            int c = Long.compare(bucketStartMs, o.bucketStartMs);
            if (c != 0) return c;
            c = sensorId.compareTo(o.sensorId);
            return c != 0 ? c : city.compareTo(o.city);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BucketKey)) return false;
            BucketKey k = (BucketKey) o;
            return bucketStartMs == k.bucketStartMs && sensorId.equals(k.sensorId) && city.equals(k.city);
        }

        @Override
        public int hashCode() {
            return Objects.hash(sensorId, city, bucketStartMs);
        }

        @Override
        public String toString() {
            return sensorId + "/" + city + "@" + Instant.ofEpochMilli(bucketStartMs);
        }
    }
}
