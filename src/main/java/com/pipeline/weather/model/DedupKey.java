package com.pipeline.weather.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * 去重键：(传感器标识, 毫秒时间戳)
 */
public final class DedupKey implements Serializable {
    private final String sensorId;
    private final long epochMillis;

    public DedupKey(String sensorId, long epochMillis) {
        this.sensorId = sensorId;
        this.epochMillis = epochMillis;
    }

    public String getSensorId() { return sensorId; }
    public long getEpochMillis() { return epochMillis; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DedupKey)) return false;
        DedupKey other = (DedupKey) o;
        return epochMillis == other.epochMillis && sensorId.equals(other.sensorId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sensorId, epochMillis);
    }

    @Override
    public String toString() {
        return sensorId + "@" + epochMillis;
    }
}
