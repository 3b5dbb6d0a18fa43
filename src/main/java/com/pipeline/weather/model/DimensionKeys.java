package com.pipeline.weather.model;

/**
 * 一条事实行引用的四个维度代理键
 */
public class DimensionKeys {
    private final long timeId;
    private final long sensorKey;
    private final long locationId;
    private final long statusId;

    public DimensionKeys(long timeId, long sensorKey, long locationId, long statusId) {
        this.timeId = timeId;
        this.sensorKey = sensorKey;
        this.locationId = locationId;
        this.statusId = statusId;
    }

    public long getTimeId() { return timeId; }
    public long getSensorKey() { return sensorKey; }
    public long getLocationId() { return locationId; }
    public long getStatusId() { return statusId; }
}
