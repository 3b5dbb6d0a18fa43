package com.pipeline.weather.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * 小时聚合：一个(传感器, 地点, UTC小时)桶内的统计摘要。
 * 派生数据，每次重算整体覆盖。
 */
public class HourlyAggregate implements Serializable {
    private String sensorId;
    private String city;
    /** 桶起点，对齐到UTC整点 */
    private Instant bucketStart;
    private int readingsCount;
    private int anomalyCount;
    private MetricStats temperature;
    private MetricStats humidity;
    private MetricStats pressure;
    private MetricStats windSpeed;
    private double totalRainfall;
    private Instant computedAt;

    public HourlyAggregate() {}

    public String getSensorId() { return sensorId; }
    public void setSensorId(String sensorId) { this.sensorId = sensorId; }
    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }
    public Instant getBucketStart() { return bucketStart; }
    public void setBucketStart(Instant bucketStart) { this.bucketStart = bucketStart; }
    public int getReadingsCount() { return readingsCount; }
    public void setReadingsCount(int readingsCount) { this.readingsCount = readingsCount; }
    public int getAnomalyCount() { return anomalyCount; }
    public void setAnomalyCount(int anomalyCount) { this.anomalyCount = anomalyCount; }
    public MetricStats getTemperature() { return temperature; }
    public void setTemperature(MetricStats temperature) { this.temperature = temperature; }
    public MetricStats getHumidity() { return humidity; }
    public void setHumidity(MetricStats humidity) { this.humidity = humidity; }
    public MetricStats getPressure() { return pressure; }
    public void setPressure(MetricStats pressure) { this.pressure = pressure; }
    public MetricStats getWindSpeed() { return windSpeed; }
    public void setWindSpeed(MetricStats windSpeed) { this.windSpeed = windSpeed; }
    public double getTotalRainfall() { return totalRainfall; }
    public void setTotalRainfall(double totalRainfall) { this.totalRainfall = totalRainfall; }
    public Instant getComputedAt() { return computedAt; }
    public void setComputedAt(Instant computedAt) { this.computedAt = computedAt; }

    @Override
    public String toString() {
        return "HourlyAggregate{" + sensorId + "/" + city + " @" + bucketStart
                + ", n=" + readingsCount + ", anomalies=" + anomalyCount
                + ", temperature=" + temperature + "}";
    }
}
