package com.pipeline.weather.model;

import java.io.Serializable;
import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * 通过校验的读数：类型已转换、量程已检查、缺省值已补齐。
 * 位置和传感器属性允许为空，由维度解析器决定是否足以建立维度行。
 */
public class ValidatedReading implements Serializable {
    private SourceFormat source;
    private String sourceRef;
    private Instant receivedAt;

    private OffsetDateTime timestamp;
    private String sensorId;
    private String sensorType;
    private String sensorModel;
    private String manufacturer;
    private String firmwareVersion;
    private String statusCode;
    private boolean simulated;

    private double temperature;
    private double humidity;
    private double pressure;
    private double windSpeed;
    private String windDirection;
    private double rainfall;
    private String unit;

    private String city;
    private String region;
    private String country;
    private Double latitude;
    private Double longitude;
    private Double altitude;

    private Double signalStrength;
    private Double readingQuality;

    public ValidatedReading() {}

    /** 读数时刻的毫秒时间戳，去重和时间维度的自然键 */
    public long getEpochMillis() {
        return timestamp.toInstant().toEpochMilli();
    }

    public DedupKey dedupKey() {
        return new DedupKey(sensorId, getEpochMillis());
    }

    public SourceFormat getSource() { return source; }
    public void setSource(SourceFormat source) { this.source = source; }
    public String getSourceRef() { return sourceRef; }
    public void setSourceRef(String sourceRef) { this.sourceRef = sourceRef; }
    public Instant getReceivedAt() { return receivedAt; }
    public void setReceivedAt(Instant receivedAt) { this.receivedAt = receivedAt; }
    public OffsetDateTime getTimestamp() { return timestamp; }
    public void setTimestamp(OffsetDateTime timestamp) { this.timestamp = timestamp; }
    public String getSensorId() { return sensorId; }
    public void setSensorId(String sensorId) { this.sensorId = sensorId; }
    public String getSensorType() { return sensorType; }
    public void setSensorType(String sensorType) { this.sensorType = sensorType; }
    public String getSensorModel() { return sensorModel; }
    public void setSensorModel(String sensorModel) { this.sensorModel = sensorModel; }
    public String getManufacturer() { return manufacturer; }
    public void setManufacturer(String manufacturer) { this.manufacturer = manufacturer; }
    public String getFirmwareVersion() { return firmwareVersion; }
    public void setFirmwareVersion(String firmwareVersion) { this.firmwareVersion = firmwareVersion; }
    public String getStatusCode() { return statusCode; }
    public void setStatusCode(String statusCode) { this.statusCode = statusCode; }
    public boolean isSimulated() { return simulated; }
    public void setSimulated(boolean simulated) { this.simulated = simulated; }
    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }
    public double getHumidity() { return humidity; }
    public void setHumidity(double humidity) { this.humidity = humidity; }
    public double getPressure() { return pressure; }
    public void setPressure(double pressure) { this.pressure = pressure; }
    public double getWindSpeed() { return windSpeed; }
    public void setWindSpeed(double windSpeed) { this.windSpeed = windSpeed; }
    public String getWindDirection() { return windDirection; }
    public void setWindDirection(String windDirection) { this.windDirection = windDirection; }
    public double getRainfall() { return rainfall; }
    public void setRainfall(double rainfall) { this.rainfall = rainfall; }
    public String getUnit() { return unit; }
    public void setUnit(String unit) { this.unit = unit; }
    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }
    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }
    public String getCountry() { return country; }
    public void setCountry(String country) { this.country = country; }
    public Double getLatitude() { return latitude; }
    public void setLatitude(Double latitude) { this.latitude = latitude; }
    public Double getLongitude() { return longitude; }
    public void setLongitude(Double longitude) { this.longitude = longitude; }
    public Double getAltitude() { return altitude; }
    public void setAltitude(Double altitude) { this.altitude = altitude; }
    public Double getSignalStrength() { return signalStrength; }
    public void setSignalStrength(Double signalStrength) { this.signalStrength = signalStrength; }
    public Double getReadingQuality() { return readingQuality; }
    public void setReadingQuality(Double readingQuality) { this.readingQuality = readingQuality; }

    @Override
    public String toString() {
        return "ValidatedReading{sensor='" + sensorId + "', ts=" + timestamp
                + ", temperature=" + temperature + ", city='" + city + "'}";
    }
}
