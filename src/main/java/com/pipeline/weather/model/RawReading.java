package com.pipeline.weather.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * 原始读数：数据源适配器的统一输出。
 * 所有业务字段均保留文本形式，类型转换和量程校验由校验器完成。
 */
public class RawReading implements Serializable {
    /** 来源格式 */
    private SourceFormat source;
    /** 来源位置，如 sensor_data.csv:42 或 sensor_data-0@118 */
    private String sourceRef;
    /** 被抽取的时刻，用于计算处理延迟 */
    private Instant receivedAt;
    /** 整条记录解析失败时的错误信息；为null表示解析成功 */
    private String parseError;

    private String timestamp;
    private String sensorId;
    private String sensorType;
    private String sensorModel;
    private String manufacturer;
    private String firmwareVersion;
    private String status;
    private String simulated;

    private String temperature;
    private String humidity;
    private String pressure;
    private String windSpeed;
    private String windDirection;
    private String rainfall;
    private String unit;

    private String city;
    private String region;
    private String country;
    private String latitude;
    private String longitude;
    private String altitude;

    private String signalStrength;
    private String readingQuality;

    public RawReading() {}

    public RawReading(SourceFormat source, String sourceRef, Instant receivedAt) {
        this.source = source;
        this.sourceRef = sourceRef;
        this.receivedAt = receivedAt;
    }

    /**
     * 构造一条无法解析的原始记录，保证其仍被计入读取总数并以MALFORMED_RECORD拒绝
     */
    public static RawReading malformed(SourceFormat source, String sourceRef,
                                       Instant receivedAt, String parseError) {
        RawReading raw = new RawReading(source, sourceRef, receivedAt);
        raw.setParseError(parseError);
        return raw;
    }

    public boolean isMalformed() { return parseError != null; }

    public SourceFormat getSource() { return source; }
    public void setSource(SourceFormat source) { this.source = source; }
    public String getSourceRef() { return sourceRef; }
    public void setSourceRef(String sourceRef) { this.sourceRef = sourceRef; }
    public Instant getReceivedAt() { return receivedAt; }
    public void setReceivedAt(Instant receivedAt) { this.receivedAt = receivedAt; }
    public String getParseError() { return parseError; }
    public void setParseError(String parseError) { this.parseError = parseError; }
    public String getTimestamp() { return timestamp; }
    public void setTimestamp(String timestamp) { this.timestamp = timestamp; }
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
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getSimulated() { return simulated; }
    public void setSimulated(String simulated) { this.simulated = simulated; }
    public String getTemperature() { return temperature; }
    public void setTemperature(String temperature) { this.temperature = temperature; }
    public String getHumidity() { return humidity; }
    public void setHumidity(String humidity) { this.humidity = humidity; }
    public String getPressure() { return pressure; }
    public void setPressure(String pressure) { this.pressure = pressure; }
    public String getWindSpeed() { return windSpeed; }
    public void setWindSpeed(String windSpeed) { this.windSpeed = windSpeed; }
    public String getWindDirection() { return windDirection; }
    public void setWindDirection(String windDirection) { this.windDirection = windDirection; }
    public String getRainfall() { return rainfall; }
    public void setRainfall(String rainfall) { this.rainfall = rainfall; }
    public String getUnit() { return unit; }
    public void setUnit(String unit) { this.unit = unit; }
    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }
    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }
    public String getCountry() { return country; }
    public void setCountry(String country) { this.country = country; }
    public String getLatitude() { return latitude; }
    public void setLatitude(String latitude) { this.latitude = latitude; }
    public String getLongitude() { return longitude; }
    public void setLongitude(String longitude) { this.longitude = longitude; }
    public String getAltitude() { return altitude; }
    public void setAltitude(String altitude) { this.altitude = altitude; }
    public String getSignalStrength() { return signalStrength; }
    public void setSignalStrength(String signalStrength) { this.signalStrength = signalStrength; }
    public String getReadingQuality() { return readingQuality; }
    public void setReadingQuality(String readingQuality) { this.readingQuality = readingQuality; }

    @Override
    public String toString() {
        return "RawReading{" + source + " " + sourceRef
                + ", sensor='" + sensorId + "', ts='" + timestamp + "'}";
    }
}
