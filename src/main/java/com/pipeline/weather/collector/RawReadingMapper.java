package com.pipeline.weather.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeline.weather.model.RawReading;
import com.pipeline.weather.model.SourceFormat;

import java.time.Instant;
import java.util.Map;

/**
 * 将各来源的记录结构映射为统一的 {@link RawReading}。
 *
 * JSON事件支持两种形态：
 * <pre>
 * 嵌套：{"timestamp":..., "sensor_id":..., "value":{"temperature":...}, "metadata":{"city":...}}
 * 扁平：{"timestamp":..., "sensor_id":..., "temperature":..., "city":...}
 * </pre>
 * CSV行按列名映射，列名与扁平形态的字段名一致。
 */
public final class RawReadingMapper {

    private RawReadingMapper() {}

    public static RawReading fromJson(JsonNode event, SourceFormat source, String sourceRef, Instant receivedAt) {
        if (event == null || !event.isObject()) {
            return RawReading.malformed(source, sourceRef, receivedAt, "Record is not a JSON object");
        }
        JsonNode value = event.path("value").isObject() ? event.get("value") : event;
        JsonNode metadata = event.path("metadata").isObject() ? event.get("metadata") : event;

        RawReading raw = new RawReading(source, sourceRef, receivedAt);
        raw.setTimestamp(text(event, "timestamp"));
        raw.setSensorId(text(event, "sensor_id"));
        raw.setSensorType(text(event, "sensor_type"));
        raw.setSensorModel(text(event, "sensor_model"));
        raw.setManufacturer(text(event, "manufacturer"));
        raw.setFirmwareVersion(text(event, "firmware_version"));
        raw.setStatus(text(event, "status"));
        raw.setSimulated(text(event, "is_simulated"));
        raw.setUnit(text(event, "unit"));
        raw.setSignalStrength(text(event, "signal_strength"));
        raw.setReadingQuality(text(event, "reading_quality"));

        raw.setTemperature(text(value, "temperature"));
        raw.setHumidity(text(value, "humidity"));
        raw.setPressure(text(value, "pressure"));
        raw.setWindSpeed(text(value, "wind_speed"));
        raw.setWindDirection(text(value, "wind_direction"));
        raw.setRainfall(text(value, "rainfall"));

        raw.setCity(text(metadata, "city"));
        raw.setRegion(text(metadata, "region"));
        raw.setCountry(text(metadata, "country"));
        raw.setLatitude(text(metadata, "lat"));
        raw.setLongitude(text(metadata, "lon"));
        raw.setAltitude(text(metadata, "altitude"));
        return raw;
    }

    public static RawReading fromColumns(Map<String, String> row, SourceFormat source,
                                         String sourceRef, Instant receivedAt) {
        RawReading raw = new RawReading(source, sourceRef, receivedAt);
        raw.setTimestamp(row.get("timestamp"));
        raw.setSensorId(row.get("sensor_id"));
        raw.setSensorType(row.get("sensor_type"));
        raw.setSensorModel(row.get("sensor_model"));
        raw.setManufacturer(row.get("manufacturer"));
        raw.setFirmwareVersion(row.get("firmware_version"));
        raw.setStatus(row.get("status"));
        raw.setSimulated(row.get("is_simulated"));
        raw.setUnit(row.get("unit"));
        raw.setSignalStrength(row.get("signal_strength"));
        raw.setReadingQuality(row.get("reading_quality"));
        raw.setTemperature(row.get("temperature"));
        raw.setHumidity(row.get("humidity"));
        raw.setPressure(row.get("pressure"));
        raw.setWindSpeed(row.get("wind_speed"));
        raw.setWindDirection(row.get("wind_direction"));
        raw.setRainfall(row.get("rainfall"));
        raw.setCity(row.get("city"));
        raw.setRegion(row.get("region"));
        raw.setCountry(row.get("country"));
        raw.setLatitude(row.get("lat"));
        raw.setLongitude(row.get("lon"));
        raw.setAltitude(row.get("altitude"));
        return raw;
    }

    private static String text(JsonNode node, String field) {
        JsonNode child = node.get(field);
        if (child == null || child.isNull() || child.isContainerNode()) {
            return null;
        }
        return child.asText();
    }
}
