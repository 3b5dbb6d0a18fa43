package com.pipeline.weather;

import com.pipeline.weather.model.*;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * 测试用读数构造
 */
public final class ReadingFixtures {

    /** 测试统一的"当前时刻" */
    public static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    /** 基准读数时刻，早于NOW一小时 */
    public static final OffsetDateTime T0 = OffsetDateTime.parse("2024-06-01T11:00:00Z");

    private ReadingFixtures() {}

    public static RawReading raw(String sensorId, OffsetDateTime ts, String temperature) {
        RawReading raw = new RawReading(SourceFormat.JSONL, "test:1", NOW);
        raw.setTimestamp(ts.toString());
        raw.setSensorId(sensorId);
        raw.setSensorType("weather_station");
        raw.setStatus("OK");
        raw.setTemperature(temperature);
        raw.setHumidity("55.0");
        raw.setPressure("1013.2");
        raw.setWindSpeed("12.5");
        raw.setWindDirection("NE");
        raw.setRainfall("0.0");
        raw.setCity("Cairo");
        raw.setRegion("Cairo Governorate");
        raw.setCountry("Egypt");
        raw.setLatitude("30.0444");
        raw.setLongitude("31.2357");
        raw.setAltitude("23");
        return raw;
    }

    public static ValidatedReading reading(String sensorId, OffsetDateTime ts, double temperature) {
        ValidatedReading r = new ValidatedReading();
        r.setSource(SourceFormat.JSONL);
        r.setSourceRef("test:1");
        r.setReceivedAt(NOW);
        r.setTimestamp(ts);
        r.setSensorId(sensorId);
        r.setSensorType("weather_station");
        r.setStatusCode("OK");
        r.setTemperature(temperature);
        r.setHumidity(55.0);
        r.setPressure(1013.2);
        r.setWindSpeed(12.5);
        r.setWindDirection("NE");
        r.setRainfall(0.0);
        r.setUnit("C/%/hPa");
        r.setCity("Cairo");
        r.setRegion("Cairo Governorate");
        r.setCountry("Egypt");
        r.setLatitude(30.0444);
        r.setLongitude(31.2357);
        r.setAltitude(23.0);
        return r;
    }

    public static AnnotatedReading annotated(String sensorId, OffsetDateTime ts, double temperature) {
        return new AnnotatedReading(reading(sensorId, ts, temperature), AnomalyAnnotation.none());
    }

    public static AnnotatedReading annotated(ValidatedReading reading, AnomalyType type) {
        return new AnnotatedReading(reading, AnomalyAnnotation.of(type));
    }

    /** JSONL格式的一行事件（嵌套形态） */
    public static String jsonLine(String sensorId, OffsetDateTime ts, double temperature) {
        return "{\"timestamp\":\"" + ts + "\",\"sensor_id\":\"" + sensorId + "\","
                + "\"sensor_type\":\"weather_station\","
                + "\"value\":{\"temperature\":" + temperature + ",\"humidity\":55.0,\"pressure\":1013.2,"
                + "\"wind_speed\":12.5,\"wind_direction\":\"NE\",\"rainfall\":0.0},"
                + "\"unit\":\"C/%/hPa\","
                + "\"metadata\":{\"city\":\"Cairo\",\"region\":\"Cairo Governorate\",\"country\":\"Egypt\","
                + "\"lat\":30.0444,\"lon\":31.2357,\"altitude\":23},"
                + "\"status\":\"OK\",\"is_simulated\":true,\"seq\":1,\"firmware_version\":\"v2.1.0\","
                + "\"sensor_model\":\"WS-200\",\"manufacturer\":\"Acme\",\"signal_strength\":-62.5,"
                + "\"reading_quality\":0.97,\"event_type\":\"measurement\"}";
    }

    public static final String CSV_HEADER = "timestamp,sensor_id,sensor_type,status,seq,is_simulated,"
            + "firmware_version,sensor_model,manufacturer,signal_strength,reading_quality,event_type,"
            + "temperature,humidity,pressure,wind_speed,wind_direction,rainfall,unit,city,region,country,"
            + "lat,lon,altitude";

    /** CSV格式的一行，列顺序与 {@link #CSV_HEADER} 一致 */
    public static String csvLine(String sensorId, OffsetDateTime ts, double temperature) {
        return ts + "," + sensorId + ",weather_station,OK,1,True,v2.1.0,WS-200,Acme,-62.5,0.97,measurement,"
                + temperature + ",55.0,1013.2,12.5,NE,0.0,C/%/hPa,Cairo,Cairo Governorate,Egypt,"
                + "30.0444,31.2357,23";
    }
}
