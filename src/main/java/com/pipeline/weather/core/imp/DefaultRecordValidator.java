package com.pipeline.weather.core.imp;

import com.pipeline.weather.core.RecordValidator;
import com.pipeline.weather.model.RawReading;
import com.pipeline.weather.model.RejectionReason;
import com.pipeline.weather.model.ValidatedReading;
import com.pipeline.weather.model.ValidationResult;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * 记录校验器默认实现。
 *
 * 校验顺序：整条解析失败 → 必填字段 → 时间戳 → 数值转换 → 量程。
 * 第一个不通过的检查决定拒绝原因。缺省值与采集端约定一致。
 */
public class DefaultRecordValidator implements RecordValidator {

    public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofMinutes(5);

    static final String DEFAULT_SENSOR_TYPE = "weather_station";
    static final String DEFAULT_STATUS = "OK";
    static final String DEFAULT_WIND_DIRECTION = "N";
    static final String DEFAULT_UNIT = "C/%/hPa";

    // 物理量程（闭区间）
    private static final double MIN_TEMPERATURE = -50.0;
    private static final double MAX_TEMPERATURE = 60.0;
    private static final double MIN_HUMIDITY = 0.0;
    private static final double MAX_HUMIDITY = 100.0;
    private static final double MIN_PRESSURE = 900.0;
    private static final double MAX_PRESSURE = 1100.0;
    private static final double MIN_WIND_SPEED = 0.0;
    private static final double MAX_WIND_SPEED = 150.0;
    private static final double MIN_RAINFALL = 0.0;
    private static final double MAX_RAINFALL = 500.0;

    private final Clock clock;
    private final Duration clockSkew;

    public DefaultRecordValidator() {
        this(Clock.systemUTC(), DEFAULT_CLOCK_SKEW);
    }

    public DefaultRecordValidator(Clock clock, Duration clockSkew) {
        if (clockSkew.isNegative()) {
            throw new IllegalArgumentException("Clock skew tolerance must not be negative: " + clockSkew);
        }
        this.clock = clock;
        this.clockSkew = clockSkew;
    }

    @Override
    public ValidationResult validate(RawReading raw) {
        if (raw.isMalformed()) {
            return ValidationResult.rejected(RejectionReason.MALFORMED_RECORD, raw.getParseError());
        }

        // 1. 必填字段
        String missing = firstMissing(raw);
        if (missing != null) {
            return ValidationResult.rejected(RejectionReason.MISSING_FIELD, "Missing field: " + missing);
        }

        // 2. 时间戳
        OffsetDateTime timestamp = parseTimestamp(raw.getTimestamp().trim());
        if (timestamp == null) {
            return ValidationResult.rejected(RejectionReason.MALFORMED_TIMESTAMP,
                    "Unparseable timestamp: " + raw.getTimestamp());
        }
        OffsetDateTime latest = OffsetDateTime.now(clock).plus(clockSkew);
        if (timestamp.isAfter(latest)) {
            return ValidationResult.rejected(RejectionReason.MALFORMED_TIMESTAMP,
                    "Timestamp in the future: " + raw.getTimestamp());
        }

        // 3. 数值转换
        ValidatedReading reading = new ValidatedReading();
        try {
            reading.setTemperature(parseRequired("temperature", raw.getTemperature()));
            reading.setHumidity(parseRequired("humidity", raw.getHumidity()));
            reading.setPressure(parseRequired("pressure", raw.getPressure()));
            reading.setWindSpeed(orDefault(parseOptional("wind_speed", raw.getWindSpeed()), 0.0));
            reading.setRainfall(orDefault(parseOptional("rainfall", raw.getRainfall()), 0.0));
            reading.setLatitude(parseOptional("lat", raw.getLatitude()));
            reading.setLongitude(parseOptional("lon", raw.getLongitude()));
            reading.setAltitude(parseOptional("altitude", raw.getAltitude()));
            reading.setSignalStrength(parseOptional("signal_strength", raw.getSignalStrength()));
            reading.setReadingQuality(parseOptional("reading_quality", raw.getReadingQuality()));
        } catch (IllegalArgumentException e) {
            return ValidationResult.rejected(RejectionReason.MALFORMED_VALUE, e.getMessage());
        }

        // 4. 量程
        String outOfRange = firstOutOfRange(reading);
        if (outOfRange != null) {
            return ValidationResult.rejected(RejectionReason.OUT_OF_RANGE_VALUE, outOfRange);
        }

        reading.setSource(raw.getSource());
        reading.setSourceRef(raw.getSourceRef());
        reading.setReceivedAt(raw.getReceivedAt());
        reading.setTimestamp(timestamp);
        reading.setSensorId(raw.getSensorId().trim());
        reading.setSensorType(textOrDefault(raw.getSensorType(), DEFAULT_SENSOR_TYPE));
        reading.setSensorModel(textOrNull(raw.getSensorModel()));
        reading.setManufacturer(textOrNull(raw.getManufacturer()));
        reading.setFirmwareVersion(textOrNull(raw.getFirmwareVersion()));
        reading.setStatusCode(textOrDefault(raw.getStatus(), DEFAULT_STATUS).toUpperCase(Locale.ROOT));
        reading.setSimulated(parseFlag(raw.getSimulated()));
        reading.setWindDirection(textOrDefault(raw.getWindDirection(), DEFAULT_WIND_DIRECTION));
        reading.setUnit(textOrDefault(raw.getUnit(), DEFAULT_UNIT));
        reading.setCity(raw.getCity().trim());
        reading.setRegion(textOrNull(raw.getRegion()));
        reading.setCountry(textOrNull(raw.getCountry()));
        return ValidationResult.success(reading);
    }

    private String firstMissing(RawReading raw) {
        if (isBlank(raw.getTimestamp())) return "timestamp";
        if (isBlank(raw.getSensorId())) return "sensor_id";
        if (isBlank(raw.getTemperature())) return "temperature";
        if (isBlank(raw.getHumidity())) return "humidity";
        if (isBlank(raw.getPressure())) return "pressure";
        if (isBlank(raw.getCity())) return "city";
        return null;
    }

    private String firstOutOfRange(ValidatedReading r) {
        if (outside(r.getTemperature(), MIN_TEMPERATURE, MAX_TEMPERATURE)) {
            return "temperature " + r.getTemperature() + " outside [" + MIN_TEMPERATURE + ", " + MAX_TEMPERATURE + "]";
        }
        if (outside(r.getHumidity(), MIN_HUMIDITY, MAX_HUMIDITY)) {
            return "humidity " + r.getHumidity() + " outside [" + MIN_HUMIDITY + ", " + MAX_HUMIDITY + "]";
        }
        if (outside(r.getPressure(), MIN_PRESSURE, MAX_PRESSURE)) {
            return "pressure " + r.getPressure() + " outside [" + MIN_PRESSURE + ", " + MAX_PRESSURE + "]";
        }
        if (outside(r.getWindSpeed(), MIN_WIND_SPEED, MAX_WIND_SPEED)) {
            return "wind_speed " + r.getWindSpeed() + " outside [" + MIN_WIND_SPEED + ", " + MAX_WIND_SPEED + "]";
        }
        if (outside(r.getRainfall(), MIN_RAINFALL, MAX_RAINFALL)) {
            return "rainfall " + r.getRainfall() + " outside [" + MIN_RAINFALL + ", " + MAX_RAINFALL + "]";
        }
        if (r.getLatitude() != null && outside(r.getLatitude(), -90.0, 90.0)) {
            return "lat " + r.getLatitude() + " outside [-90, 90]";
        }
        if (r.getLongitude() != null && outside(r.getLongitude(), -180.0, 180.0)) {
            return "lon " + r.getLongitude() + " outside [-180, 180]";
        }
        return null;
    }

    /**
     * 解析ISO-8601时间戳；不带时区偏移的按UTC处理
     */
    static OffsetDateTime parseTimestamp(String text) {
        String normalized = text.indexOf('T') < 0 ? text.replaceFirst(" ", "T") : text;
        try {
            return OffsetDateTime.parse(normalized);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(normalized).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private double parseRequired(String field, String text) {
        return parseNumber(field, text.trim());
    }

    private Double parseOptional(String field, String text) {
        if (isBlank(text)) return null;
        return parseNumber(field, text.trim());
    }

    private double parseNumber(String field, String text) {
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " is not a number: '" + text + "'");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " is not finite: '" + text + "'");
        }
        return value;
    }

    private boolean parseFlag(String text) {
        if (isBlank(text)) return false;
        String v = text.trim().toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("yes");
    }

    private static boolean outside(double value, double min, double max) {
        return value < min || value > max;
    }

    private static double orDefault(Double value, double defaultValue) {
        return value != null ? value : defaultValue;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private static String textOrNull(String s) {
        return isBlank(s) ? null : s.trim();
    }

    private static String textOrDefault(String s, String defaultValue) {
        return isBlank(s) ? defaultValue : s.trim();
    }
}
