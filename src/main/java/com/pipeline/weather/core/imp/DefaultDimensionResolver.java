package com.pipeline.weather.core.imp;

import com.pipeline.weather.core.DimensionResolutionException;
import com.pipeline.weather.core.DimensionResolver;
import com.pipeline.weather.core.WarehouseException;
import com.pipeline.weather.core.WarehouseStorage;
import com.pipeline.weather.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 维度解析器默认实现。
 *
 * 解析流程：缓存 → 按自然键查询 → 校验必填属性 → INSERT ON CONFLICT DO NOTHING → 再查询。
 * 已存在的维度行直接复用，不校验也不覆盖其属性（先写者胜）。
 */
public class DefaultDimensionResolver implements DimensionResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultDimensionResolver.class);

    /** 预置状态码及说明 */
    static final Map<String, String> SEED_STATUSES = new LinkedHashMap<>();

    static {
        SEED_STATUSES.put("OK", "Normal reading");
        SEED_STATUSES.put("SPIKE", "Sudden spike against sensor baseline");
        SEED_STATUSES.put("STUCK", "Sensor value stuck");
        SEED_STATUSES.put("DROPOUT", "Gap in the reading sequence");
        SEED_STATUSES.put("RECOVERED", "Recovered after a fault");
        SEED_STATUSES.put("DEGRADED", "Degraded reading accuracy");
    }

    /** 各维度必填属性 */
    private static final Map<DimensionKind, List<String>> REQUIRED_ATTRIBUTES = new EnumMap<>(DimensionKind.class);

    static {
        REQUIRED_ATTRIBUTES.put(DimensionKind.TIME, List.of());
        REQUIRED_ATTRIBUTES.put(DimensionKind.SENSOR, List.of("sensor_type"));
        REQUIRED_ATTRIBUTES.put(DimensionKind.LOCATION, List.of("country", "lat", "lon"));
        REQUIRED_ATTRIBUTES.put(DimensionKind.STATUS, List.of());
    }

    private final WarehouseStorage storage;

    /** 代理键缓存：维度 -> (存储自然键 -> 代理键) */
    private final Map<DimensionKind, ConcurrentHashMap<String, Long>> caches = new EnumMap<>(DimensionKind.class);

    public DefaultDimensionResolver(WarehouseStorage storage) {
        this.storage = storage;
        for (DimensionKind kind : DimensionKind.values()) {
            caches.put(kind, new ConcurrentHashMap<>());
        }
    }

    @Override
    public long resolve(DimensionKind kind, String naturalKey, Map<String, Object> attributes) {
        if (naturalKey == null || naturalKey.trim().isEmpty()) {
            throw new DimensionResolutionException(kind, "natural key is empty");
        }

        Map<String, Object> attrs = new LinkedHashMap<>(attributes);
        String storageKey = naturalKey;
        if (kind == DimensionKind.TIME) {
            OffsetDateTime ts = DefaultRecordValidator.parseTimestamp(naturalKey);
            if (ts == null) {
                throw new DimensionResolutionException(kind, "unparseable timestamp '" + naturalKey + "'");
            }
            storageKey = String.valueOf(ts.toInstant().toEpochMilli());
            attrs = timeAttributes(ts);
        }

        ConcurrentHashMap<String, Long> cache = caches.get(kind);
        Long cached = cache.get(storageKey);
        if (cached != null) {
            return cached;
        }

        Long id = storage.findDimensionId(kind, storageKey);
        if (id == null) {
            checkRequired(kind, naturalKey, attrs);
            if (kind == DimensionKind.STATUS && attrs.get("description") == null) {
                attrs.put("description", titleCase(naturalKey));
            }
            storage.insertDimensionIfAbsent(kind, storageKey, attrs);
            id = storage.findDimensionId(kind, storageKey);
            if (id == null) {
                throw new WarehouseException(kind + " row '" + naturalKey + "' not visible after insert", null);
            }
        }

        cache.put(storageKey, id);
        return id;
    }

    @Override
    public DimensionKeys resolveAll(AnnotatedReading annotated) {
        ValidatedReading r = annotated.getReading();

        long timeId = resolve(DimensionKind.TIME, r.getTimestamp().toString(), Collections.emptyMap());

        Map<String, Object> sensorAttrs = new LinkedHashMap<>();
        sensorAttrs.put("sensor_type", r.getSensorType());
        sensorAttrs.put("sensor_model", r.getSensorModel());
        sensorAttrs.put("manufacturer", r.getManufacturer());
        sensorAttrs.put("firmware_version", r.getFirmwareVersion());
        sensorAttrs.put("is_active", Boolean.TRUE);
        long sensorKey = resolve(DimensionKind.SENSOR, r.getSensorId(), sensorAttrs);

        Map<String, Object> locationAttrs = new LinkedHashMap<>();
        locationAttrs.put("region", r.getRegion());
        locationAttrs.put("country", r.getCountry());
        locationAttrs.put("lat", r.getLatitude());
        locationAttrs.put("lon", r.getLongitude());
        locationAttrs.put("altitude", r.getAltitude());
        locationAttrs.put("location_code", locationCode(r.getCity()));
        long locationId = resolve(DimensionKind.LOCATION, r.getCity(), locationAttrs);

        String statusCode = annotated.effectiveStatusCode();
        Map<String, Object> statusAttrs = new LinkedHashMap<>();
        statusAttrs.put("description", SEED_STATUSES.get(statusCode));
        long statusId = resolve(DimensionKind.STATUS, statusCode, statusAttrs);

        return new DimensionKeys(timeId, sensorKey, locationId, statusId);
    }

    @Override
    public boolean setSensorActive(String sensorId, boolean active) {
        boolean updated = storage.updateSensorActive(sensorId, active);
        if (updated) {
            log.info("Sensor {} marked {}", sensorId, active ? "active" : "inactive");
        } else {
            log.warn("Cannot change active flag of unknown sensor {}", sensorId);
        }
        return updated;
    }

    @Override
    public void seedStatuses() {
        for (Map.Entry<String, String> e : SEED_STATUSES.entrySet()) {
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put("description", e.getValue());
            resolve(DimensionKind.STATUS, e.getKey(), attrs);
        }
        log.info("Status dimension seeded with {} codes.", SEED_STATUSES.size());
    }

    @Override
    public void invalidateCache() {
        for (ConcurrentHashMap<String, Long> cache : caches.values()) {
            cache.clear();
        }
        log.debug("Dimension caches invalidated.");
    }

    private void checkRequired(DimensionKind kind, String naturalKey, Map<String, Object> attrs) {
        for (String name : REQUIRED_ATTRIBUTES.get(kind)) {
            Object value = attrs.get(name);
            if (value == null || (value instanceof String && ((String) value).trim().isEmpty())) {
                throw new DimensionResolutionException(kind,
                        "missing required attribute '" + name + "' for '" + naturalKey + "'");
            }
        }
    }

    /**
     * 时间维度属性，日历字段取读数自带的时区偏移
     */
    static Map<String, Object> timeAttributes(OffsetDateTime ts) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("ts_iso", ts.toString());
        attrs.put("date", ts.toLocalDate().toString());
        attrs.put("year", ts.getYear());
        attrs.put("month", ts.getMonthValue());
        attrs.put("day", ts.getDayOfMonth());
        attrs.put("hour", ts.getHour());
        attrs.put("minute", ts.getMinute());
        attrs.put("second", ts.getSecond());
        attrs.put("day_of_week", ts.getDayOfWeek().getValue());
        attrs.put("is_weekend", ts.getDayOfWeek() == DayOfWeek.SATURDAY || ts.getDayOfWeek() == DayOfWeek.SUNDAY);
        return attrs;
    }

    /** 城市名前三个字母大写 */
    static String locationCode(String city) {
        StringBuilder code = new StringBuilder(3);
        for (char c : city.toCharArray()) {
            if (Character.isLetter(c)) {
                code.append(Character.toUpperCase(c));
                if (code.length() == 3) break;
            }
        }
        return code.toString();
    }

    static String titleCase(String code) {
        StringBuilder sb = new StringBuilder();
        for (String word : code.toLowerCase(Locale.ROOT).split("[_\\s]+")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}
