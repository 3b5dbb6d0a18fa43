package com.pipeline.weather.core.imp;

import com.pipeline.weather.core.AnomalyDetector;
import com.pipeline.weather.core.AnomalyRule;
import com.pipeline.weather.model.AnnotatedReading;
import com.pipeline.weather.model.AnomalyAnnotation;
import com.pipeline.weather.model.AnomalyType;
import com.pipeline.weather.model.ValidatedReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 异常检测器默认实现。
 * 规则按异常类型的声明顺序排列，同一读数被多条规则命中时取最先命中者。
 */
public class DefaultAnomalyDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(DefaultAnomalyDetector.class);

    private final List<AnomalyRule> rules;

    public DefaultAnomalyDetector(List<AnomalyRule> rules) {
        List<AnomalyRule> ordered = new ArrayList<>(rules);
        ordered.sort(Comparator.comparingInt(r -> r.getType().ordinal()));
        this.rules = Collections.unmodifiableList(ordered);
    }

    @Override
    public List<AnnotatedReading> detect(List<ValidatedReading> readings) {
        // 按传感器分组，组内按时间排序
        Map<String, List<ValidatedReading>> groups = new TreeMap<>();
        for (ValidatedReading r : readings) {
            groups.computeIfAbsent(r.getSensorId(), k -> new ArrayList<>()).add(r);
        }

        List<AnnotatedReading> result = new ArrayList<>(readings.size());
        for (Map.Entry<String, List<ValidatedReading>> entry : groups.entrySet()) {
            List<ValidatedReading> group = entry.getValue();
            group.sort(Comparator.comparingLong(ValidatedReading::getEpochMillis));

            AnomalyType[] types = new AnomalyType[group.size()];
            for (AnomalyRule rule : rules) {
                boolean[] flags = rule.evaluate(group);
                for (int i = 0; i < types.length; i++) {
                    if (types[i] == null && flags[i]) {
                        types[i] = rule.getType();
                    }
                }
            }

            int flagged = 0;
            for (int i = 0; i < group.size(); i++) {
                if (types[i] != null) flagged++;
                result.add(new AnnotatedReading(group.get(i), AnomalyAnnotation.of(types[i])));
            }
            if (flagged > 0) {
                log.debug("Sensor {}: {} of {} readings flagged", entry.getKey(), flagged, group.size());
            }
        }
        return result;
    }

    public List<AnomalyRule> getRules() { return rules; }
}
