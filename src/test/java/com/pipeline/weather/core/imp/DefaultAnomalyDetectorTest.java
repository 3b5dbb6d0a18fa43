package com.pipeline.weather.core.imp;

import com.pipeline.weather.core.AnomalyRule;
import com.pipeline.weather.model.AnnotatedReading;
import com.pipeline.weather.model.AnomalyType;
import com.pipeline.weather.model.ValidatedReading;
import com.pipeline.weather.operators.DropoutDetectionOperator;
import com.pipeline.weather.operators.SpikeDetectionOperator;
import com.pipeline.weather.operators.StuckSensorOperator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.pipeline.weather.ReadingFixtures.T0;
import static com.pipeline.weather.ReadingFixtures.reading;
import static org.assertj.core.api.Assertions.assertThat;

class DefaultAnomalyDetectorTest {

    private final DefaultAnomalyDetector detector = new DefaultAnomalyDetector(List.of(
            new DropoutDetectionOperator(),
            new StuckSensorOperator(),
            new SpikeDetectionOperator()));

    @Test
    void constructor_RulesOrderedByAnomalyType() {
        assertThat(detector.getRules()).extracting(AnomalyRule::getType)
                .containsExactly(AnomalyType.SPIKE, AnomalyType.STUCK, AnomalyType.DROPOUT);
    }

    @Test
    void detect_UnorderedInput_GroupedBySensorAndSortedByTime() {
        // Given
        List<ValidatedReading> input = List.of(
                reading("S2", T0.plusSeconds(5), 20.0),
                reading("S1", T0.plusSeconds(5), 20.5),
                reading("S2", T0, 20.1),
                reading("S1", T0, 20.2));

        // When
        List<AnnotatedReading> result = detector.detect(input);

        // Then
        assertThat(result).extracting(r -> r.getReading().getSensorId() + "@" + r.getReading().getTimestamp().getSecond())
                .containsExactly("S1@0", "S1@5", "S2@0", "S2@5");
        assertThat(result).noneMatch(r -> r.getAnnotation().isAnomaly());
    }

    @Test
    void detect_FiveStuckReadingsThenChange_StuckFlaggedOnly() {
        // Given
        List<ValidatedReading> input = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            input.add(reading("S1", T0.plusSeconds(5L * i), 22.0));
        }
        input.add(reading("S1", T0.plusSeconds(25), 22.1));

        // When
        List<AnnotatedReading> result = detector.detect(input);

        // Then
        assertThat(result).extracting(r -> r.getAnnotation().getType())
                .containsExactly(AnomalyType.STUCK, AnomalyType.STUCK, AnomalyType.STUCK,
                        AnomalyType.STUCK, AnomalyType.STUCK, null);
    }

    @Test
    void detect_ReadingMatchingSeveralRules_FirstRuleWins() {
        // Given: 最后一条既是尖峰又在空档之后
        List<ValidatedReading> input = new ArrayList<>();
        double[] temps = {20.0, 20.1, 19.9, 20.0, 20.2, 19.8, 20.0, 20.1, 19.9};
        for (int i = 0; i < 19; i++) {
            input.add(reading("S1", T0.plusSeconds(5L * i), temps[i % temps.length]));
        }
        input.add(reading("S1", T0.plusSeconds(150), 45.0));

        // When
        List<AnnotatedReading> result = detector.detect(input);

        // Then
        assertThat(result.get(19).getAnnotation().getType()).isEqualTo(AnomalyType.SPIKE);
        assertThat(result.subList(0, 19)).noneMatch(r -> r.getAnnotation().isAnomaly());
    }

    @Test
    void detect_GapInSeries_DropoutFlagged() {
        List<AnnotatedReading> result = detector.detect(Arrays.asList(
                reading("S1", T0, 20.0),
                reading("S1", T0.plusSeconds(60), 20.4)));

        assertThat(result.get(0).getAnnotation().isAnomaly()).isFalse();
        assertThat(result.get(1).getAnnotation().getType()).isEqualTo(AnomalyType.DROPOUT);
        assertThat(result.get(1).effectiveStatusCode()).isEqualTo("DROPOUT");
    }

    @Test
    void detect_EmptyInput_ReturnsEmpty() {
        assertThat(detector.detect(List.of())).isEmpty();
    }
}
