package com.pipeline.weather.operators;

import com.pipeline.weather.model.ValidatedReading;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.pipeline.weather.ReadingFixtures.T0;
import static com.pipeline.weather.ReadingFixtures.reading;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpikeDetectionOperatorTest {

    private final SpikeDetectionOperator operator = new SpikeDetectionOperator();

    @Test
    void evaluate_NineNormalOneOutlier_OnlyOutlierFlagged() {
        // Given: 9个20.0和1个100.0，100.0的z值恰为3
        List<ValidatedReading> group = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            group.add(reading("S1", T0.plusSeconds(5L * i), 20.0));
        }
        group.add(reading("S1", T0.plusSeconds(45), 100.0));

        // When
        boolean[] flags = operator.evaluate(group);

        // Then
        for (int i = 0; i < 9; i++) {
            assertThat(flags[i]).as("reading %d", i).isFalse();
        }
        assertThat(flags[9]).isTrue();
    }

    @Test
    void evaluate_PressureOutlier_Flagged() {
        List<ValidatedReading> group = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            group.add(reading("S1", T0.plusSeconds(5L * i), 20.0));
        }
        group.get(4).setPressure(1090.0);

        boolean[] flags = operator.evaluate(group);

        assertThat(flags[4]).isTrue();
        assertThat(flags[3]).isFalse();
    }

    @Test
    void evaluate_ConstantValues_NothingFlagged() {
        List<ValidatedReading> group = List.of(
                reading("S1", T0, 20.0),
                reading("S1", T0.plusSeconds(5), 20.0),
                reading("S1", T0.plusSeconds(10), 20.0));

        assertThat(operator.evaluate(group)).containsOnly(false);
    }

    @Test
    void evaluate_SingleReading_NothingFlagged() {
        assertThat(operator.evaluate(List.of(reading("S1", T0, 55.0)))).containsExactly(false);
    }

    @Test
    void evaluate_EmptyGroup_ReturnsEmptyArray() {
        assertThat(operator.evaluate(List.of())).isEmpty();
    }

    @Test
    void constructor_NonPositiveThreshold_Rejected() {
        assertThatThrownBy(() -> new SpikeDetectionOperator(0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
