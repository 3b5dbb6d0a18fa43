package com.pipeline.weather.core.imp;

import com.pipeline.weather.model.AggregationResult;
import com.pipeline.weather.model.AnnotatedReading;
import com.pipeline.weather.model.AnomalyAnnotation;
import com.pipeline.weather.model.AnomalyType;
import com.pipeline.weather.model.HourlyAggregate;
import com.pipeline.weather.model.ValidatedReading;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static com.pipeline.weather.ReadingFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DefaultAggregatorTest {

    private final DefaultAggregator aggregator = new DefaultAggregator(CLOCK);

    @Test
    void aggregate_ThreeReadingsInOneHour_StatisticsComputed() {
        // Given
        List<AnnotatedReading> readings = List.of(
                annotated("S1", T0, 18.0),
                annotated("S1", T0.plusMinutes(20), 20.0),
                annotated("S1", T0.plusMinutes(40), 22.0));

        // When
        AggregationResult result = aggregator.aggregate(readings);

        // Then
        assertThat(result.getFailedBuckets()).isZero();
        assertThat(result.getAggregates()).hasSize(1);
        HourlyAggregate agg = result.getAggregates().get(0);
        assertThat(agg.getBucketStart()).isEqualTo(Instant.parse("2024-06-01T11:00:00Z"));
        assertThat(agg.getReadingsCount()).isEqualTo(3);
        assertThat(agg.getTemperature().getMean()).isCloseTo(20.0, within(1e-9));
        assertThat(agg.getTemperature().getMin()).isEqualTo(18.0);
        assertThat(agg.getTemperature().getMax()).isEqualTo(22.0);
        assertThat(agg.getTemperature().getStddev()).isCloseTo(Math.sqrt(8.0 / 3.0), within(1e-9));
        assertThat(agg.getHumidity().getStddev()).isZero();
        assertThat(agg.getComputedAt()).isEqualTo(NOW);
    }

    @Test
    void aggregate_DifferentHoursSensorsAndCities_SeparateBuckets() {
        // Given
        ValidatedReading alexandria = reading("S1", T0.plusMinutes(10), 24.0);
        alexandria.setCity("Alexandria");
        List<AnnotatedReading> readings = List.of(
                annotated("S1", T0, 20.0),
                annotated("S1", T0.plusMinutes(59).plusSeconds(59), 21.0),
                annotated("S1", T0.plusHours(1), 22.0),
                annotated("S2", T0, 23.0),
                new AnnotatedReading(alexandria, AnomalyAnnotation.none()));

        // When
        List<HourlyAggregate> aggregates = aggregator.aggregate(readings).getAggregates();

        // Then
        assertThat(aggregates).hasSize(4);
        assertThat(aggregates).extracting(HourlyAggregate::getReadingsCount).containsExactly(1, 2, 1, 1);
        assertThat(aggregates.get(0).getCity()).isEqualTo("Alexandria");
        assertThat(aggregates.get(3).getBucketStart()).isEqualTo(Instant.parse("2024-06-01T12:00:00Z"));
    }

    @Test
    void aggregate_AnomaliesAndRainfall_CountedAndSummed() {
        // Given
        ValidatedReading wet = reading("S1", T0.plusMinutes(5), 20.0);
        wet.setRainfall(2.5);
        ValidatedReading wetter = reading("S1", T0.plusMinutes(10), 20.0);
        wetter.setRainfall(1.0);
        List<AnnotatedReading> readings = List.of(
                annotated("S1", T0, 20.0),
                annotated(wet, AnomalyType.SPIKE),
                annotated(wetter, AnomalyType.STUCK));

        // When
        HourlyAggregate agg = aggregator.aggregate(readings).getAggregates().get(0);

        // Then
        assertThat(agg.getAnomalyCount()).isEqualTo(2);
        assertThat(agg.getTotalRainfall()).isCloseTo(3.5, within(1e-9));
    }

    @Test
    void aggregate_NonFiniteValue_BucketSkippedOthersKept() {
        // Given
        ValidatedReading broken = reading("S2", T0, 20.0);
        broken.setPressure(Double.NaN);
        List<AnnotatedReading> readings = List.of(
                annotated("S1", T0, 20.0),
                new AnnotatedReading(broken, AnomalyAnnotation.none()));

        // When
        AggregationResult result = aggregator.aggregate(readings);

        // Then
        assertThat(result.getFailedBuckets()).isEqualTo(1);
        assertThat(result.getAggregates()).extracting(HourlyAggregate::getSensorId).containsExactly("S1");
    }

    @Test
    void aggregate_EmptyInput_NoBuckets() {
        AggregationResult result = aggregator.aggregate(Collections.emptyList());

        assertThat(result.getAggregates()).isEmpty();
        assertThat(result.getFailedBuckets()).isZero();
    }

    @Test
    void hourStart_AlignsToUtcHour() {
        long ms = Instant.parse("2024-06-01T11:59:59.999Z").toEpochMilli();

        assertThat(DefaultAggregator.hourStart(ms)).isEqualTo(Instant.parse("2024-06-01T11:00:00Z").toEpochMilli());
    }
}
