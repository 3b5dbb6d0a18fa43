package com.pipeline.weather.core.imp;

import com.pipeline.weather.core.CycleInterruptedException;
import com.pipeline.weather.core.DimensionResolver;
import com.pipeline.weather.core.WarehouseException;
import com.pipeline.weather.core.WarehouseStorage;
import com.pipeline.weather.core.WarehouseUnavailableException;
import com.pipeline.weather.model.AnnotatedReading;
import com.pipeline.weather.model.DimensionKeys;
import com.pipeline.weather.model.DimensionKind;
import com.pipeline.weather.model.LoadResult;
import com.pipeline.weather.storage.SQLiteWarehouseStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.pipeline.weather.ReadingFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DefaultFactLoaderTest {

    @TempDir
    Path tempDir;

    private static final DimensionKeys KEYS = new DimensionKeys(1L, 1L, 1L, 1L);

    private List<AnnotatedReading> series(String sensorId, int count) {
        List<AnnotatedReading> readings = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            readings.add(annotated(sensorId, T0.plusSeconds(5L * i), 20.0 + i % 3));
        }
        return readings;
    }

    // ==================== 真实仓库 ====================

    @Test
    void load_SameReadingsTwice_SecondLoadAllConflicts() {
        // Given
        SQLiteWarehouseStorage storage = new SQLiteWarehouseStorage(tempDir.resolve("warehouse.db").toString());
        DefaultDimensionResolver resolver = new DefaultDimensionResolver(storage);
        resolver.seedStatuses();
        DefaultFactLoader loader = new DefaultFactLoader(storage, resolver, new WriteRetrier(3, 1), 100, CLOCK);
        List<AnnotatedReading> readings = series("S1", 3);

        try {
            // When
            LoadResult first = loader.load(readings);
            LoadResult second = loader.load(readings);

            // Then
            assertThat(first.getInserted()).isEqualTo(3);
            assertThat(second.getInserted()).isZero();
            assertThat(second.getConflicts()).isEqualTo(3);
            assertThat(storage.countFacts()).isEqualTo(3);
        } finally {
            storage.shutdown();
        }
    }

    @Test
    void load_ReadingWithoutLatitudeForNewCity_CountedAsFailed() {
        // Given
        SQLiteWarehouseStorage storage = new SQLiteWarehouseStorage(tempDir.resolve("warehouse.db").toString());
        DefaultDimensionResolver resolver = new DefaultDimensionResolver(storage);
        DefaultFactLoader loader = new DefaultFactLoader(storage, resolver, new WriteRetrier(3, 1), 100, CLOCK);
        List<AnnotatedReading> readings = series("S1", 2);
        AnnotatedReading noLat = annotated("S2", T0, 25.0);
        noLat.getReading().setCity("Alexandria");
        noLat.getReading().setLatitude(null);
        readings.add(noLat);

        try {
            // When
            LoadResult result = loader.load(readings);

            // Then
            assertThat(result.getInserted()).isEqualTo(2);
            assertThat(result.getFailed()).isEqualTo(1);
            assertThat(result.total()).isEqualTo(readings.size());
            assertThat(storage.findDimensionId(DimensionKind.LOCATION, "Alexandria")).isNull();
        } finally {
            storage.shutdown();
        }
    }

    @Test
    void load_InterruptedDuringBusyBackoff_TransactionRolledBackAndLockReleased() {
        // Given: 插入总是报 busy，线程已被中断，退避等待立即失败
        String path = tempDir.resolve("warehouse.db").toString();
        SQLiteWarehouseStorage storage = new SQLiteWarehouseStorage(path) {
            @Override
            public synchronized boolean insertFact(AnnotatedReading annotated, DimensionKeys keys,
                                                   Instant ingestedAt) {
                throw new WarehouseException("database is locked", null, true);
            }
        };
        DefaultDimensionResolver resolver = new DefaultDimensionResolver(storage);
        DefaultFactLoader loader = new DefaultFactLoader(storage, resolver, new WriteRetrier(3, 1000), 100, CLOCK);
        SQLiteWarehouseStorage other = null;

        try {
            Thread.currentThread().interrupt();

            // When
            assertThatThrownBy(() -> loader.load(series("S1", 1)))
                    .isInstanceOf(CycleInterruptedException.class);
            Thread.interrupted();

            // Then: 另一个连接可以立即写入，未提交的维度行已回滚
            other = new SQLiteWarehouseStorage(path);
            new DefaultDimensionResolver(other).resolveAll(annotated("S9", T0.plusHours(1), 20.0));
            assertThat(other.countDimensionRows(DimensionKind.SENSOR)).isEqualTo(1);
            assertThat(storage.findDimensionId(DimensionKind.SENSOR, "S1")).isNull();
        } finally {
            Thread.interrupted();
            if (other != null) {
                other.shutdown();
            }
            storage.shutdown();
        }
    }

    // ==================== 模拟仓库 ====================

    @Test
    void load_MoreReadingsThanBatchSize_OneTransactionPerBatch() {
        // Given
        WarehouseStorage storage = mock(WarehouseStorage.class);
        DimensionResolver resolver = mock(DimensionResolver.class);
        when(resolver.resolveAll(any())).thenReturn(KEYS);
        when(storage.insertFact(any(), any(), any())).thenReturn(true);
        DefaultFactLoader loader = new DefaultFactLoader(storage, resolver, new WriteRetrier(0, 1), 100, CLOCK);

        // When
        LoadResult result = loader.load(series("S1", 250));

        // Then
        assertThat(result.getInserted()).isEqualTo(250);
        verify(storage, times(3)).beginBatch();
        verify(storage, times(3)).commitBatch();
        verify(storage, never()).rollbackBatch();
    }

    @Test
    void load_CommitFails_WholeBatchFailedAndCacheInvalidated() {
        // Given
        WarehouseStorage storage = mock(WarehouseStorage.class);
        DimensionResolver resolver = mock(DimensionResolver.class);
        when(resolver.resolveAll(any())).thenReturn(KEYS);
        when(storage.insertFact(any(), any(), any())).thenReturn(true);
        doThrow(new WarehouseException("disk I/O error", null)).when(storage).commitBatch();
        when(storage.isAvailable()).thenReturn(true);
        DefaultFactLoader loader = new DefaultFactLoader(storage, resolver, new WriteRetrier(0, 1), 100, CLOCK);

        // When
        LoadResult result = loader.load(series("S1", 4));

        // Then
        assertThat(result.getInserted()).isZero();
        assertThat(result.getFailed()).isEqualTo(4);
        verify(storage).rollbackBatch();
        verify(resolver).invalidateCache();
    }

    @Test
    void load_CommitFailsAndWarehouseGone_ThrowsUnavailable() {
        // Given
        WarehouseStorage storage = mock(WarehouseStorage.class);
        DimensionResolver resolver = mock(DimensionResolver.class);
        when(resolver.resolveAll(any())).thenReturn(KEYS);
        when(storage.insertFact(any(), any(), any())).thenReturn(true);
        doThrow(new WarehouseException("disk I/O error", null)).when(storage).commitBatch();
        when(storage.isAvailable()).thenReturn(false);
        DefaultFactLoader loader = new DefaultFactLoader(storage, resolver, new WriteRetrier(0, 1), 100, CLOCK);

        // When / Then
        assertThatThrownBy(() -> loader.load(series("S1", 2)))
                .isInstanceOf(WarehouseUnavailableException.class);
        verify(storage).rollbackBatch();
        verify(resolver).invalidateCache();
    }

    @Test
    void load_InsertBusyOnce_RetriedAndInserted() {
        // Given
        WarehouseStorage storage = mock(WarehouseStorage.class);
        DimensionResolver resolver = mock(DimensionResolver.class);
        when(resolver.resolveAll(any())).thenReturn(KEYS);
        when(storage.insertFact(any(), any(), any()))
                .thenThrow(new WarehouseException("database is locked", null, true))
                .thenReturn(true);
        DefaultFactLoader loader = new DefaultFactLoader(storage, resolver, new WriteRetrier(3, 1), 100, CLOCK);

        // When
        LoadResult result = loader.load(series("S1", 1));

        // Then
        assertThat(result.getInserted()).isEqualTo(1);
        verify(storage, times(2)).insertFact(any(), any(), any());
    }

    @Test
    void load_SingleInsertFailsWhileWarehouseUp_OnlyThatReadingFailed() {
        // Given
        WarehouseStorage storage = mock(WarehouseStorage.class);
        DimensionResolver resolver = mock(DimensionResolver.class);
        when(resolver.resolveAll(any())).thenReturn(KEYS);
        when(storage.insertFact(any(), any(), any()))
                .thenReturn(true)
                .thenThrow(new WarehouseException("constraint failed", null))
                .thenReturn(true);
        when(storage.isAvailable()).thenReturn(true);
        DefaultFactLoader loader = new DefaultFactLoader(storage, resolver, new WriteRetrier(3, 1), 100, CLOCK);

        // When
        LoadResult result = loader.load(series("S1", 3));

        // Then
        assertThat(result.getInserted()).isEqualTo(2);
        assertThat(result.getFailed()).isEqualTo(1);
        verify(storage).commitBatch();
    }

    @Test
    void load_UnexpectedRuntimeError_RollsBackAndRethrows() {
        // Given
        WarehouseStorage storage = mock(WarehouseStorage.class);
        DimensionResolver resolver = mock(DimensionResolver.class);
        when(resolver.resolveAll(any())).thenThrow(new IllegalArgumentException("Unknown column 'x'"));
        DefaultFactLoader loader = new DefaultFactLoader(storage, resolver, new WriteRetrier(0, 1), 100, CLOCK);

        // When / Then
        assertThatThrownBy(() -> loader.load(series("S1", 2)))
                .isInstanceOf(IllegalArgumentException.class);
        verify(storage).beginBatch();
        verify(storage).rollbackBatch();
        verify(storage, never()).commitBatch();
        verify(resolver).invalidateCache();
    }

    @Test
    void constructor_NonPositiveBatchSize_Rejected() {
        assertThatThrownBy(() -> new DefaultFactLoader(mock(WarehouseStorage.class),
                mock(DimensionResolver.class), new WriteRetrier(0, 1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
