package com.pipeline.weather.core.imp;

import com.pipeline.weather.core.CycleExecutor;
import com.pipeline.weather.core.WarehouseUnavailableException;
import com.pipeline.weather.model.CycleState;
import com.pipeline.weather.model.CycleSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultCycleSchedulerTest {

    @Mock private CycleExecutor executor;

    private DefaultCycleScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    /** 模拟一个依次经历三个阶段的正常周期 */
    private static CycleSummary completeCycle(InvocationOnMock invocation) {
        long cycleNumber = invocation.getArgument(0);
        Consumer<CycleState> callback = invocation.getArgument(1);
        callback.accept(CycleState.EXTRACTING);
        callback.accept(CycleState.TRANSFORMING);
        callback.accept(CycleState.LOADING);
        return new CycleSummary(cycleNumber, Instant.now());
    }

    @Test
    void runOnce_NormalCycle_WalksThroughAllStates() {
        // Given
        when(executor.runCycle(anyLong(), any())).thenAnswer(DefaultCycleSchedulerTest::completeCycle);
        scheduler = new DefaultCycleScheduler(executor, 60_000, 5_000, 600_000);
        List<CycleState> visited = new CopyOnWriteArrayList<>();
        scheduler.addStateListener((from, to) -> visited.add(to));

        // When
        CycleSummary summary = scheduler.runOnce();

        // Then
        assertThat(summary.isAborted()).isFalse();
        assertThat(summary.getCycleNumber()).isEqualTo(1);
        assertThat(visited).containsExactly(CycleState.EXTRACTING, CycleState.TRANSFORMING,
                CycleState.LOADING, CycleState.SLEEPING);
        assertThat(scheduler.getState()).isEqualTo(CycleState.SLEEPING);
    }

    @Test
    void runOnce_WarehouseUnavailable_AbortedThenSleeping() {
        // Given
        when(executor.runCycle(anyLong(), any()))
                .thenThrow(new WarehouseUnavailableException("Warehouse is not reachable", null));
        scheduler = new DefaultCycleScheduler(executor, 60_000, 5_000, 600_000);
        List<CycleState> visited = new CopyOnWriteArrayList<>();
        scheduler.addStateListener((from, to) -> visited.add(to));

        // When
        CycleSummary summary = scheduler.runOnce();

        // Then
        assertThat(summary.isAborted()).isTrue();
        assertThat(summary.getAbortReason()).contains("WarehouseUnavailableException");
        assertThat(visited).containsExactly(CycleState.EXTRACTING, CycleState.ABORTING, CycleState.SLEEPING);
    }

    @Test
    void runOnce_CycleExceedsSoftTimeout_AbortedAndWorkerInterrupted() throws InterruptedException {
        // Given
        CountDownLatch interrupted = new CountDownLatch(1);
        when(executor.runCycle(anyLong(), any())).thenAnswer(invocation -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        });
        scheduler = new DefaultCycleScheduler(executor, 1_000, 100, 10_000);

        // When
        CycleSummary summary = scheduler.runOnce();

        // Then
        assertThat(summary.isAborted()).isTrue();
        assertThat(summary.getAbortReason()).contains("soft timeout");
        assertThat(scheduler.getState()).isEqualTo(CycleState.SLEEPING);
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    /** 忽略中断、持续运行约 1.5 秒的周期 */
    private static CycleSummary ignoreInterrupts(InvocationOnMock invocation, AtomicInteger interrupts) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(1_500);
        while (System.nanoTime() < deadline) {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                interrupts.incrementAndGet();
            }
        }
        long cycleNumber = invocation.getArgument(0);
        return new CycleSummary(cycleNumber, Instant.now());
    }

    @Test
    void start_TimedOutWorkerIgnoresInterrupt_NoNewCycleUntilItExits() throws InterruptedException {
        // Given
        AtomicInteger interrupts = new AtomicInteger();
        CountDownLatch secondCycle = new CountDownLatch(1);
        when(executor.runCycle(anyLong(), any()))
                .thenAnswer(invocation -> ignoreInterrupts(invocation, interrupts))
                .thenAnswer(invocation -> {
                    secondCycle.countDown();
                    return completeCycle(invocation);
                });
        scheduler = new DefaultCycleScheduler(executor, 100, 200, 1_000);

        // When
        scheduler.start();
        Thread.sleep(800);

        // Then: 第一个周期已超时，但工作线程仍在运行，不会再开始新周期
        assertThat(interrupts.get()).isPositive();
        assertThat(scheduler.isWorkerBusy()).isTrue();
        assertThat(scheduler.getCycleCount()).isEqualTo(1);
        verify(executor, times(1)).runCycle(anyLong(), any());

        // Then: 工作线程退出后恢复调度
        assertThat(secondCycle.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.getCycleCount()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void runOnce_PreviousTimedOutCycleStillRunning_Throws() {
        // Given
        when(executor.runCycle(anyLong(), any()))
                .thenAnswer(invocation -> ignoreInterrupts(invocation, new AtomicInteger()));
        scheduler = new DefaultCycleScheduler(executor, 1_000, 100, 10_000);
        CycleSummary first = scheduler.runOnce();

        // When / Then
        assertThat(first.isAborted()).isTrue();
        assertThatThrownBy(() -> scheduler.runOnce())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("still running");
    }

    @Test
    void transitionTo_InvalidTransition_RejectedAndStateUnchanged() {
        // Given
        scheduler = new DefaultCycleScheduler(executor, 60_000, 5_000, 600_000);

        // When
        boolean accepted = scheduler.transitionTo(CycleState.LOADING);

        // Then
        assertThat(accepted).isFalse();
        assertThat(scheduler.getState()).isEqualTo(CycleState.IDLE);
    }

    @Test
    void transitionTo_ListenerThrows_TransitionStillApplied() {
        // Given
        scheduler = new DefaultCycleScheduler(executor, 60_000, 5_000, 600_000);
        scheduler.addStateListener((from, to) -> {
            throw new IllegalStateException("listener failure");
        });

        // When / Then
        assertThat(scheduler.transitionTo(CycleState.EXTRACTING)).isTrue();
        assertThat(scheduler.getState()).isEqualTo(CycleState.EXTRACTING);
    }

    @Test
    void start_LoopRunsCyclesUntilShutdown() throws InterruptedException {
        // Given
        CountDownLatch threeCycles = new CountDownLatch(3);
        when(executor.runCycle(anyLong(), any())).thenAnswer(invocation -> {
            threeCycles.countDown();
            return completeCycle(invocation);
        });
        scheduler = new DefaultCycleScheduler(executor, 50, 1_000, 1_000);

        // When
        scheduler.start();
        boolean ran = threeCycles.await(5, TimeUnit.SECONDS);
        scheduler.shutdown();

        // Then
        assertThat(ran).isTrue();
        assertThat(scheduler.isRunning()).isFalse();
        assertThat(scheduler.getCycleCount()).isGreaterThanOrEqualTo(3);
        verify(executor).close();
    }

    @Test
    void start_AlreadyRunning_Throws() {
        // Given
        lenient().when(executor.runCycle(anyLong(), any())).thenAnswer(DefaultCycleSchedulerTest::completeCycle);
        scheduler = new DefaultCycleScheduler(executor, 60_000, 5_000, 600_000);
        scheduler.start();

        // When / Then
        assertThatThrownBy(() -> scheduler.start()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> scheduler.runOnce()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void runOnce_AfterShutdown_Throws() {
        // Given
        scheduler = new DefaultCycleScheduler(executor, 60_000, 5_000, 600_000);
        scheduler.shutdown();

        // When / Then
        assertThatThrownBy(() -> scheduler.runOnce()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> scheduler.start()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void constructor_BackoffShorterThanPeriod_Rejected() {
        assertThatThrownBy(() -> new DefaultCycleScheduler(executor, 60_000, 5_000, 30_000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefaultCycleScheduler(executor, 0, 5_000, 30_000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== 周期间隔计算 ====================

    @Test
    void computeSleepMillis_NormalCycle_PadsToPeriod() {
        assertThat(DefaultCycleScheduler.computeSleepMillis(0, 10_000, 60_000, 0, 600_000)).isEqualTo(50_000);
        assertThat(DefaultCycleScheduler.computeSleepMillis(0, 10_000, 60_000, 1, 600_000)).isEqualTo(50_000);
    }

    @Test
    void computeSleepMillis_CycleOverran_StartsImmediately() {
        assertThat(DefaultCycleScheduler.computeSleepMillis(0, 75_000, 60_000, 0, 600_000)).isLessThanOrEqualTo(0);
    }

    @Test
    void computeSleepMillis_ConsecutiveFailures_BackoffDoublesUpToCap() {
        assertThat(DefaultCycleScheduler.computeSleepMillis(0, 1_000, 60_000, 2, 600_000)).isEqualTo(119_000);
        assertThat(DefaultCycleScheduler.computeSleepMillis(0, 0, 60_000, 3, 600_000)).isEqualTo(240_000);
        assertThat(DefaultCycleScheduler.computeSleepMillis(0, 0, 60_000, 5, 600_000)).isEqualTo(600_000);
        assertThat(DefaultCycleScheduler.computeSleepMillis(0, 0, 60_000, 40, 600_000)).isEqualTo(600_000);
    }
}
