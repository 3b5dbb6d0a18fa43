package com.pipeline.weather.core.imp;

import com.pipeline.weather.core.CycleExecutor;
import com.pipeline.weather.core.CycleScheduler;
import com.pipeline.weather.core.CycleStateListener;
import com.pipeline.weather.model.CycleState;
import com.pipeline.weather.model.CycleSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 周期调度器默认实现。
 *
 * 调度线程负责计时和状态机，周期本身提交到单线程工作池执行，
 * 以便调度线程在软超时后中断工作线程。
 * 超时的工作线程尚未退出时，不启动新周期。
 */
public class DefaultCycleScheduler implements CycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultCycleScheduler.class);

    /** 合法状态转换表 */
    private static final Map<CycleState, Set<CycleState>> VALID_TRANSITIONS = new EnumMap<>(CycleState.class);

    static {
        VALID_TRANSITIONS.put(CycleState.IDLE,
                EnumSet.of(CycleState.EXTRACTING));
        VALID_TRANSITIONS.put(CycleState.EXTRACTING,
                EnumSet.of(CycleState.TRANSFORMING, CycleState.ABORTING));
        VALID_TRANSITIONS.put(CycleState.TRANSFORMING,
                EnumSet.of(CycleState.LOADING, CycleState.ABORTING));
        VALID_TRANSITIONS.put(CycleState.LOADING,
                EnumSet.of(CycleState.SLEEPING, CycleState.ABORTING));
        VALID_TRANSITIONS.put(CycleState.SLEEPING,
                EnumSet.of(CycleState.EXTRACTING));
        VALID_TRANSITIONS.put(CycleState.ABORTING,
                EnumSet.of(CycleState.SLEEPING));
    }

    private final CycleExecutor executor;
    private final long periodMs;
    private final long softTimeoutMs;
    private final long maxBackoffMs;
    private final Clock clock;

    private final AtomicReference<CycleState> state = new AtomicReference<>(CycleState.IDLE);
    private final List<CycleStateListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong cycleCounter = new AtomicLong(0);
    private final ExecutorService worker;
    private Thread schedulerThread;

    /** 工作线程是否仍在执行周期；取消后的 Future 已 done，但线程可能还没退出 */
    private final AtomicBoolean workerBusy = new AtomicBoolean(false);
    private int consecutiveFailures = 0;

    public DefaultCycleScheduler(CycleExecutor executor, long periodMs, long softTimeoutMs, long maxBackoffMs) {
        this(executor, periodMs, softTimeoutMs, maxBackoffMs, Clock.systemUTC());
    }

    public DefaultCycleScheduler(CycleExecutor executor, long periodMs, long softTimeoutMs,
                                 long maxBackoffMs, Clock clock) {
        if (periodMs <= 0) {
            throw new IllegalArgumentException("Cycle period must be positive, got: " + periodMs);
        }
        if (softTimeoutMs <= 0) {
            throw new IllegalArgumentException("Soft timeout must be positive, got: " + softTimeoutMs);
        }
        if (maxBackoffMs < periodMs) {
            throw new IllegalArgumentException(
                    "Max backoff must not be shorter than the period, got: " + maxBackoffMs);
        }
        this.executor = executor;
        this.periodMs = periodMs;
        this.softTimeoutMs = softTimeoutMs;
        this.maxBackoffMs = maxBackoffMs;
        this.clock = clock;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "etl-cycle-worker");
            t.setDaemon(true);
            return t;
        });
        log.info("CycleScheduler initialized. Period: {}ms, Soft timeout: {}ms, Max backoff: {}ms",
                periodMs, softTimeoutMs, maxBackoffMs);
    }

    @Override
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Scheduler has been shut down");
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Scheduler is already running");
        }
        schedulerThread = new Thread(this::schedulingLoop, "etl-cycle-scheduler");
        schedulerThread.setDaemon(false);
        schedulerThread.start();
        log.info("CycleScheduler started.");
    }

    @Override
    public void shutdown() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping CycleScheduler...");
            if (schedulerThread != null) {
                schedulerThread.interrupt();
                try {
                    schedulerThread.join(softTimeoutMs + periodMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for scheduler thread to finish.");
                }
            }
        }

        if (!closed.compareAndSet(false, true)) {
            return;
        }
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(softTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Cycle worker did not terminate within {}ms", softTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for cycle worker to finish.");
        }
        executor.close();
        log.info("CycleScheduler shut down after {} cycles.", cycleCounter.get());
    }

    @Override
    public CycleSummary runOnce() {
        if (running.get()) {
            throw new IllegalStateException("runOnce() is not allowed while the scheduler loop is running");
        }
        if (closed.get()) {
            throw new IllegalStateException("Scheduler has been shut down");
        }
        if (workerBusy.get()) {
            throw new IllegalStateException("Previous cycle " + cycleCounter.get() + " is still running");
        }
        return executeCycle();
    }

    @Override
    public CycleState getState() {
        return state.get();
    }

    @Override
    public void addStateListener(CycleStateListener listener) {
        listeners.add(listener);
    }

    /**
     * 调度主循环
     */
    private void schedulingLoop() {
        log.info("Cycle scheduling loop started.");
        while (running.get()) {
            long cycleStart = clock.millis();

            if (workerBusy.get()) {
                log.warn("Timed-out cycle {} is still running, not starting a new cycle", cycleCounter.get());
            } else {
                CycleSummary summary = executeCycle();
                consecutiveFailures = summary.isAborted() ? consecutiveFailures + 1 : 0;
            }

            long now = clock.millis();
            long sleepMs = computeSleepMillis(cycleStart, now, periodMs, consecutiveFailures, maxBackoffMs);
            if (sleepMs <= 0) {
                log.warn("Cycle took {}ms, exceeding period of {}ms; starting next cycle immediately",
                        now - cycleStart, periodMs);
                continue;
            }
            if (consecutiveFailures >= 2) {
                log.warn("{} consecutive failed cycles, backing off for {}ms", consecutiveFailures, sleepMs);
            }
            try {
                Thread.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Cycle scheduling loop stopped.");
    }

    /**
     * 执行一个周期并等待其完成或超时
     */
    private CycleSummary executeCycle() {
        long cycleNumber = cycleCounter.incrementAndGet();
        Instant startedAt = Instant.now(clock);
        AtomicBoolean abandoned = new AtomicBoolean(false);

        transitionTo(CycleState.EXTRACTING);
        Future<CycleSummary> future;
        try {
            future = worker.submit(() -> {
                workerBusy.set(true);
                try {
                    return executor.runCycle(cycleNumber, phase -> {
                        if (!abandoned.get() && phase != state.get()) {
                            transitionTo(phase);
                        }
                    });
                } finally {
                    workerBusy.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            return abort(cycleNumber, startedAt, "cycle worker is shut down");
        }

        try {
            CycleSummary summary = future.get(softTimeoutMs, TimeUnit.MILLISECONDS);
            transitionTo(CycleState.SLEEPING);
            return summary;
        } catch (TimeoutException e) {
            abandoned.set(true);
            future.cancel(true);
            log.error("Cycle {} exceeded soft timeout of {}ms, interrupting", cycleNumber, softTimeoutMs);
            return abort(cycleNumber, startedAt, "soft timeout of " + softTimeoutMs + "ms exceeded");
        } catch (ExecutionException e) {
            abandoned.set(true);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Cycle {} aborted: {}", cycleNumber, cause.getMessage(), cause);
            return abort(cycleNumber, startedAt, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandoned.set(true);
            future.cancel(true);
            return abort(cycleNumber, startedAt, "scheduler interrupted");
        }
    }

    private CycleSummary abort(long cycleNumber, Instant startedAt, String reason) {
        transitionTo(CycleState.ABORTING);
        transitionTo(CycleState.SLEEPING);
        CycleSummary summary = new CycleSummary(cycleNumber, startedAt);
        summary.markAborted(reason);
        summary.setElapsedMs(clock.millis() - startedAt.toEpochMilli());
        log.warn("Cycle {} aborted: {}", cycleNumber, summary);
        return summary;
    }

    /**
     * 状态转换
     *
     * @return 转换合法并已生效时返回true
     */
    synchronized boolean transitionTo(CycleState next) {
        CycleState current = state.get();
        Set<CycleState> allowed = VALID_TRANSITIONS.getOrDefault(current, Collections.emptySet());
        if (!allowed.contains(next)) {
            log.warn("Invalid cycle state transition: {} -> {}", current, next);
            return false;
        }
        state.set(next);
        log.debug("Cycle state: {} -> {}", current, next);
        for (CycleStateListener listener : listeners) {
            try {
                listener.onTransition(current, next);
            } catch (RuntimeException e) {
                log.warn("State listener failed on {} -> {}: {}", current, next, e.getMessage());
            }
        }
        return true;
    }

    /**
     * 计算下一周期开始前需要等待的时间。
     *
     * 正常情况下按起点到起点的固定周期补齐；连续失败 k ≥ 2 次后，
     * 周期延长为 period × 2^(k-1)，不超过 maxBackoff。
     * 返回值不大于0表示应立即开始下一周期，错过的周期不补。
     */
    static long computeSleepMillis(long cycleStartMs, long nowMs, long periodMs,
                                   int consecutiveFailures, long maxBackoffMs) {
        long interval = periodMs;
        if (consecutiveFailures >= 2) {
            int exponent = Math.min(consecutiveFailures - 1, 30);
            long backoff = periodMs << exponent;
            if (backoff <= 0 || backoff > maxBackoffMs) {
                backoff = maxBackoffMs;
            }
            interval = Math.max(periodMs, backoff);
        }
        long elapsed = nowMs - cycleStartMs;
        return interval - elapsed;
    }

    public long getCycleCount() { return cycleCounter.get(); }
    public boolean isRunning() { return running.get(); }
    boolean isWorkerBusy() { return workerBusy.get(); }
}
