package com.pipeline.weather.core.imp;

import com.pipeline.weather.core.CycleInterruptedException;
import com.pipeline.weather.core.WarehouseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 仓库写操作的有限重试。
 * 仅对资源忙（transient）的失败重试，等待时间按 base × 2^(n-1) 指数增长。
 */
public class WriteRetrier {

    private static final Logger log = LoggerFactory.getLogger(WriteRetrier.class);

    /** 首次失败后的最大重试次数 */
    private final int maxRetries;
    private final long baseBackoffMs;

    public WriteRetrier(int maxRetries, long baseBackoffMs) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Retry attempts must not be negative, got: " + maxRetries);
        }
        if (baseBackoffMs < 0) {
            throw new IllegalArgumentException("Retry backoff must not be negative, got: " + baseBackoffMs);
        }
        this.maxRetries = maxRetries;
        this.baseBackoffMs = baseBackoffMs;
    }

    public <T> T execute(String operation, Supplier<T> action) {
        int retry = 0;
        while (true) {
            try {
                return action.get();
            } catch (WarehouseException e) {
                if (!e.isTransient() || retry >= maxRetries) {
                    throw e;
                }
                retry++;
                long backoff = baseBackoffMs << (retry - 1);
                log.warn("Warehouse busy during {} (retry {}/{} in {}ms): {}",
                        operation, retry, maxRetries, backoff, e.getMessage());
                sleep(backoff);
            }
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CycleInterruptedException("Interrupted while backing off a warehouse retry");
        }
    }

    public int getMaxRetries() { return maxRetries; }
    public long getBaseBackoffMs() { return baseBackoffMs; }
}
