package com.pipeline.weather.core;

/**
 * 仓库访问异常。transient为true表示资源忙（SQLITE_BUSY/LOCKED），可有限次重试。
 */
public class WarehouseException extends RuntimeException {

    private final boolean transientFailure;

    public WarehouseException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public WarehouseException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
