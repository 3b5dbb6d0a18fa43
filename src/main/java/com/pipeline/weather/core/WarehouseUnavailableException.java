package com.pipeline.weather.core;

/**
 * 仓库整体不可用（文件无法打开、连接失效且无法重建），当前周期必须中止
 */
public class WarehouseUnavailableException extends WarehouseException {

    public WarehouseUnavailableException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
