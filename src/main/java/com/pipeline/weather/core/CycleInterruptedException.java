package com.pipeline.weather.core;

/**
 * 周期执行线程被中断（软超时或关闭），当前周期放弃剩余工作
 */
public class CycleInterruptedException extends RuntimeException {

    public CycleInterruptedException(String message) {
        super(message);
    }
}
