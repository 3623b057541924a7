package com.zcunsoft.clklog.behavior.exception;

/**
 * 行为分析异常基类
 */
public class BehaviorException extends RuntimeException {

    public BehaviorException(String message) {
        super(message);
    }

    public BehaviorException(String message, Throwable cause) {
        super(message, cause);
    }
}
