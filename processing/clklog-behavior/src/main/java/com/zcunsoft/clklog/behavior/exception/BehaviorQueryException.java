package com.zcunsoft.clklog.behavior.exception;

/**
 * 查询参数非法，在进入引擎之前抛出
 */
public class BehaviorQueryException extends BehaviorException {

    public BehaviorQueryException(String message) {
        super(message);
    }
}
