package com.zcunsoft.clklog.behavior.exception;

/**
 * 事件日志读取失败或超时，原样返回给调用方
 */
public class EventLogException extends BehaviorException {

    private final boolean timeout;

    public EventLogException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public EventLogException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
