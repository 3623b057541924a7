package com.zcunsoft.clklog.behavior.eventlog;

import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import com.zcunsoft.clklog.behavior.bean.EventQuery;
import com.zcunsoft.clklog.behavior.exception.EventLogException;

import java.util.List;

/**
 * 只读事件日志
 */
public interface EventLog {

    /**
     * 按时间区间、环境、平台读取事件
     *
     * @param query 查询条件
     * @return 符合条件的事件，顺序不保证
     * @throws EventLogException 读取失败
     */
    List<BehaviorEvent> fetch(EventQuery query);
}
