package com.zcunsoft.clklog.behavior.bean;

import lombok.Value;

/**
 * 事件日志查询条件
 */
@Value
public class EventQuery {
    TimeRange timeRange;
    String environment;
    PlatformFilter platformFilter;

    public static EventQuery prod(TimeRange timeRange, PlatformFilter platformFilter) {
        return new EventQuery(timeRange, BehaviorConsts.ENV_PROD, platformFilter == null ? PlatformFilter.ALL : platformFilter);
    }

    public boolean matches(BehaviorEvent event) {
        return timeRange.contains(event.getTimestamp())
                && environment.equals(event.getEnvironment())
                && platformFilter.matches(event.getPlatform());
    }
}
