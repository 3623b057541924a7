package com.zcunsoft.clklog.behavior.bean;

import lombok.Value;

import java.time.Instant;

/**
 * 查询时间区间，两端均包含
 */
@Value
public class TimeRange {
    Instant start;
    Instant end;

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
    }
}
