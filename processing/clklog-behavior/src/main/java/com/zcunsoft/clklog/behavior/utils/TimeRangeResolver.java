package com.zcunsoft.clklog.behavior.utils;

import com.zcunsoft.clklog.behavior.bean.TimeRange;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 时间区间解析
 * <p>
 * 支持 1h、24h/1d、7d、30d、90d，其他值按 30d 处理。
 */
public class TimeRangeResolver {

    public static final String DEFAULT_TOKEN = "30d";

    private final Clock clock;

    public TimeRangeResolver(Clock clock) {
        this.clock = clock;
    }

    public TimeRange resolve(String token) {
        Instant end = clock.instant();
        return new TimeRange(end.minus(durationOf(token)), end);
    }

    static Duration durationOf(String token) {
        String value = StringUtils.isBlank(token) ? DEFAULT_TOKEN : token.trim().toLowerCase();
        switch (value) {
            case "1h":
                return Duration.ofHours(1);
            case "24h":
            case "1d":
                return Duration.ofDays(1);
            case "7d":
                return Duration.ofDays(7);
            case "90d":
                return Duration.ofDays(90);
            case "30d":
            default:
                return Duration.ofDays(30);
        }
    }
}
