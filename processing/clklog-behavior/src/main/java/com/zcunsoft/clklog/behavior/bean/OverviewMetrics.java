package com.zcunsoft.clklog.behavior.bean;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 概览指标
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverviewMetrics {
    private long uniqueUsers;
    private long sessions;
    private long pageViews;
    /**
     * 跳出率（%），保留两位小数
     */
    private double bounceRate;
    /**
     * 平均会话时长（秒）
     */
    private long avgSessionDuration;
}
