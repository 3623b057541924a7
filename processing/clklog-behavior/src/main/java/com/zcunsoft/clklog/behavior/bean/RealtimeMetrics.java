package com.zcunsoft.clklog.behavior.bean;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 实时指标：最近 60 分钟活跃，最近 15 分钟热门页面，最近 5 分钟事件
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeMetrics {
    private long activeUsers;
    private long pageViews;
    private List<LabelCount> topPages;
    private List<LabelCount> liveEvents;
}
