package com.zcunsoft.clklog.behavior.bean;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 看板全部汇总指标
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardSnapshot {
    private OverviewMetrics overview;
    private List<PageStat> topPages;
    private List<TrafficSource> trafficSources;
    private List<LocationStat> locations;
    private DevicesAndPlatforms devices;
    private EventsOverview events;
}
