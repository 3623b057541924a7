package com.zcunsoft.clklog.report.services;

import com.zcunsoft.clklog.behavior.bean.DashboardSnapshot;
import com.zcunsoft.clklog.behavior.bean.FunnelReport;
import com.zcunsoft.clklog.behavior.bean.RealtimeMetrics;
import com.zcunsoft.clklog.behavior.bean.StartingPoints;
import com.zcunsoft.clklog.report.model.UserJourney;

public interface IBehaviorReportService {

    /**
     * 封闭漏斗
     *
     * @param timeRange 时间区间，如 7d
     * @param platform  web / mobile / all
     * @param steps     逗号分隔的步骤，为空时取默认漏斗
     */
    FunnelReport funnel(String timeRange, String platform, String steps);

    /**
     * 用户路径
     *
     * @param startingPoint 起始标签，为空时取会话入口最多的标签
     * @param maxSteps      最大步数，为空时取默认值
     * @param nodesPerStep  每步节点数，为空时取默认值
     */
    UserJourney userJourney(String timeRange, String platform, String startingPoint, Integer maxSteps, Integer nodesPerStep);

    StartingPoints startingPoints(String timeRange, String platform);

    DashboardSnapshot dashboard(String timeRange, String platform);

    /**
     * 最近一小时的实时指标
     */
    RealtimeMetrics realtime(String platform);
}
