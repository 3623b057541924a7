package com.zcunsoft.clklog.report.services;

import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import com.zcunsoft.clklog.behavior.bean.DashboardSnapshot;
import com.zcunsoft.clklog.behavior.bean.EventQuery;
import com.zcunsoft.clklog.behavior.bean.FunnelDefinition;
import com.zcunsoft.clklog.behavior.bean.FunnelReport;
import com.zcunsoft.clklog.behavior.bean.PathQuery;
import com.zcunsoft.clklog.behavior.bean.PathTree;
import com.zcunsoft.clklog.behavior.bean.RealtimeMetrics;
import com.zcunsoft.clklog.behavior.bean.SessionStreams;
import com.zcunsoft.clklog.behavior.bean.StartingPoints;
import com.zcunsoft.clklog.behavior.entry.BehaviorAnalyticsEngine;
import com.zcunsoft.clklog.behavior.eventlog.EventLog;
import com.zcunsoft.clklog.report.model.UserJourney;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class BehaviorReportServiceImpl implements IBehaviorReportService {

    private static final String REALTIME_RANGE = "1h";

    private final Logger logger = LogManager.getLogger(this.getClass());

    private final BehaviorAnalyticsEngine engine;

    private final EventLog eventLog;

    public BehaviorReportServiceImpl(BehaviorAnalyticsEngine engine, EventLog eventLog) {
        this.engine = engine;
        this.eventLog = eventLog;
    }

    @Override
    public FunnelReport funnel(String timeRange, String platform, String steps) {
        FunnelDefinition definition = engine.funnelDefinition(steps);
        EventQuery query = engine.eventQuery(timeRange, platform);

        SessionStreams streams = engine.buildSessionStreams(engine.fetch(eventLog, query));
        FunnelReport report = engine.analyzeFunnel(streams, definition);
        logger.debug("funnel {} {} {}: {} sessions, entered {}, converted {}", timeRange, query.getPlatformFilter(),
                definition.getSteps(), streams.sessionCount(), report.getTotalEntered(), report.getTotalConverted());
        return report;
    }

    @Override
    public UserJourney userJourney(String timeRange, String platform, String startingPoint, Integer maxSteps, Integer nodesPerStep) {
        // 参数校验先于读取事件
        PathQuery pathQuery = engine.pathQuery(startingPoint, maxSteps, nodesPerStep);
        EventQuery query = engine.eventQuery(timeRange, platform);

        SessionStreams streams = engine.buildSessionStreams(engine.fetch(eventLog, query));
        PathTree tree = engine.explorePaths(streams, pathQuery);
        logger.debug("user journey {} {} from '{}': {} sessions, {} steps", timeRange, query.getPlatformFilter(),
                tree.getStartingLabel(), streams.sessionCount(), tree.stepCount());
        return new UserJourney(tree.getStartingLabel(), new UserJourney.Path(tree.getSteps()));
    }

    @Override
    public StartingPoints startingPoints(String timeRange, String platform) {
        return engine.startingPoints(fetch(timeRange, platform));
    }

    @Override
    public DashboardSnapshot dashboard(String timeRange, String platform) {
        return engine.dashboard(fetch(timeRange, platform));
    }

    @Override
    public RealtimeMetrics realtime(String platform) {
        return engine.realtime(fetch(REALTIME_RANGE, platform));
    }

    private List<BehaviorEvent> fetch(String timeRange, String platform) {
        return engine.fetch(eventLog, engine.eventQuery(timeRange, platform));
    }
}
