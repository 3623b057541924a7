package com.zcunsoft.clklog.behavior.entry;

import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import com.zcunsoft.clklog.behavior.bean.DashboardSnapshot;
import com.zcunsoft.clklog.behavior.bean.EventQuery;
import com.zcunsoft.clklog.behavior.bean.FunnelDefinition;
import com.zcunsoft.clklog.behavior.bean.FunnelReport;
import com.zcunsoft.clklog.behavior.bean.PathQuery;
import com.zcunsoft.clklog.behavior.bean.PathTree;
import com.zcunsoft.clklog.behavior.bean.PlatformFilter;
import com.zcunsoft.clklog.behavior.bean.RealtimeMetrics;
import com.zcunsoft.clklog.behavior.bean.SessionStreams;
import com.zcunsoft.clklog.behavior.bean.StartingPoints;
import com.zcunsoft.clklog.behavior.bean.TimeRange;
import com.zcunsoft.clklog.behavior.cfg.BehaviorSettings;
import com.zcunsoft.clklog.behavior.eventlog.EventFetcher;
import com.zcunsoft.clklog.behavior.eventlog.EventLog;
import com.zcunsoft.clklog.behavior.funnel.FunnelAnalyzer;
import com.zcunsoft.clklog.behavior.metrics.AggregateMetricsCalculator;
import com.zcunsoft.clklog.behavior.path.JourneyPathExplorer;
import com.zcunsoft.clklog.behavior.path.StartingPointCollector;
import com.zcunsoft.clklog.behavior.stream.SessionStreamBuilder;
import com.zcunsoft.clklog.behavior.utils.TimeRangeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * 行为分析引擎入口
 * <p>
 * 功能：
 * 1. 将事件构建为会话标签流
 * 2. 封闭漏斗分析
 * 3. 用户路径探索
 * 4. 看板汇总指标
 * <p>
 * 引擎无状态，同一实例可被任意多个查询并发使用。
 * 单次查询中会话标签流只构建一次，漏斗与路径分析分别消费。
 */
public class BehaviorAnalyticsEngine {

    private static final Logger logger = LoggerFactory.getLogger(BehaviorAnalyticsEngine.class);

    private final BehaviorSettings settings;
    private final Clock clock;
    private final TimeRangeResolver timeRangeResolver;
    private final SessionStreamBuilder sessionStreamBuilder = new SessionStreamBuilder();
    private final FunnelAnalyzer funnelAnalyzer;
    private final JourneyPathExplorer journeyPathExplorer;
    private final StartingPointCollector startingPointCollector = new StartingPointCollector();
    private final AggregateMetricsCalculator aggregateMetricsCalculator = new AggregateMetricsCalculator();
    private final EventFetcher eventFetcher;

    /**
     * 构造函数
     *
     * @param settings     引擎配置
     * @param clock        时钟，用于解析时间区间
     * @param eventFetcher 事件读取器
     */
    public BehaviorAnalyticsEngine(BehaviorSettings settings, Clock clock, EventFetcher eventFetcher) {
        this.settings = settings;
        this.clock = clock;
        this.timeRangeResolver = new TimeRangeResolver(clock);
        this.funnelAnalyzer = new FunnelAnalyzer(settings.getParallelThreshold());
        this.journeyPathExplorer = new JourneyPathExplorer(settings.getParallelThreshold());
        this.eventFetcher = eventFetcher;
    }

    // ========== 查询解析 ==========

    public TimeRange resolveTimeRange(String token) {
        return timeRangeResolver.resolve(token);
    }

    public PlatformFilter parsePlatform(String platform) {
        return PlatformFilter.parse(platform);
    }

    public EventQuery eventQuery(String timeRangeToken, String platform) {
        return EventQuery.prod(resolveTimeRange(timeRangeToken), parsePlatform(platform));
    }

    public FunnelDefinition funnelDefinition(String stepsParam) {
        return FunnelDefinition.parse(stepsParam, settings.getDefaultFunnelSteps());
    }

    /**
     * 路径查询参数，未传的参数取配置默认值
     */
    public PathQuery pathQuery(String startingLabel, Integer maxSteps, Integer nodesPerStep) {
        return PathQuery.of(startingLabel,
                maxSteps != null ? maxSteps : settings.getDefaultMaxSteps(),
                nodesPerStep != null ? nodesPerStep : settings.getDefaultNodesPerStep());
    }

    /**
     * 读取事件，超时时间取配置
     */
    public List<BehaviorEvent> fetch(EventLog eventLog, EventQuery query) {
        long start = System.currentTimeMillis();
        List<BehaviorEvent> events = eventFetcher.fetch(eventLog, query, settings.getFetchTimeoutMs());
        logger.debug("Fetched {} events in {}ms", events.size(), System.currentTimeMillis() - start);
        return events;
    }

    public List<BehaviorEvent> query(EventLog eventLog, String timeRangeToken, String platform) {
        return fetch(eventLog, eventQuery(timeRangeToken, platform));
    }

    // ========== 会话分析 ==========

    public SessionStreams buildSessionStreams(Iterable<BehaviorEvent> events) {
        return sessionStreamBuilder.build(events);
    }

    public FunnelReport analyzeFunnel(SessionStreams sessionStreams, List<String> steps) {
        return analyzeFunnel(sessionStreams, new FunnelDefinition(steps));
    }

    public FunnelReport analyzeFunnel(SessionStreams sessionStreams, FunnelDefinition definition) {
        return funnelAnalyzer.analyze(sessionStreams, definition);
    }

    public PathTree explorePaths(SessionStreams sessionStreams, PathQuery query) {
        return journeyPathExplorer.explore(sessionStreams, query);
    }

    public PathTree explorePaths(SessionStreams sessionStreams) {
        return explorePaths(sessionStreams, pathQuery(null, null, null));
    }

    public StartingPoints startingPoints(List<BehaviorEvent> events) {
        return startingPointCollector.collect(events, settings.getStartingPointLimit());
    }

    // ========== 汇总指标 ==========

    public DashboardSnapshot dashboard(List<BehaviorEvent> events) {
        return aggregateMetricsCalculator.snapshot(events);
    }

    public RealtimeMetrics realtime(List<BehaviorEvent> events) {
        return aggregateMetricsCalculator.realtime(events, clock.instant());
    }

    public BehaviorSettings getSettings() {
        return settings;
    }
}
