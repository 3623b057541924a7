package com.zcunsoft.clklog.behavior.entry;

import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import com.zcunsoft.clklog.behavior.bean.FunnelReport;
import com.zcunsoft.clklog.behavior.bean.FunnelStep;
import com.zcunsoft.clklog.behavior.bean.LabelCount;
import com.zcunsoft.clklog.behavior.bean.PathStep;
import com.zcunsoft.clklog.behavior.bean.PathTree;
import com.zcunsoft.clklog.behavior.bean.RealtimeMetrics;
import com.zcunsoft.clklog.behavior.bean.SessionStreams;
import com.zcunsoft.clklog.behavior.bean.StartingPoints;
import com.zcunsoft.clklog.behavior.cfg.BehaviorSettings;
import com.zcunsoft.clklog.behavior.eventlog.EventFetcher;
import com.zcunsoft.clklog.behavior.eventlog.JsonFileEventLog;
import com.zcunsoft.clklog.behavior.exception.BehaviorQueryException;
import com.zcunsoft.clklog.behavior.TestEvents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BehaviorAnalyticsEngineTest {

    private EventFetcher eventFetcher;
    private BehaviorAnalyticsEngine engine;
    private JsonFileEventLog eventLog;

    @BeforeEach
    void setUp() throws Exception {
        eventFetcher = EventFetcher.create(2);
        engine = new BehaviorAnalyticsEngine(TestEvents.settings(),
                Clock.fixed(Instant.parse("2026-10-19T12:30:00Z"), ZoneOffset.UTC), eventFetcher);
        eventLog = new JsonFileEventLog(Paths.get(getClass().getClassLoader().getResource("events.jsonl").toURI()));
    }

    @AfterEach
    void tearDown() {
        eventFetcher.close();
    }

    @Test
    void funnelUsesConfiguredDefaultSteps() {
        SessionStreams streams = engine.buildSessionStreams(engine.query(eventLog, "1d", "all"));

        FunnelReport report = engine.analyzeFunnel(streams, engine.funnelDefinition(null));

        assertThat(report.getSteps()).extracting(FunnelStep::getLabel).containsExactly("Landing", "Explore", "Event Page");
        assertThat(report.getSteps()).extracting(FunnelStep::getCount).containsExactly(3L, 2L, 1L);
    }

    @Test
    void funnelWithExplicitStepsAndPlatform() {
        SessionStreams all = engine.buildSessionStreams(engine.query(eventLog, "1d", null));
        SessionStreams web = engine.buildSessionStreams(engine.query(eventLog, "1d", "web"));

        FunnelReport allReport = engine.analyzeFunnel(all, engine.funnelDefinition("Landing,Explore,Event Page,event_registration"));
        FunnelReport webReport = engine.analyzeFunnel(web, List.of("Landing", "Explore", "Event Page"));

        assertThat(allReport.getSteps()).extracting(FunnelStep::getCount).containsExactly(3L, 2L, 1L, 1L);
        assertThat(webReport.getSteps()).extracting(FunnelStep::getCount).containsExactly(1L, 1L, 1L);
        assertThat(webReport.getOverallConversionRate()).isEqualTo(100D);
    }

    @Test
    void pathsFromDerivedStart() {
        SessionStreams streams = engine.buildSessionStreams(engine.query(eventLog, "7d", "all"));

        PathTree tree = engine.explorePaths(streams);

        assertThat(tree.getStartingLabel()).isEqualTo("Landing");
        assertThat(tree.getSteps()).extracting(PathStep::getNodes).containsExactly(
                List.of(new LabelCount("Landing", 3)),
                List.of(new LabelCount("Explore", 2), new LabelCount("search", 1)),
                List.of(new LabelCount("Event Page", 1)),
                List.of(new LabelCount("event_registration", 1)));
    }

    @Test
    void shortWindowExcludesOlderEvents() {
        List<BehaviorEvent> events = engine.query(eventLog, "1h", "all");

        assertThat(events).extracting(BehaviorEvent::getEventId).containsExactlyInAnyOrder("e7", "e8");
    }

    @Test
    void pathQueryUsesConfiguredDefaultsAndValidates() {
        assertThat(engine.pathQuery(null, null, null).getMaxSteps()).isEqualTo(4);
        assertThat(engine.pathQuery("Explore", 2, null).getNodesPerStep()).isEqualTo(3);
        assertThatThrownBy(() -> engine.pathQuery(null, 0, null)).isInstanceOf(BehaviorQueryException.class);
    }

    @Test
    void startingPointsAndRealtime() {
        List<BehaviorEvent> events = engine.query(eventLog, "1d", "all");

        StartingPoints points = engine.startingPoints(events);
        RealtimeMetrics realtime = engine.realtime(events);

        assertThat(points.getScreens()).containsExactly(
                new LabelCount("Landing", 3), new LabelCount("Explore", 2), new LabelCount("Event Page", 1));
        assertThat(points.getEvents()).containsExactly(
                new LabelCount("event_registration", 1), new LabelCount("search", 1));
        assertThat(realtime.getActiveUsers()).isEqualTo(1);
        assertThat(realtime.getPageViews()).isEqualTo(1);
    }

    @Test
    void dashboardOverNoEvents() {
        assertThat(engine.dashboard(List.of()).getOverview().getSessions()).isZero();
        assertThat(engine.explorePaths(SessionStreams.empty()).stepCount()).isEqualTo(1);
    }
}
