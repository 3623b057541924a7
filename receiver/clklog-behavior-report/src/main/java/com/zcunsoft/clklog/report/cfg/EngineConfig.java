package com.zcunsoft.clklog.report.cfg;

import com.zcunsoft.clklog.behavior.entry.BehaviorAnalyticsEngine;
import com.zcunsoft.clklog.behavior.eventlog.EventFetcher;
import com.zcunsoft.clklog.behavior.eventlog.EventLog;
import com.zcunsoft.clklog.behavior.eventlog.JsonFileEventLog;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public EventFetcher eventFetcher(ReportSetting reportSetting) {
        return EventFetcher.create(reportSetting.getFetchThreads());
    }

    @Bean
    public BehaviorAnalyticsEngine behaviorAnalyticsEngine(ReportSetting reportSetting, Clock clock, EventFetcher eventFetcher) {
        return new BehaviorAnalyticsEngine(reportSetting.toBehaviorSettings(), clock, eventFetcher);
    }

    /**
     * 本地 JSON 行文件事件源，用于演示与联调
     */
    @Bean
    @ConditionalOnProperty(prefix = "report", name = "event-source", havingValue = ReportSetting.SOURCE_FILE)
    public EventLog jsonFileEventLog(ReportSetting reportSetting) {
        return new JsonFileEventLog(Paths.get(reportSetting.getEventFile()));
    }
}
