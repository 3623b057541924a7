package com.zcunsoft.clklog.report.cfg;

import com.zcunsoft.clklog.behavior.bean.FunnelDefinition;
import com.zcunsoft.clklog.behavior.bean.PathQuery;
import com.zcunsoft.clklog.behavior.cfg.BehaviorSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;


@ConfigurationProperties("report")
public class ReportSetting {

    public static final String SOURCE_CLICKHOUSE = "clickhouse";

    public static final String SOURCE_FILE = "file";

    /**
     * 事件来源：clickhouse 或 file
     */
    private String eventSource = SOURCE_CLICKHOUSE;

    /**
     * event-source=file 时的 JSON 行文件
     */
    private String eventFile = "";

    private int fetchThreads = 4;

    /**
     * 读取事件超时（毫秒）
     */
    private long fetchTimeoutMs = 30000;

    private int parallelThreshold = 10000;

    private List<String> defaultFunnelSteps = new ArrayList<>(FunnelDefinition.DEFAULT_STEPS);

    private int defaultMaxSteps = PathQuery.DEFAULT_MAX_STEPS;

    private int defaultNodesPerStep = PathQuery.DEFAULT_NODES_PER_STEP;

    private int startingPointLimit = 50;

    private String[] accessControlAllowOriginPatterns;

    /**
     * 转换为引擎配置
     */
    public BehaviorSettings toBehaviorSettings() {
        BehaviorSettings settings = new BehaviorSettings();
        settings.setDefaultFunnelSteps(List.copyOf(defaultFunnelSteps));
        settings.setDefaultMaxSteps(defaultMaxSteps);
        settings.setDefaultNodesPerStep(defaultNodesPerStep);
        settings.setStartingPointLimit(startingPointLimit);
        settings.setFetchTimeoutMs(fetchTimeoutMs);
        settings.setParallelThreshold(parallelThreshold);
        return settings;
    }

    public String getEventSource() {
        return eventSource;
    }

    public void setEventSource(String eventSource) {
        this.eventSource = eventSource;
    }

    public String getEventFile() {
        return eventFile;
    }

    public void setEventFile(String eventFile) {
        this.eventFile = eventFile;
    }

    public int getFetchThreads() {
        return fetchThreads;
    }

    public void setFetchThreads(int fetchThreads) {
        this.fetchThreads = fetchThreads;
    }

    public long getFetchTimeoutMs() {
        return fetchTimeoutMs;
    }

    public void setFetchTimeoutMs(long fetchTimeoutMs) {
        this.fetchTimeoutMs = fetchTimeoutMs;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public void setParallelThreshold(int parallelThreshold) {
        this.parallelThreshold = parallelThreshold;
    }

    public List<String> getDefaultFunnelSteps() {
        return defaultFunnelSteps;
    }

    public void setDefaultFunnelSteps(List<String> defaultFunnelSteps) {
        this.defaultFunnelSteps = defaultFunnelSteps;
    }

    public int getDefaultMaxSteps() {
        return defaultMaxSteps;
    }

    public void setDefaultMaxSteps(int defaultMaxSteps) {
        this.defaultMaxSteps = defaultMaxSteps;
    }

    public int getDefaultNodesPerStep() {
        return defaultNodesPerStep;
    }

    public void setDefaultNodesPerStep(int defaultNodesPerStep) {
        this.defaultNodesPerStep = defaultNodesPerStep;
    }

    public int getStartingPointLimit() {
        return startingPointLimit;
    }

    public void setStartingPointLimit(int startingPointLimit) {
        this.startingPointLimit = startingPointLimit;
    }

    public String[] getAccessControlAllowOriginPatterns() {
        return accessControlAllowOriginPatterns;
    }

    public void setAccessControlAllowOriginPatterns(String[] accessControlAllowOriginPatterns) {
        this.accessControlAllowOriginPatterns = accessControlAllowOriginPatterns;
    }
}
