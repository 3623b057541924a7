package com.zcunsoft.clklog.behavior.cfg;

import com.zcunsoft.clklog.behavior.bean.FunnelDefinition;
import com.zcunsoft.clklog.behavior.bean.PathQuery;
import lombok.Data;

import java.util.List;
import java.util.Properties;

/**
 * 行为分析引擎配置
 */
@Data
public class BehaviorSettings {

    public static final String CONFIG_RESOURCE = "behavior.properties";

    /**
     * 默认漏斗步骤
     */
    private List<String> defaultFunnelSteps = FunnelDefinition.DEFAULT_STEPS;

    private int defaultMaxSteps = PathQuery.DEFAULT_MAX_STEPS;

    private int defaultNodesPerStep = PathQuery.DEFAULT_NODES_PER_STEP;

    /**
     * 起始点列表长度
     */
    private int startingPointLimit = 50;

    /**
     * 事件日志读取超时（毫秒）
     */
    private long fetchTimeoutMs = 30000;

    /**
     * 会话数达到该值时按会话并行计算，<= 0 表示不并行
     */
    private int parallelThreshold = 10000;

    /**
     * 从 properties 构建配置，缺失的键使用默认值
     * <p>
     * 独立使用引擎时由调用方加载 behavior.properties；报表服务通过 ReportSetting 构建。
     *
     * @param props behavior.* 配置项
     * @return 配置
     */
    public static BehaviorSettings fromProperties(Properties props) {
        BehaviorSettings settings = new BehaviorSettings();
        String funnel = props.getProperty("behavior.funnel.default-steps");
        if (funnel != null) {
            settings.setDefaultFunnelSteps(FunnelDefinition.parse(funnel, FunnelDefinition.DEFAULT_STEPS).getSteps());
        }
        settings.setDefaultMaxSteps(Integer.parseInt(props.getProperty("behavior.path.max-steps", String.valueOf(PathQuery.DEFAULT_MAX_STEPS)).trim()));
        settings.setDefaultNodesPerStep(Integer.parseInt(props.getProperty("behavior.path.nodes-per-step", String.valueOf(PathQuery.DEFAULT_NODES_PER_STEP)).trim()));
        settings.setStartingPointLimit(Integer.parseInt(props.getProperty("behavior.path.starting-point-limit", "50").trim()));
        settings.setFetchTimeoutMs(Long.parseLong(props.getProperty("behavior.fetch.timeout.ms", "30000").trim()));
        settings.setParallelThreshold(Integer.parseInt(props.getProperty("behavior.parallel.threshold", "10000").trim()));
        return settings;
    }
}
