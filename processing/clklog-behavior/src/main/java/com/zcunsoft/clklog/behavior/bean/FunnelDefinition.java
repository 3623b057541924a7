package com.zcunsoft.clklog.behavior.bean;

import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 漏斗定义：有序的步骤标签列表，允许重复
 */
@Value
public class FunnelDefinition {

    public static final List<String> DEFAULT_STEPS = List.of("Landing", "Explore", "Event Page", "event_registration");

    List<String> steps;

    public FunnelDefinition(List<String> steps) {
        this.steps = List.copyOf(steps);
    }

    /**
     * 解析逗号分隔的步骤，为空时使用默认步骤
     *
     * @param stepsParam   逗号分隔的步骤
     * @param defaultSteps 默认步骤
     * @return 漏斗定义
     */
    public static FunnelDefinition parse(String stepsParam, List<String> defaultSteps) {
        if (StringUtils.isBlank(stepsParam)) {
            return new FunnelDefinition(defaultSteps);
        }
        List<String> steps = new ArrayList<>();
        for (String step : stepsParam.split(",", -1)) {
            if (StringUtils.isNotBlank(step)) {
                steps.add(step.trim());
            }
        }
        return new FunnelDefinition(steps.isEmpty() ? defaultSteps : steps);
    }

    public int size() {
        return steps.size();
    }
}
