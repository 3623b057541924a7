package com.zcunsoft.clklog.behavior.bean;

import lombok.Value;

/**
 * 漏斗单步统计
 */
@Value
public class FunnelStep {
    /**
     * 步骤序号，从 1 开始
     */
    int index;
    String label;
    long count;
    double conversionRate;
    long dropOff;
}
