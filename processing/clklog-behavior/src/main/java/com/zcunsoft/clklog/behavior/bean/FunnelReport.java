package com.zcunsoft.clklog.behavior.bean;

import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * 漏斗报表
 */
@Value
public class FunnelReport {
    List<FunnelStep> steps;
    long totalEntered;
    long totalConverted;
    double overallConversionRate;

    public static FunnelReport empty() {
        return new FunnelReport(Collections.emptyList(), 0, 0, 0D);
    }
}
