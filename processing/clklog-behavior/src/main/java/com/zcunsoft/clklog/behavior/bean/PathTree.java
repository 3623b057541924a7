package com.zcunsoft.clklog.behavior.bean;

import lombok.Value;

import java.util.List;

/**
 * 路径探索结果，第 0 步为起始标签
 */
@Value
public class PathTree {
    String startingLabel;
    List<PathStep> steps;

    public int stepCount() {
        return steps.size();
    }
}
