package com.zcunsoft.clklog.behavior.bean;

import lombok.Value;

import java.util.List;

@Value
public class PathStep {
    int step;
    List<LabelCount> nodes;
}
