package com.zcunsoft.clklog.behavior.bean;

import lombok.Value;

@Value
public class LabelCount {
    String label;
    long count;
}
