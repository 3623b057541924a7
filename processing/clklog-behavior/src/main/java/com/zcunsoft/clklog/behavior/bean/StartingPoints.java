package com.zcunsoft.clklog.behavior.bean;

import lombok.Value;

import java.util.List;

/**
 * 路径探索可选的起始点
 */
@Value
public class StartingPoints {
    /**
     * screen_view 事件的标签
     */
    List<LabelCount> screens;
    /**
     * 其他事件的事件名
     */
    List<LabelCount> events;
}
