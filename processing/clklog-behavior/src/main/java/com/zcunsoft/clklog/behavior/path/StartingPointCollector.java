package com.zcunsoft.clklog.behavior.path;

import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import com.zcunsoft.clklog.behavior.bean.StartingPoints;
import com.zcunsoft.clklog.behavior.utils.LabelResolver;

/**
 * 统计路径探索可选的起始点
 * screen_view 事件按屏幕标签计数，其余事件按事件名计数
 */
public class StartingPointCollector {

    public StartingPoints collect(Iterable<BehaviorEvent> events, int limit) {
        LabelTally screens = LabelTally.labelOrder();
        LabelTally others = LabelTally.labelOrder();
        for (BehaviorEvent event : events) {
            if (event == null) {
                continue;
            }
            if (event.isScreenView()) {
                screens.increment(LabelResolver.label(event));
            } else {
                others.increment(LabelResolver.label(event));
            }
        }
        return new StartingPoints(screens.top(limit), others.top(limit));
    }
}
