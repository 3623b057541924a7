package com.zcunsoft.clklog.behavior.utils;

import com.zcunsoft.clklog.behavior.bean.BehaviorConsts;
import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import org.apache.commons.lang3.StringUtils;

/**
 * 事件标签解析
 * <p>
 * screen_view 事件取 context.screen -> properties.path -> context.route -> "Unknown"，
 * 其余事件取事件名。
 */
public final class LabelResolver {

    private LabelResolver() {
    }

    public static String label(BehaviorEvent event) {
        if (!event.isScreenView()) {
            return firstNonBlank(event.getEventName());
        }
        return firstNonBlank(
                event.contextValue(BehaviorConsts.CONTEXT_SCREEN),
                event.propertyValue(BehaviorConsts.PROPERTY_PATH),
                event.contextValue(BehaviorConsts.CONTEXT_ROUTE));
    }

    /**
     * 页面路径，用于页面类指标：properties.path -> context.route -> context.screen -> "Unknown"
     */
    public static String pagePath(BehaviorEvent event) {
        return firstNonBlank(
                event.propertyValue(BehaviorConsts.PROPERTY_PATH),
                event.contextValue(BehaviorConsts.CONTEXT_ROUTE),
                event.contextValue(BehaviorConsts.CONTEXT_SCREEN));
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (StringUtils.isNotBlank(value)) {
                return value;
            }
        }
        return BehaviorConsts.UNKNOWN_LABEL;
    }
}
