package com.zcunsoft.clklog.behavior.bean;

/**
 * 行为分析常量
 */
public final class BehaviorConsts {

    /**
     * 页面/屏幕浏览事件名
     */
    public static final String SCREEN_VIEW = "screen_view";

    /**
     * 无法解析出标签时的占位值
     */
    public static final String UNKNOWN_LABEL = "Unknown";

    /**
     * 参与报表统计的环境
     */
    public static final String ENV_PROD = "prod";

    public static final String CONTEXT_SCREEN = "screen";
    public static final String CONTEXT_ROUTE = "route";
    public static final String CONTEXT_REFERRER = "referrer";
    public static final String CONTEXT_DEVICE_MODEL = "device_model";
    public static final String CONTEXT_OS_VERSION = "os_version";

    public static final String PROPERTY_PATH = "path";
    public static final String PROPERTY_COUNTRY = "country";
    public static final String PROPERTY_REGION = "region";
    public static final String PROPERTY_CITY = "city";

    public static final String PLATFORM_WEB = "web";
    public static final String PLATFORM_IOS = "ios";
    public static final String PLATFORM_ANDROID = "android";

    private BehaviorConsts() {
    }
}
