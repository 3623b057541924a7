package com.zcunsoft.clklog.behavior.bean;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 平台过滤条件
 */
public enum PlatformFilter {

    ALL,

    /**
     * platform == web
     */
    WEB,

    /**
     * platform in (ios, android)
     */
    MOBILE;

    private static final Logger logger = LoggerFactory.getLogger(PlatformFilter.class);

    /**
     * 解析平台参数，未设置或无法识别时不过滤
     *
     * @param value 参数值 web / mobile / all
     * @return 平台过滤条件
     */
    public static PlatformFilter parse(String value) {
        if (StringUtils.isBlank(value) || "all".equalsIgnoreCase(value.trim())) {
            return ALL;
        }
        String code = value.trim();
        if ("web".equalsIgnoreCase(code)) {
            return WEB;
        }
        if ("mobile".equalsIgnoreCase(code)) {
            return MOBILE;
        }
        logger.warn("Unrecognised platform filter '{}', no platform filter applied", value);
        return ALL;
    }

    public boolean matches(String platform) {
        switch (this) {
            case WEB:
                return BehaviorConsts.PLATFORM_WEB.equalsIgnoreCase(platform);
            case MOBILE:
                return BehaviorConsts.PLATFORM_IOS.equalsIgnoreCase(platform)
                        || BehaviorConsts.PLATFORM_ANDROID.equalsIgnoreCase(platform);
            default:
                return true;
        }
    }
}
