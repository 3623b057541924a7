package com.zcunsoft.clklog.behavior.utils;

/**
 * 百分比计算，保留两位小数
 */
public final class RateUtil {

    private RateUtil() {
    }

    /**
     * @return part / total * 100，total 为 0 时返回 0
     */
    public static double percent(long part, long total) {
        if (total == 0) {
            return 0D;
        }
        return round2(part * 100D / total);
    }

    public static double round2(double value) {
        return Math.round(value * 100D) / 100D;
    }
}
