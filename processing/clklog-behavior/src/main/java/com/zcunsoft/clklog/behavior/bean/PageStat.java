package com.zcunsoft.clklog.behavior.bean;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageStat {
    private String path;
    private long views;
    private long uniqueSessions;
    /**
     * 作为会话首个页面的次数
     */
    private long entrances;
    /**
     * 作为会话最后页面的次数
     */
    private long exits;
    private double exitRate;
}
