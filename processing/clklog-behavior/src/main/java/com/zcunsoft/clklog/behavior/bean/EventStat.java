package com.zcunsoft.clklog.behavior.bean;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventStat {
    private String event;
    private long count;
    private long uniqueSessions;
}
