package com.zcunsoft.clklog.behavior.bean;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventsOverview {
    private List<EventStat> topEvents;
    private double avgEventsPerSession;
    private long totalSessions;
}
