package com.zcunsoft.clklog.behavior.metrics;

import com.zcunsoft.clklog.behavior.bean.BehaviorConsts;
import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import com.zcunsoft.clklog.behavior.bean.DashboardSnapshot;
import com.zcunsoft.clklog.behavior.bean.DevicesAndPlatforms;
import com.zcunsoft.clklog.behavior.bean.EventStat;
import com.zcunsoft.clklog.behavior.bean.EventsOverview;
import com.zcunsoft.clklog.behavior.bean.LabelCount;
import com.zcunsoft.clklog.behavior.bean.LocationStat;
import com.zcunsoft.clklog.behavior.bean.OverviewMetrics;
import com.zcunsoft.clklog.behavior.bean.PageStat;
import com.zcunsoft.clklog.behavior.bean.RealtimeMetrics;
import com.zcunsoft.clklog.behavior.bean.TrafficSource;
import com.zcunsoft.clklog.behavior.utils.LabelResolver;
import com.zcunsoft.clklog.behavior.utils.RateUtil;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 看板汇总指标计算
 * <p>
 * 对已过滤的事件做单次分组计数，不依赖会话内的先后顺序（入口/出口页除外）。
 * 列表按主计数降序，计数相同按键升序。
 */
public class AggregateMetricsCalculator {

    public static final int TOP_PAGES_LIMIT = 20;
    public static final int LOCATIONS_LIMIT = 50;
    public static final int DEVICES_LIMIT = 20;
    public static final int TOP_EVENTS_LIMIT = 30;
    public static final int REALTIME_PAGES_LIMIT = 10;
    public static final int LIVE_EVENTS_LIMIT = 20;

    private static final Comparator<BehaviorEvent> SESSION_ORDER = Comparator
            .comparing(BehaviorEvent::getSessionId)
            .thenComparing(BehaviorEvent::getTimestamp)
            .thenComparing(BehaviorEvent::getEventId, Comparator.nullsLast(Comparator.naturalOrder()));

    public DashboardSnapshot snapshot(List<BehaviorEvent> events) {
        return DashboardSnapshot.builder()
                .overview(overview(events))
                .topPages(topPages(events, TOP_PAGES_LIMIT))
                .trafficSources(trafficSources(events))
                .locations(locations(events, LOCATIONS_LIMIT))
                .devices(devicesAndPlatforms(events, DEVICES_LIMIT))
                .events(eventsOverview(events, TOP_EVENTS_LIMIT))
                .build();
    }

    public OverviewMetrics overview(List<BehaviorEvent> events) {
        Set<String> users = new HashSet<>();
        Set<String> sessions = new HashSet<>();
        Map<String, Long> pageViewsPerSession = new HashMap<>();
        Map<String, Instant[]> sessionBounds = new HashMap<>();
        long pageViews = 0;

        for (BehaviorEvent event : events) {
            if (event.getActorId() != null) {
                users.add(event.getActorId());
            }
            if (event.getAnonymousId() != null) {
                users.add(event.getAnonymousId());
            }
            if (event.isScreenView()) {
                pageViews++;
            }
            String sessionId = event.getSessionId();
            if (StringUtils.isBlank(sessionId)) {
                continue;
            }
            sessions.add(sessionId);
            if (event.isScreenView()) {
                pageViewsPerSession.merge(sessionId, 1L, Long::sum);
            }
            Instant ts = event.getTimestamp();
            if (ts != null) {
                Instant[] bounds = sessionBounds.computeIfAbsent(sessionId, k -> new Instant[]{ts, ts});
                if (ts.isBefore(bounds[0])) {
                    bounds[0] = ts;
                }
                if (ts.isAfter(bounds[1])) {
                    bounds[1] = ts;
                }
            }
        }

        long bounced = pageViewsPerSession.values().stream().filter(count -> count == 1L).count();

        double avgDurationMs = sessionBounds.values().stream()
                .mapToLong(bounds -> Duration.between(bounds[0], bounds[1]).toMillis())
                .average()
                .orElse(0D);

        return OverviewMetrics.builder()
                .uniqueUsers(users.size())
                .sessions(sessions.size())
                .pageViews(pageViews)
                .bounceRate(RateUtil.percent(bounced, pageViewsPerSession.size()))
                .avgSessionDuration(Math.round(avgDurationMs / 1000D))
                .build();
    }

    /**
     * 实时指标
     *
     * @param events 最近一小时的事件
     * @param now    当前时间
     */
    public RealtimeMetrics realtime(List<BehaviorEvent> events, Instant now) {
        List<BehaviorEvent> lastHour = within(events, now, Duration.ofMinutes(60));
        Set<String> users = new HashSet<>();
        long pageViews = 0;
        for (BehaviorEvent event : lastHour) {
            if (event.getActorId() != null) {
                users.add(event.getActorId());
            }
            if (event.getAnonymousId() != null) {
                users.add(event.getAnonymousId());
            }
            if (event.isScreenView()) {
                pageViews++;
            }
        }

        Map<String, Long> recentPages = countBy(within(events, now, Duration.ofMinutes(15)),
                BehaviorEvent::isScreenView, LabelResolver::pagePath);
        Map<String, Long> liveEvents = countBy(within(events, now, Duration.ofMinutes(5)),
                event -> true, event -> valueOrUnknown(event.getEventName()));

        return RealtimeMetrics.builder()
                .activeUsers(users.size())
                .pageViews(pageViews)
                .topPages(rank(recentPages, REALTIME_PAGES_LIMIT))
                .liveEvents(rank(liveEvents, LIVE_EVENTS_LIMIT))
                .build();
    }

    /**
     * 热门页面：浏览量、会话数、入口次数、出口次数、出口率
     */
    public List<PageStat> topPages(List<BehaviorEvent> events, int limit) {
        List<BehaviorEvent> pageViews = events.stream()
                .filter(BehaviorEvent::isScreenView)
                .filter(event -> StringUtils.isNotBlank(event.getSessionId()) && event.getTimestamp() != null)
                .sorted(SESSION_ORDER)
                .collect(Collectors.toList());

        Map<String, Long> views = new HashMap<>();
        Map<String, Set<String>> sessions = new HashMap<>();
        Map<String, Long> entrances = new HashMap<>();
        Map<String, Long> exits = new HashMap<>();

        String previousSession = null;
        String previousPath = null;
        for (BehaviorEvent event : pageViews) {
            String path = LabelResolver.pagePath(event);
            views.merge(path, 1L, Long::sum);
            sessions.computeIfAbsent(path, k -> new HashSet<>()).add(event.getSessionId());

            if (!event.getSessionId().equals(previousSession)) {
                entrances.merge(path, 1L, Long::sum);
                if (previousPath != null) {
                    exits.merge(previousPath, 1L, Long::sum);
                }
            }
            previousSession = event.getSessionId();
            previousPath = path;
        }
        if (previousPath != null) {
            exits.merge(previousPath, 1L, Long::sum);
        }

        List<PageStat> pages = new ArrayList<>();
        for (LabelCount item : rank(views, limit)) {
            String path = item.getLabel();
            long exitCount = exits.getOrDefault(path, 0L);
            pages.add(PageStat.builder()
                    .path(path)
                    .views(item.getCount())
                    .uniqueSessions(sessions.get(path).size())
                    .entrances(entrances.getOrDefault(path, 0L))
                    .exits(exitCount)
                    .exitRate(RateUtil.percent(exitCount, item.getCount()))
                    .build());
        }
        return pages;
    }

    public List<TrafficSource> trafficSources(List<BehaviorEvent> events) {
        Map<String, Long> views = new HashMap<>();
        Map<String, Set<String>> sessions = new HashMap<>();
        for (BehaviorEvent event : events) {
            if (!event.isScreenView()) {
                continue;
            }
            String referrer = event.contextValue(BehaviorConsts.CONTEXT_REFERRER);
            String source = StringUtils.isBlank(referrer) ? "direct" : referrer;
            views.merge(source, 1L, Long::sum);
            Set<String> sourceSessions = sessions.computeIfAbsent(source, k -> new HashSet<>());
            if (event.getSessionId() != null) {
                sourceSessions.add(event.getSessionId());
            }
        }

        List<TrafficSource> sources = new ArrayList<>();
        for (LabelCount item : rank(views, Integer.MAX_VALUE)) {
            sources.add(TrafficSource.builder()
                    .source(item.getLabel())
                    .views(item.getCount())
                    .sessions(sessions.get(item.getLabel()).size())
                    .build());
        }
        return sources;
    }

    public List<LocationStat> locations(List<BehaviorEvent> events, int limit) {
        Map<List<String>, Set<String>> users = new HashMap<>();
        for (BehaviorEvent event : events) {
            List<String> key = List.of(
                    valueOrUnknown(event.propertyValue(BehaviorConsts.PROPERTY_COUNTRY)),
                    valueOrUnknown(event.propertyValue(BehaviorConsts.PROPERTY_REGION)),
                    valueOrUnknown(event.propertyValue(BehaviorConsts.PROPERTY_CITY)));
            Set<String> locationUsers = users.computeIfAbsent(key, k -> new HashSet<>());
            if (event.actorKey() != null) {
                locationUsers.add(event.actorKey());
            }
        }

        return users.entrySet().stream()
                .sorted(Comparator.<Map.Entry<List<String>, Set<String>>>comparingInt(entry -> entry.getValue().size()).reversed()
                        .thenComparing(entry -> String.join("/", entry.getKey())))
                .limit(limit)
                .map(entry -> LocationStat.builder()
                        .country(entry.getKey().get(0))
                        .region(entry.getKey().get(1))
                        .city(entry.getKey().get(2))
                        .users(entry.getValue().size())
                        .build())
                .collect(Collectors.toList());
    }

    public DevicesAndPlatforms devicesAndPlatforms(List<BehaviorEvent> events, int limit) {
        return DevicesAndPlatforms.builder()
                .platforms(distinctUsersBy(events, event -> valueOrUnknown(event.getPlatform()), Integer.MAX_VALUE))
                .devices(distinctUsersBy(events, event -> valueOrUnknown(event.contextValue(BehaviorConsts.CONTEXT_DEVICE_MODEL)), limit))
                .os(distinctUsersBy(events, event -> valueOrUnknown(event.contextValue(BehaviorConsts.CONTEXT_OS_VERSION)), limit))
                .browsers(distinctUsersBy(events, event -> valueOrUnknown(event.getUserAgentSummary()), limit))
                .deviceTypes(distinctUsersBy(events, AggregateMetricsCalculator::deviceType, Integer.MAX_VALUE))
                .build();
    }

    public EventsOverview eventsOverview(List<BehaviorEvent> events, int limit) {
        Map<String, Long> counts = new HashMap<>();
        Map<String, Set<String>> sessions = new HashMap<>();
        Map<String, Long> eventsPerSession = new HashMap<>();
        for (BehaviorEvent event : events) {
            String name = valueOrUnknown(event.getEventName());
            counts.merge(name, 1L, Long::sum);
            Set<String> eventSessions = sessions.computeIfAbsent(name, k -> new HashSet<>());
            if (StringUtils.isNotBlank(event.getSessionId())) {
                eventSessions.add(event.getSessionId());
                eventsPerSession.merge(event.getSessionId(), 1L, Long::sum);
            }
        }

        List<EventStat> topEvents = new ArrayList<>();
        for (LabelCount item : rank(counts, limit)) {
            topEvents.add(EventStat.builder()
                    .event(item.getLabel())
                    .count(item.getCount())
                    .uniqueSessions(sessions.get(item.getLabel()).size())
                    .build());
        }

        double avg = eventsPerSession.values().stream().mapToLong(Long::longValue).average().orElse(0D);
        return EventsOverview.builder()
                .topEvents(topEvents)
                .avgEventsPerSession(RateUtil.round2(avg))
                .totalSessions(eventsPerSession.size())
                .build();
    }

    static String deviceType(BehaviorEvent event) {
        String platform = event.getPlatform();
        if (BehaviorConsts.PLATFORM_IOS.equalsIgnoreCase(platform) || BehaviorConsts.PLATFORM_ANDROID.equalsIgnoreCase(platform)) {
            return "mobile";
        }
        return "desktop";
    }

    private List<LabelCount> distinctUsersBy(List<BehaviorEvent> events, Function<BehaviorEvent, String> keyFn, int limit) {
        Map<String, Set<String>> users = new HashMap<>();
        for (BehaviorEvent event : events) {
            Set<String> keyUsers = users.computeIfAbsent(keyFn.apply(event), k -> new HashSet<>());
            if (event.actorKey() != null) {
                keyUsers.add(event.actorKey());
            }
        }
        Map<String, Long> counts = new HashMap<>();
        users.forEach((key, value) -> counts.put(key, (long) value.size()));
        return rank(counts, limit);
    }

    private static Map<String, Long> countBy(List<BehaviorEvent> events, Predicate<BehaviorEvent> filter, Function<BehaviorEvent, String> keyFn) {
        Map<String, Long> counts = new HashMap<>();
        for (BehaviorEvent event : events) {
            if (filter.test(event)) {
                counts.merge(keyFn.apply(event), 1L, Long::sum);
            }
        }
        return counts;
    }

    /**
     * 按计数降序、键升序排列并截断
     */
    private static List<LabelCount> rank(Map<String, Long> counts, int limit) {
        return new TreeMap<>(counts).entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(limit)
                .map(entry -> new LabelCount(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }

    private static List<BehaviorEvent> within(List<BehaviorEvent> events, Instant now, Duration window) {
        Instant from = now.minus(window);
        return events.stream()
                .filter(event -> event.getTimestamp() != null
                        && !event.getTimestamp().isBefore(from)
                        && !event.getTimestamp().isAfter(now))
                .collect(Collectors.toList());
    }

    private static String valueOrUnknown(String value) {
        return StringUtils.isBlank(value) ? BehaviorConsts.UNKNOWN_LABEL : value;
    }
}
