package com.zcunsoft.clklog.behavior;

import com.zcunsoft.clklog.behavior.bean.BehaviorConsts;
import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import com.zcunsoft.clklog.behavior.bean.SessionStreams;
import com.zcunsoft.clklog.behavior.cfg.BehaviorSettings;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 测试事件构造
 */
public final class TestEvents {

    public static final Instant BASE = Instant.parse("2026-10-19T10:00:00Z");

    private TestEvents() {
    }

    public static BehaviorEvent screen(String sessionId, long offsetSeconds, String screen) {
        return base(sessionId, offsetSeconds, BehaviorConsts.SCREEN_VIEW)
                .context(Map.of(BehaviorConsts.CONTEXT_SCREEN, screen))
                .build();
    }

    public static BehaviorEvent action(String sessionId, long offsetSeconds, String eventName) {
        return base(sessionId, offsetSeconds, eventName).build();
    }

    public static BehaviorEvent.BehaviorEventBuilder base(String sessionId, long offsetSeconds, String eventName) {
        return BehaviorEvent.builder()
                .eventId(sessionId + "-" + offsetSeconds + "-" + eventName)
                .sessionId(sessionId)
                .timestamp(BASE.plusSeconds(offsetSeconds))
                .eventName(eventName)
                .anonymousId("anon-" + sessionId)
                .platform(BehaviorConsts.PLATFORM_WEB)
                .environment(BehaviorConsts.ENV_PROD);
    }

    /**
     * 直接构造会话流，参数依次为 sessionId、标签列表
     */
    public static SessionStreams streams(Object... sessionAndLabels) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < sessionAndLabels.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<String> labels = (List<String>) sessionAndLabels[i + 1];
            map.put((String) sessionAndLabels[i], labels);
        }
        return new SessionStreams(map);
    }

    /**
     * 读取测试 classpath 下的 behavior.properties
     */
    public static BehaviorSettings settings() {
        Properties props = new Properties();
        try (InputStream is = TestEvents.class.getClassLoader().getResourceAsStream(BehaviorSettings.CONFIG_RESOURCE)) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return BehaviorSettings.fromProperties(props);
    }
}
