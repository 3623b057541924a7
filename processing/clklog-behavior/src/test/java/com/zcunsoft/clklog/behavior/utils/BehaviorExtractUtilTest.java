package com.zcunsoft.clklog.behavior.utils;

import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BehaviorExtractUtilTest {

    @Test
    void mapsSingleEventLine() {
        String line = "{\"event_id\":\"e1\",\"event\":\"screen_view\",\"ts\":\"2026-10-19T10:00:00Z\","
                + "\"session_id\":\"s1\",\"user_id\":\"u1\",\"anonymous_id\":\"a1\",\"platform\":\"web\",\"env\":\"prod\","
                + "\"context\":{\"screen\":\"Landing\",\"viewport\":{\"w\":1280}},\"properties\":{\"path\":\"/\",\"count\":3}}";

        List<BehaviorEvent> events = BehaviorExtractUtil.extractToEventList(line);

        assertThat(events).hasSize(1);
        BehaviorEvent event = events.get(0);
        assertThat(event.getEventId()).isEqualTo("e1");
        assertThat(event.getEventName()).isEqualTo("screen_view");
        assertThat(event.getTimestamp()).isEqualTo(Instant.parse("2026-10-19T10:00:00Z"));
        assertThat(event.getSessionId()).isEqualTo("s1");
        assertThat(event.getActorId()).isEqualTo("u1");
        assertThat(event.getAnonymousId()).isEqualTo("a1");
        assertThat(event.getPlatform()).isEqualTo("web");
        assertThat(event.getEnvironment()).isEqualTo("prod");
        assertThat(event.contextValue("screen")).isEqualTo("Landing");
        assertThat(event.contextValue("viewport")).isEqualTo("{\"w\":1280}");
        assertThat(event.propertyValue("count")).isEqualTo("3");
    }

    @Test
    void mapsArrayLineAndSkipsInvalidEntries() {
        String line = "[{\"event\":\"search\",\"ts\":1760868000000,\"session_id\":\"s1\"},"
                + "{\"event\":\"search\",\"ts\":\"yesterday\",\"session_id\":\"s1\"},"
                + "{\"ts\":\"2026-10-19T10:00:00Z\",\"session_id\":\"s1\"},"
                + "\"not an object\"]";

        List<BehaviorEvent> events = BehaviorExtractUtil.extractToEventList(line);

        assertThat(events).hasSize(1);
        assertThat(events.get(0).getTimestamp()).isEqualTo(Instant.ofEpochMilli(1760868000000L));
        assertThat(events.get(0).getActorId()).isNull();
    }

    @Test
    void acceptsLenientJson() {
        List<BehaviorEvent> events = BehaviorExtractUtil.extractToEventList(
                "{event:'search', ts:'2026-10-19T10:00:00Z', session_id:'s1', unknown_field:1}");

        assertThat(events).extracting(BehaviorEvent::getEventName).containsExactly("search");
    }

    @Test
    void malformedLineYieldsNoEvents() {
        assertThat(BehaviorExtractUtil.extractToEventList("{broken")).isEmpty();
        assertThat(BehaviorExtractUtil.extractToEventList("")).isEmpty();
        assertThat(BehaviorExtractUtil.extractToEventList(null)).isEmpty();
    }
}
