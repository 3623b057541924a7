package com.zcunsoft.clklog.behavior.utils;

import com.zcunsoft.clklog.behavior.TestEvents;
import com.zcunsoft.clklog.behavior.bean.BehaviorConsts;
import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LabelResolverTest {

    @Test
    void screenViewPrefersContextScreen() {
        BehaviorEvent event = TestEvents.base("s1", 0, BehaviorConsts.SCREEN_VIEW)
                .context(Map.of("screen", "Explore", "route", "/explore"))
                .properties(Map.of("path", "/explore?tab=1"))
                .build();

        assertThat(LabelResolver.label(event)).isEqualTo("Explore");
    }

    @Test
    void screenViewFallsBackToPathThenRoute() {
        BehaviorEvent withPath = TestEvents.base("s1", 0, BehaviorConsts.SCREEN_VIEW)
                .context(Map.of("route", "/r", "screen", " "))
                .properties(Map.of("path", "/p"))
                .build();
        BehaviorEvent withRoute = TestEvents.base("s1", 0, BehaviorConsts.SCREEN_VIEW)
                .context(Map.of("route", "/r"))
                .build();

        assertThat(LabelResolver.label(withPath)).isEqualTo("/p");
        assertThat(LabelResolver.label(withRoute)).isEqualTo("/r");
    }

    @Test
    void screenViewWithoutAnyHintIsUnknown() {
        BehaviorEvent event = TestEvents.action("s1", 0, BehaviorConsts.SCREEN_VIEW);

        assertThat(LabelResolver.label(event)).isEqualTo(BehaviorConsts.UNKNOWN_LABEL);
    }

    @Test
    void otherEventsUseEventName() {
        BehaviorEvent event = TestEvents.base("s1", 0, "event_registration")
                .context(Map.of("screen", "Event Page"))
                .build();

        assertThat(LabelResolver.label(event)).isEqualTo("event_registration");
    }

    @Test
    void pagePathPrefersPropertiesPath() {
        BehaviorEvent event = TestEvents.base("s1", 0, BehaviorConsts.SCREEN_VIEW)
                .context(Map.of("screen", "Explore", "route", "/explore"))
                .properties(Map.of("path", "/explore/all"))
                .build();

        assertThat(LabelResolver.pagePath(event)).isEqualTo("/explore/all");
        assertThat(LabelResolver.pagePath(TestEvents.screen("s1", 0, "Landing"))).isEqualTo("Landing");
    }
}
