package com.zcunsoft.clklog.behavior.bean;

import com.zcunsoft.clklog.behavior.exception.BehaviorQueryException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.zcunsoft.clklog.behavior.TestEvents.base;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryBeansTest {

    @Test
    void pathQueryRejectsNonPositiveLimits() {
        assertThatThrownBy(() -> PathQuery.of("Landing", 0, 5)).isInstanceOf(BehaviorQueryException.class)
                .hasMessageContaining("maxSteps");
        assertThatThrownBy(() -> PathQuery.of("Landing", 3, -1)).isInstanceOf(BehaviorQueryException.class)
                .hasMessageContaining("nodesPerStep");
    }

    @Test
    void pathQueryTreatsBlankStartAsDerived() {
        assertThat(PathQuery.of("  ", 3, 5).getStartingLabel()).isNull();
        assertThat(PathQuery.of(" Explore ", 3, 5).getStartingLabel()).isEqualTo("Explore");
        assertThat(PathQuery.defaults().getMaxSteps()).isEqualTo(3);
        assertThat(PathQuery.defaults().getNodesPerStep()).isEqualTo(5);
    }

    @Test
    void funnelDefinitionParsesCommaSeparatedSteps() {
        assertThat(FunnelDefinition.parse("Landing, Explore,,Event Page ", FunnelDefinition.DEFAULT_STEPS).getSteps())
                .containsExactly("Landing", "Explore", "Event Page");
        assertThat(FunnelDefinition.parse(null, List.of("A")).getSteps()).containsExactly("A");
        assertThat(FunnelDefinition.parse(" , ", List.of("A")).getSteps()).containsExactly("A");
    }

    @Test
    void platformFilterParsesLeniently() {
        assertThat(PlatformFilter.parse(null)).isEqualTo(PlatformFilter.ALL);
        assertThat(PlatformFilter.parse("All")).isEqualTo(PlatformFilter.ALL);
        assertThat(PlatformFilter.parse(" WEB ")).isEqualTo(PlatformFilter.WEB);
        assertThat(PlatformFilter.parse("mobile")).isEqualTo(PlatformFilter.MOBILE);
        assertThat(PlatformFilter.parse("desktop")).isEqualTo(PlatformFilter.ALL);
    }

    @Test
    void platformFilterMatchesPlatforms() {
        assertThat(PlatformFilter.WEB.matches("web")).isTrue();
        assertThat(PlatformFilter.WEB.matches("ios")).isFalse();
        assertThat(PlatformFilter.MOBILE.matches("ios")).isTrue();
        assertThat(PlatformFilter.MOBILE.matches("android")).isTrue();
        assertThat(PlatformFilter.MOBILE.matches(null)).isFalse();
        assertThat(PlatformFilter.ALL.matches(null)).isTrue();
    }

    @Test
    void eventQueryMatchesProdEventsInRange() {
        TimeRange range = new TimeRange(Instant.parse("2026-10-19T09:00:00Z"), Instant.parse("2026-10-19T11:00:00Z"));
        EventQuery query = EventQuery.prod(range, null);

        assertThat(query.getPlatformFilter()).isEqualTo(PlatformFilter.ALL);
        assertThat(query.matches(base("s1", 0, "search").build())).isTrue();
        assertThat(query.matches(base("s1", 0, "search").environment("dev").build())).isFalse();
        assertThat(query.matches(base("s1", 0, "search").environment(null).build())).isFalse();
        assertThat(query.matches(base("s1", 7200, "search").build())).isFalse();
    }

    @Test
    void sessionStreamsCountLabelOccurrences() {
        SessionStreams streams = new SessionStreams(java.util.Map.of("s1", List.of("A", "B", "A")));

        assertThat(streams.labelOccurrences("A")).isEqualTo(2);
        assertThat(streams.labelOccurrences("C")).isZero();
    }
}
