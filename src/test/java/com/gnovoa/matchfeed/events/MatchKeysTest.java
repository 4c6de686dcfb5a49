package com.gnovoa.matchfeed.events;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MatchKeysTest {

    @Test
    void keysDependOnlyOnTheMatchId() {
        assertThat(MatchKeys.eventsChannel(42)).isEqualTo("match:42:events");
        assertThat(MatchKeys.stream(42)).isEqualTo("match:42:stream");
        assertThat(MatchKeys.summaryCache(42)).isEqualTo("match:42");
        assertThat(MatchKeys.eventsCache(42)).isEqualTo("match:42:events");
        assertThat(MatchKeys.statsCache(42)).isEqualTo("match:42:stats");
    }

    @Test
    void extractsMatchIdFromEventsChannel() {
        assertThat(MatchKeys.matchIdFromChannel("match:42:events")).isEqualTo(42);
        assertThat(MatchKeys.matchIdFromChannel(MatchKeys.eventsChannel(123456789L))).isEqualTo(123456789L);
    }

    @Test
    void foreignChannelsYieldMinusOne() {
        assertThat(MatchKeys.matchIdFromChannel("match:42:stream")).isEqualTo(-1);
        assertThat(MatchKeys.matchIdFromChannel("match:abc:events")).isEqualTo(-1);
        assertThat(MatchKeys.matchIdFromChannel("team:42:events")).isEqualTo(-1);
        assertThat(MatchKeys.matchIdFromChannel(null)).isEqualTo(-1);
    }
}
