package com.gnovoa.matchfeed.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MatchStatus {
    SCHEDULED,
    LIVE,
    FINISHED,
    POSTPONED,
    CANCELED;

    @JsonValue
    public String wireName() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static MatchStatus fromWireName(String value) {
        return MatchStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
