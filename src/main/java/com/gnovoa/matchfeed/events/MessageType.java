package com.gnovoa.matchfeed.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Type tag of the envelope pushed to viewers. */
public enum MessageType {
    MATCH_EVENT("match_event"),
    SCORE_UPDATE("score_update"),
    MATCH_STATUS("match_status");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    @JsonCreator
    public static MessageType fromWireName(String value) {
        for (MessageType t : values()) {
            if (t.wireName.equals(value)) return t;
        }
        throw new IllegalArgumentException("Unknown message type " + value);
    }
}
