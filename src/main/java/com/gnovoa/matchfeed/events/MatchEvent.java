package com.gnovoa.matchfeed.events;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A single on-pitch incident (goal, shot, card, substitution, ...).
 *
 * <p>Optional references are {@code null} when unknown and omitted from JSON. {@code metadata} is
 * an opaque JSON string (xG, pass completion, provider extras).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchEvent(
        long id,
        long matchId,
        Long teamId,
        Long playerId,
        Long secondaryPlayerId,
        String eventType,
        int minute,
        int extraMinute,
        Double positionX,
        Double positionY,
        String description,
        String metadata,
        Instant timestamp
) {

    public MatchEvent withTimestamp(Instant at) {
        return new MatchEvent(id, matchId, teamId, playerId, secondaryPlayerId, eventType, minute,
                extraMinute, positionX, positionY, description, metadata, at);
    }

    public MatchEvent withEventType(String type) {
        return new MatchEvent(id, matchId, teamId, playerId, secondaryPlayerId, type, minute,
                extraMinute, positionX, positionY, description, metadata, timestamp);
    }

    public EventCategory category() {
        return EventCategory.of(eventType);
    }
}
