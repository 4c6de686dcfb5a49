package com.gnovoa.matchfeed.events;

import java.time.Instant;

public record MatchStatusUpdate(
        long matchId,
        MatchStatus status,
        Instant timestamp
) {
    public MatchStatusUpdate withTimestamp(Instant at) {
        return new MatchStatusUpdate(matchId, status, at);
    }
}
