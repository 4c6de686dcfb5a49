package com.gnovoa.matchfeed.events;

import java.time.Instant;

public record ScoreUpdate(
        long matchId,
        int homeTeamScore,
        int awayTeamScore,
        Instant timestamp
) {
    public ScoreUpdate withTimestamp(Instant at) {
        return new ScoreUpdate(matchId, homeTeamScore, awayTeamScore, at);
    }
}
