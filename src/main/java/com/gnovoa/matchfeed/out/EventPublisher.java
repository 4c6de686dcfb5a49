package com.gnovoa.matchfeed.out;

import com.gnovoa.matchfeed.events.MatchEvent;
import com.gnovoa.matchfeed.events.MatchStatusUpdate;
import com.gnovoa.matchfeed.events.ScoreUpdate;
import java.util.List;

/**
 * Write side of the live feed. Each call stamps the update, appends it to the match log and then
 * notifies live viewers.
 */
public interface EventPublisher {

    /**
     * @return the event as published, carrying its authoritative timestamp
     * @throws EventPublishException if the append or the publish failed
     * @throws IllegalArgumentException if the event is not publishable
     */
    MatchEvent publishMatchEvent(MatchEvent event);

    ScoreUpdate publishScoreUpdate(ScoreUpdate update);

    MatchStatusUpdate publishStatusUpdate(MatchStatusUpdate update);

    /** Best-effort removal of cached views of a match; never throws for a single key failure. */
    List<CacheInvalidation> invalidateMatchCache(long matchId);
}
