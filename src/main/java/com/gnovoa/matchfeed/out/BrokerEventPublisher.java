package com.gnovoa.matchfeed.out;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.matchfeed.events.EventCategory;
import com.gnovoa.matchfeed.events.MatchEvent;
import com.gnovoa.matchfeed.events.MatchKeys;
import com.gnovoa.matchfeed.events.MatchMessage;
import com.gnovoa.matchfeed.events.MatchStatusUpdate;
import com.gnovoa.matchfeed.events.MessageType;
import com.gnovoa.matchfeed.events.ScoreUpdate;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventPublisher} over a durable {@link EventLog} and a live {@link EventChannel}.
 *
 * <p>Every update is appended to {@code match:{id}:stream} first; only a successful append is
 * published to {@code match:{id}:events}. Timestamps never go backwards within one instance, even
 * if the wall clock does.
 */
public final class BrokerEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(BrokerEventPublisher.class);

    private final EventLog eventLog;
    private final EventChannel channel;
    private final MatchCache cache;
    private final ObjectMapper mapper;
    private final Clock clock;

    private final AtomicReference<Instant> lastStamp = new AtomicReference<>(Instant.EPOCH);

    public BrokerEventPublisher(EventLog eventLog, EventChannel channel, MatchCache cache, ObjectMapper mapper, Clock clock) {
        this.eventLog = eventLog;
        this.channel = channel;
        this.cache = cache;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public MatchEvent publishMatchEvent(MatchEvent event) {
        if (event == null) throw new IllegalArgumentException("event is required");
        requireMatchId(event.matchId());
        String eventType = EventCategory.normalize(event.eventType());
        if (!EventCategory.isValid(eventType)) {
            throw new IllegalArgumentException("Invalid event type '" + event.eventType() + "'");
        }

        MatchEvent stamped = event.withEventType(eventType).withTimestamp(nextStamp());
        appendThenPublish(MessageType.MATCH_EVENT, stamped.matchId(), stamped.eventType(), stamped, stamped.timestamp());

        log.info("Published match event match_id={} event_type={} category={} minute={}",
                stamped.matchId(), stamped.eventType(), stamped.category(), stamped.minute());
        return stamped;
    }

    @Override
    public ScoreUpdate publishScoreUpdate(ScoreUpdate update) {
        if (update == null) throw new IllegalArgumentException("update is required");
        requireMatchId(update.matchId());
        if (update.homeTeamScore() < 0 || update.awayTeamScore() < 0) {
            throw new IllegalArgumentException("Scores cannot be negative");
        }

        ScoreUpdate stamped = update.withTimestamp(nextStamp());
        appendThenPublish(MessageType.SCORE_UPDATE, stamped.matchId(), MessageType.SCORE_UPDATE.wireName(),
                stamped, stamped.timestamp());

        log.info("Published score update match_id={} home_score={} away_score={}",
                stamped.matchId(), stamped.homeTeamScore(), stamped.awayTeamScore());
        return stamped;
    }

    @Override
    public MatchStatusUpdate publishStatusUpdate(MatchStatusUpdate update) {
        if (update == null || update.status() == null) throw new IllegalArgumentException("status is required");
        requireMatchId(update.matchId());

        MatchStatusUpdate stamped = update.withTimestamp(nextStamp());
        appendThenPublish(MessageType.MATCH_STATUS, stamped.matchId(), MessageType.MATCH_STATUS.wireName(),
                stamped, stamped.timestamp());

        log.info("Published match status update match_id={} status={}",
                stamped.matchId(), stamped.status().wireName());
        return stamped;
    }

    @Override
    public List<CacheInvalidation> invalidateMatchCache(long matchId) {
        requireMatchId(matchId);
        List<String> keys = List.of(
                MatchKeys.summaryCache(matchId),
                MatchKeys.eventsCache(matchId),
                MatchKeys.statsCache(matchId));

        List<CacheInvalidation> results = new ArrayList<>(keys.size());
        for (String key : keys) {
            try {
                boolean deleted = cache.delete(key);
                results.add(new CacheInvalidation(key,
                        deleted ? CacheInvalidation.Outcome.DELETED : CacheInvalidation.Outcome.ABSENT, null));
            } catch (RuntimeException e) {
                log.error("Failed to invalidate cache key={} error={}", key, e.toString());
                results.add(new CacheInvalidation(key, CacheInvalidation.Outcome.FAILED, e.toString()));
            }
        }

        log.info("Invalidated match cache match_id={} failed_keys={}",
                matchId, results.stream().filter(CacheInvalidation::failed).count());
        return results;
    }

    private void appendThenPublish(MessageType type, long matchId, String eventType, Object payload, Instant at) {
        String data;
        String envelope;
        try {
            data = mapper.writeValueAsString(payload);
            envelope = mapper.writeValueAsString(new MatchMessage(type, matchId, at, mapper.valueToTree(payload)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventPublishException(EventPublishException.Stage.ENCODE, matchId,
                    "Failed to encode " + type.wireName(), e);
        }

        try {
            eventLog.append(MatchKeys.stream(matchId), Map.of(
                    "event_type", eventType,
                    "data", data,
                    "timestamp", String.valueOf(at.getEpochSecond())));
        } catch (RuntimeException e) {
            log.error("Failed to add event to stream match_id={} type={} error={}", matchId, type.wireName(), e.toString());
            throw new EventPublishException(EventPublishException.Stage.APPEND, matchId,
                    "Failed to add " + type.wireName() + " to stream", e);
        }

        try {
            channel.publish(MatchKeys.eventsChannel(matchId), envelope);
        } catch (RuntimeException e) {
            log.error("Failed to publish match_id={} type={} error={}", matchId, type.wireName(), e.toString());
            throw new EventPublishException(EventPublishException.Stage.PUBLISH, matchId,
                    "Failed to publish " + type.wireName(), e);
        }
    }

    /** Current time, or the previous stamp if the clock stepped back. */
    private Instant nextStamp() {
        Instant now = clock.instant();
        return lastStamp.accumulateAndGet(now, (prev, cur) -> cur.isBefore(prev) ? prev : cur);
    }

    private static void requireMatchId(long matchId) {
        if (matchId <= 0) throw new IllegalArgumentException("match id must be positive, got " + matchId);
    }
}
