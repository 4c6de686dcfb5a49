package com.gnovoa.matchfeed.events;

/**
 * Broker keyspace, derived from the match id only.
 *
 * <ul>
 *   <li>{@code match:{id}:events} pub/sub channel carrying {@link MatchMessage} JSON</li>
 *   <li>{@code match:{id}:stream} stream, one entry per published update (analytics)</li>
 *   <li>{@code match:{id}}, {@code match:{id}:events}, {@code match:{id}:stats} cached read views</li>
 * </ul>
 *
 * <p>Channels and keys live in separate broker namespaces, so the events channel and the cached
 * event list can share a name.
 */
public final class MatchKeys {
    private MatchKeys() {
    }

    public static final String EVENTS_PATTERN = "match:*:events";

    private static final String PREFIX = "match:";
    private static final String EVENTS_SUFFIX = ":events";

    public static String eventsChannel(long matchId) {
        return PREFIX + matchId + EVENTS_SUFFIX;
    }

    public static String stream(long matchId) {
        return PREFIX + matchId + ":stream";
    }

    public static String summaryCache(long matchId) {
        return PREFIX + matchId;
    }

    public static String eventsCache(long matchId) {
        return PREFIX + matchId + EVENTS_SUFFIX;
    }

    public static String statsCache(long matchId) {
        return PREFIX + matchId + ":stats";
    }

    /**
     * Extracts the id from an events channel name.
     *
     * @return the match id, or -1 if the channel does not follow {@code match:{id}:events}
     */
    public static long matchIdFromChannel(String channel) {
        if (channel == null || !channel.startsWith(PREFIX) || !channel.endsWith(EVENTS_SUFFIX)) return -1;
        String id = channel.substring(PREFIX.length(), channel.length() - EVENTS_SUFFIX.length());
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
