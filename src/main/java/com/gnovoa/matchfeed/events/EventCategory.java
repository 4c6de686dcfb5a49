package com.gnovoa.matchfeed.events;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Groups free-form event types for analytics and filtering.
 *
 * <p>Event types are not a closed set: data providers send thousands of variants. Anything that is
 * well-formed but not listed here falls into {@link #OTHER}.
 */
public enum EventCategory {
    GOAL("goal", "own_goal", "penalty", "penalty_goal", "penalty_miss"),
    CARD("yellow_card", "red_card", "second_yellow_card"),
    SUBSTITUTION("substitution", "substitution_on", "substitution_off"),
    SHOT("shot", "shot_on_target", "shot_off_target", "shot_blocked", "shot_saved", "shot_post",
            "shot_woodwork"),
    PASS("pass", "pass_completed", "pass_incomplete", "key_pass", "assist", "through_ball", "cross",
            "long_ball", "short_pass"),
    DEFENSIVE("tackle", "tackle_won", "tackle_lost", "interception", "clearance", "block",
            "blocked_shot"),
    DUEL("duel", "duel_won", "duel_lost", "aerial_duel", "aerial_duel_won", "aerial_duel_lost",
            "ground_duel"),
    FOUL("foul", "foul_committed", "foul_won", "offside"),
    GOALKEEPER("save", "save_penalty", "save_six_yard_box", "save_penalty_area", "save_out_of_box",
            "punch", "claim", "sweeper_keeper"),
    VAR("var_review", "var_goal", "var_penalty", "var_red_card"),
    MATCH_STATE("kick_off", "half_time", "full_time", "extra_time", "penalty_shootout"),
    OTHER;

    /** Matches the database column: lowercase, digits and underscores, at most 50 chars. */
    private static final Pattern VALID_TYPE = Pattern.compile("[a-z0-9_]{1,50}");

    private static final Map<String, EventCategory> BY_TYPE = new HashMap<>();

    static {
        for (EventCategory c : values()) {
            for (String t : c.types) BY_TYPE.put(t, c);
        }
    }

    private final List<String> types;

    EventCategory(String... types) {
        this.types = List.of(types);
    }

    public List<String> types() { return types; }

    public static EventCategory of(String eventType) {
        if (eventType == null) return OTHER;
        return BY_TYPE.getOrDefault(normalize(eventType), OTHER);
    }

    public static String normalize(String eventType) {
        return eventType == null ? null : eventType.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String eventType) {
        return eventType != null && VALID_TYPE.matcher(eventType).matches();
    }
}
