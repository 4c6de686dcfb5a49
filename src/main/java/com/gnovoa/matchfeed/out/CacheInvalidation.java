package com.gnovoa.matchfeed.out;

/**
 * Result of deleting one cached view.
 *
 * @param key cache key
 * @param outcome what happened
 * @param error failure description, null unless {@code outcome == FAILED}
 */
public record CacheInvalidation(String key, Outcome outcome, String error) {

    public enum Outcome {
        DELETED,
        ABSENT,
        FAILED
    }

    public boolean failed() {
        return outcome == Outcome.FAILED;
    }
}
