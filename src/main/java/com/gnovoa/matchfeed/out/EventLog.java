package com.gnovoa.matchfeed.out;

import java.util.Map;

/** Append-only, per-match ordered log read by analytics. */
public interface EventLog {

    /**
     * Appends one entry.
     *
     * @return the id the log assigned to the entry
     * @throws RuntimeException if the log is unreachable or rejects the entry
     */
    String append(String streamKey, Map<String, String> fields);
}
