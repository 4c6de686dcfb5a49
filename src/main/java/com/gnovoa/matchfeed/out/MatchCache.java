package com.gnovoa.matchfeed.out;

public interface MatchCache {

    /** @return true if the key existed and was removed */
    boolean delete(String key);
}
