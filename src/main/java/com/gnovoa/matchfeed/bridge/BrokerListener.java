package com.gnovoa.matchfeed.bridge;

/** Callbacks of a pattern subscription. Invoked on the subscribing thread, in delivery order. */
public interface BrokerListener {

    default void onSubscribed(String pattern) {}

    void onMessage(String channel, String payload);
}
