package com.gnovoa.matchfeed.bridge;

/** A wildcard subscription on the pub/sub broker. */
public interface PatternSubscriber {

    /**
     * Subscribes and delivers messages to {@code listener} until {@link #unsubscribe()} is called.
     * Blocks the calling thread for the whole subscription.
     *
     * @throws RuntimeException when the broker is unreachable or the connection drops
     */
    void subscribe(String pattern, BrokerListener listener);

    /** Ends the current subscription, making {@link #subscribe} return. No-op when not subscribed. */
    void unsubscribe();
}
