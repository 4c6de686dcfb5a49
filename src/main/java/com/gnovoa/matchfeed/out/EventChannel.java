package com.gnovoa.matchfeed.out;

/** Fire-and-forget pub/sub channel consumed by live bridges. */
public interface EventChannel {

    /** @return number of subscribers that received the message */
    long publish(String channel, String message);
}
