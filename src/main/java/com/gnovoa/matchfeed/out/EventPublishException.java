package com.gnovoa.matchfeed.out;

/** A publish call that did not complete. {@link #stage()} tells how far it got. */
public class EventPublishException extends RuntimeException {

    public enum Stage {
        /** Nothing was written. */
        ENCODE,
        /** The durable append failed; nothing was published. */
        APPEND,
        /** The entry is in the log but the live notification did not go out. */
        PUBLISH
    }

    private final Stage stage;
    private final long matchId;

    public EventPublishException(Stage stage, long matchId, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.matchId = matchId;
    }

    public Stage stage() { return stage; }
    public long matchId() { return matchId; }
}
