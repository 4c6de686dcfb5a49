package com.gnovoa.matchfeed.ws;

import java.io.IOException;
import org.springframework.web.socket.CloseStatus;

/** The duplex channel of one viewer, as seen by its {@link MatchConnection}. */
public interface ViewerTransport {

    String id();

    /** Writes one text frame. Bounded by the transport's write deadline. */
    void sendText(String payload) throws IOException;

    /** Writes a keepalive probe. */
    void sendPing() throws IOException;

    /** Closes the channel. Never throws; closing an already closed channel is a no-op. */
    void close(CloseStatus status);
}
