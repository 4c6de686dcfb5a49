package com.gnovoa.matchfeed.ws;

import com.gnovoa.matchfeed.config.FeedProperties;
import java.security.Principal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Adapts Spring WebSocket callbacks to {@link MatchConnection}s.
 *
 * <p>Upgrade: one connection per session, registered with the hub, then its write loop starts.
 * Inbound frames, transport errors and close events are forwarded to the owning connection.
 */
public final class MatchSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(MatchSocketHandler.class);

    private final MatchHub hub;
    private final FeedProperties props;
    private final Executor writers;

    private final Map<String, MatchConnection> bySession = new ConcurrentHashMap<>();

    public MatchSocketHandler(MatchHub hub, FeedProperties props, Executor writers) {
        this.hub = hub;
        this.props = props;
        this.writers = writers;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Object attr = session.getAttributes().get(MatchHandshakeInterceptor.MATCH_ID_ATTR);
        if (!(attr instanceof Long matchId)) {
            log.warn("Session without match id connection={}", session.getId());
            closeQuietly(session);
            return;
        }

        var transport = new SessionTransport(
                session, writers, props.writeWait(), props.maxMessageBytes() * props.sendBufferSize());

        var conn = new MatchConnection(
                matchId,
                viewerId(session.getPrincipal()),
                transport,
                hub,
                props.sendBufferSize(),
                props.pingPeriod(),
                props.pongWait(),
                props.maxMessageBytes());

        bySession.put(session.getId(), conn);
        hub.register(conn);
        conn.start(writers);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        MatchConnection conn = bySession.get(session.getId());
        if (conn != null) conn.onInbound(message.getPayloadLength());
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        MatchConnection conn = bySession.get(session.getId());
        if (conn != null) conn.onPong();
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        MatchConnection conn = bySession.get(session.getId());
        if (conn != null) conn.onTransportError(exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        MatchConnection conn = bySession.remove(session.getId());
        if (conn != null) conn.onTransportClosed(status);
    }

    int trackedSessions() {
        return bySession.size();
    }

    /** Authentication is upstream; a numeric principal name is taken as the viewer id. */
    static Long viewerId(Principal principal) {
        if (principal == null || principal.getName() == null) return null;
        try {
            return Long.parseLong(principal.getName());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.BAD_DATA);
        } catch (java.io.IOException e) {
            log.debug("Close failed connection={}", session.getId(), e);
        }
    }
}
