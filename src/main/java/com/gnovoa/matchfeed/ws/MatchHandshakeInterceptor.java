package com.gnovoa.matchfeed.ws;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

/**
 * Resolves the match id from {@code /ws/matches/{matchId}} before the upgrade. An invalid id
 * refuses the handshake with 400 and nothing is created.
 */
public final class MatchHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(MatchHandshakeInterceptor.class);

    static final String MATCH_ID_ATTR = "matchId";

    @Override
    public boolean beforeHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Map<String, Object> attributes
    ) {
        Long matchId = parseMatchId(request.getURI().getPath());
        if (matchId == null) {
            log.info("Rejecting subscription, invalid match id path={}", request.getURI().getPath());
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }
        attributes.put(MATCH_ID_ATTR, matchId);
        return true;
    }

    @Override
    public void afterHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Exception exception
    ) {
        if (exception != null) {
            log.info("Upgrade failed path={} error={}", request.getURI().getPath(), exception.toString());
        }
    }

    /** @return the positive match id in the last path segment, or null. */
    static Long parseMatchId(String path) {
        if (path == null) return null;
        String[] p = path.split("/");
        if (p.length == 0) return null;
        try {
            long id = Long.parseLong(p[p.length - 1]);
            return id > 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
