package com.gnovoa.matchfeed.ws;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * {@link ViewerTransport} over a Spring {@link WebSocketSession}.
 *
 * <p>Every frame is written on the sender executor while the caller waits at most the write
 * deadline; a send still running after that is cancelled and reported as an {@link IOException}.
 * On Tomcat the container's own blocking-send timeout is set to the same deadline so the stalled
 * socket write is released too.
 */
final class SessionTransport implements ViewerTransport {

    private static final Logger log = LoggerFactory.getLogger(SessionTransport.class);
    private static final ByteBuffer PING_PAYLOAD = ByteBuffer.wrap(new byte[0]);

    static final String TOMCAT_BLOCKING_SEND_TIMEOUT = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    private final WebSocketSession session;
    private final Executor sender;
    private final long writeWaitMillis;

    SessionTransport(WebSocketSession session, Executor sender, Duration writeWait, int bufferSizeLimitBytes) {
        this.writeWaitMillis = writeWait.toMillis();
        this.sender = sender;
        this.session = new ConcurrentWebSocketSessionDecorator(
                session, Math.toIntExact(writeWaitMillis), bufferSizeLimitBytes);
        applyContainerSendTimeout(session, writeWaitMillis);
    }

    @Override public String id() { return session.getId(); }

    @Override
    public void sendText(String payload) throws IOException {
        send(new TextMessage(payload));
    }

    @Override
    public void sendPing() throws IOException {
        send(new PingMessage(PING_PAYLOAD.duplicate()));
    }

    private void send(WebSocketMessage<?> message) throws IOException {
        FutureTask<Void> task = new FutureTask<>(() -> {
            session.sendMessage(message);
            return null;
        });
        sender.execute(task);
        try {
            task.get(writeWaitMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw new IOException("Write deadline of " + writeWaitMillis + "ms exceeded");
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while writing");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) throw io;
            if (cause instanceof RuntimeException re) throw re;
            throw new IOException(cause);
        }
    }

    @Override
    public void close(CloseStatus status) {
        if (!session.isOpen()) return;
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Close failed connection={} status={}", session.getId(), status, e);
        }
    }

    private static void applyContainerSendTimeout(WebSocketSession session, long millis) {
        if (!(session instanceof NativeWebSocketSession nativeSession)) return;
        jakarta.websocket.Session ws = nativeSession.getNativeSession(jakarta.websocket.Session.class);
        if (ws != null) {
            // Tomcat reads this property as a Long
            ws.getUserProperties().put(TOMCAT_BLOCKING_SEND_TIMEOUT, Long.valueOf(millis));
        }
    }
}
