package com.gnovoa.matchfeed.ws;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import jakarta.websocket.Session;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class SessionTransportTest {

    private ExecutorService sender;
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        sender = Executors.newCachedThreadPool();
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
    }

    @AfterEach
    void tearDown() {
        sender.shutdownNow();
    }

    @Test
    void writesTextFramesToTheSession() throws Exception {
        var transport = new SessionTransport(session, sender, Duration.ofSeconds(1), 1 << 20);

        transport.sendText("{\"type\":\"score_update\"}");

        verify(session).sendMessage(new TextMessage("{\"type\":\"score_update\"}"));
    }

    @Test
    void stalledWriteFailsAtTheWriteDeadline() throws Exception {
        CountDownLatch released = new CountDownLatch(1);
        doAnswer(inv -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                released.countDown();
                throw new IOException("write interrupted");
            }
            return null;
        }).when(session).sendMessage(any());
        var transport = new SessionTransport(session, sender, Duration.ofMillis(300), 1 << 20);

        long started = System.nanoTime();
        assertTimeoutPreemptively(Duration.ofSeconds(2), () ->
                assertThatThrownBy(() -> transport.sendText("{}"))
                        .isInstanceOf(IOException.class)
                        .hasMessageContaining("300ms"));

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(2000);
        assertThat(released.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void sessionFailuresSurfaceAsIoExceptions() throws Exception {
        doThrow(new IOException("connection reset")).when(session).sendMessage(any());
        var transport = new SessionTransport(session, sender, Duration.ofSeconds(1), 1 << 20);

        assertThatThrownBy(transport::sendPing)
                .isInstanceOf(IOException.class)
                .hasMessage("connection reset");
    }

    @Test
    void setsTheContainerSendTimeoutOnTomcatSessions() {
        NativeWebSocketSession nativeSession = mock(NativeWebSocketSession.class);
        Session container = mock(Session.class);
        Map<String, Object> userProperties = new HashMap<>();
        when(nativeSession.getNativeSession(Session.class)).thenReturn(container);
        when(container.getUserProperties()).thenReturn(userProperties);

        new SessionTransport(nativeSession, sender, Duration.ofSeconds(10), 1 << 20);

        assertThat(userProperties).containsEntry(SessionTransport.TOMCAT_BLOCKING_SEND_TIMEOUT, 10_000L);
    }
}
