package com.gnovoa.matchfeed.ws;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.matchfeed.config.JacksonConfig;
import com.gnovoa.matchfeed.events.MatchMessage;
import com.gnovoa.matchfeed.events.MessageType;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;

class MatchConnectionTest {

    private final ObjectMapper mapper = new JacksonConfig().objectMapper();
    private ExecutorService writers;
    private MatchHub hub;
    private RecordingTransport transport;

    @BeforeEach
    void setUp() {
        writers = Executors.newCachedThreadPool();
        hub = new MatchHub(mapper, Clock.systemUTC(), 16);
        transport = new RecordingTransport();
    }

    @AfterEach
    void tearDown() {
        writers.shutdownNow();
    }

    private MatchConnection fastKeepalive() {
        return new MatchConnection(42, 7L, transport, hub, 8,
                Duration.ofMillis(100), Duration.ofMillis(300), 512);
    }

    private MatchConnection slowKeepalive() {
        return new MatchConnection(42, null, transport, hub, 8,
                Duration.ofSeconds(9), Duration.ofSeconds(10), 512);
    }

    private MatchMessage score(int home) {
        return new MatchMessage(MessageType.SCORE_UPDATE, 42, Instant.now(),
                mapper.valueToTree(Map.of("home_team_score", home, "away_team_score", 0)));
    }

    @Test
    void writesQueuedMessagesInOrder() throws Exception {
        var conn = slowKeepalive();
        hub.register(conn);
        conn.start(writers);

        for (int i = 0; i < 5; i++) hub.broadcast(score(i));

        for (int i = 0; i < 5; i++) {
            var json = mapper.readTree(transport.awaitMessage(2000));
            assertThat(json.get("data").get("home_team_score").asInt()).isEqualTo(i);
        }
    }

    @Test
    void pingsWhileViewerAnswersAndStaysOpen() throws Exception {
        var conn = fastKeepalive();
        hub.register(conn);
        conn.start(writers);

        long until = System.currentTimeMillis() + 700;
        while (System.currentTimeMillis() < until) {
            conn.onPong();
            Thread.sleep(50);
        }

        assertThat(transport.pings()).isGreaterThanOrEqualTo(3);
        assertThat(transport.isOpen()).isTrue();
        assertThat(hub.connectionCount(42)).isEqualTo(1);
        hub.unregister(conn);
    }

    @Test
    void silentViewerIsDroppedWhenReadDeadlinePasses() throws Exception {
        var conn = fastKeepalive();
        hub.register(conn);
        conn.start(writers);

        assertThat(transport.awaitClosed(2000)).isTrue();

        assertThat(transport.closeStatus()).isEqualTo(CloseStatus.SESSION_NOT_RELIABLE);
        assertThat(hub.connectionCount(42)).isZero();
        assertThat(transport.pings()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void writeFailureUnregistersTheViewer() throws Exception {
        var conn = slowKeepalive();
        hub.register(conn);
        transport.failSendsWith(new IOException("broken pipe"));
        conn.start(writers);

        hub.broadcast(score(1));

        assertThat(transport.awaitClosed(2000)).isTrue();
        assertThat(transport.closeStatus()).isEqualTo(CloseStatus.SERVER_ERROR);
        assertThat(hub.connectionCount(42)).isZero();
    }

    @Test
    void oversizeInboundFrameClosesWithTooBig() throws Exception {
        var conn = slowKeepalive();
        hub.register(conn);
        conn.start(writers);

        conn.onInbound(128);
        assertThat(hub.connectionCount(42)).isEqualTo(1);

        conn.onInbound(513);

        assertThat(transport.awaitClosed(2000)).isTrue();
        assertThat(transport.closeStatus()).isEqualTo(CloseStatus.TOO_BIG_TO_PROCESS);
        assertThat(conn.isQueueClosed()).isTrue();
    }

    @Test
    void peerCloseUnregistersNormally() throws Exception {
        var conn = slowKeepalive();
        hub.register(conn);
        conn.start(writers);

        conn.onTransportClosed(CloseStatus.GOING_AWAY);

        assertThat(transport.awaitClosed(2000)).isTrue();
        assertThat(transport.closeStatus()).isEqualTo(CloseStatus.NORMAL);
        assertThat(hub.liveMatchCount()).isZero();
    }

    @Test
    void closedQueueRejectsFurtherOffers() {
        var conn = slowKeepalive();
        hub.register(conn);
        hub.unregister(conn);

        assertThat(conn.offer("{}")).isFalse();
    }

    @Test
    void rejectsPingPeriodNotShorterThanPongWait() {
        assertThatThrownBy(() -> new MatchConnection(1, null, transport, hub, 4,
                Duration.ofSeconds(10), Duration.ofSeconds(10), 512))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
