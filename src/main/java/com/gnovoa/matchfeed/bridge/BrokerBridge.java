package com.gnovoa.matchfeed.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.matchfeed.events.MatchKeys;
import com.gnovoa.matchfeed.events.MatchMessage;
import com.gnovoa.matchfeed.ws.MatchHub;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds broker messages into the {@link MatchHub}.
 *
 * <p>One wildcard subscription covers every match channel. Each message is decoded and handed to
 * the hub intake on the subscribing thread, so channel order is preserved and at most one message
 * is in flight. Undecodable messages are logged and skipped. A dropped or unreachable broker is
 * retried after a fixed backoff; the loop ends only on {@link #stop()}.
 */
public final class BrokerBridge {

    private static final Logger log = LoggerFactory.getLogger(BrokerBridge.class);

    private final PatternSubscriber subscriber;
    private final MatchHub hub;
    private final ObjectMapper mapper;
    private final String pattern;
    private final Duration backoff;

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();

    private volatile BridgeState state = BridgeState.IDLE;
    private volatile CountDownLatch stopSignal;
    private ExecutorService exec;

    public BrokerBridge(PatternSubscriber subscriber, MatchHub hub, ObjectMapper mapper, String pattern, Duration backoff) {
        this.subscriber = subscriber;
        this.hub = hub;
        this.mapper = mapper;
        this.pattern = pattern;
        this.backoff = backoff;
    }

    public BridgeState state() { return state; }
    public long received() { return received.get(); }
    public long malformed() { return malformed.get(); }
    public long retries() { return retries.get(); }

    public synchronized void start() {
        if (exec != null) return;
        stopSignal = new CountDownLatch(1);
        exec = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "broker-bridge");
            t.setDaemon(true);
            return t;
        });
        state = BridgeState.CONNECTING;
        exec.execute(this::receiveLoop);
    }

    public synchronized void stop() {
        if (exec == null) return;
        stopSignal.countDown();
        subscriber.unsubscribe();
        exec.shutdownNow();
        try {
            if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Broker bridge did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        exec = null;
        state = BridgeState.STOPPED;
        log.info("Broker bridge stopped");
    }

    private boolean stopping() {
        return stopSignal.getCount() == 0 || Thread.currentThread().isInterrupted();
    }

    private void receiveLoop() {
        var listener = new BrokerListener() {
            @Override
            public void onSubscribed(String p) {
                if (stopping()) {
                    // stop() ran before the subscription existed
                    subscriber.unsubscribe();
                    return;
                }
                state = BridgeState.SUBSCRIBED;
                log.info("Started broker listener pattern={}", p);
            }

            @Override
            public void onMessage(String channel, String payload) {
                deliver(channel, payload);
            }
        };

        while (!stopping()) {
            try {
                subscriber.subscribe(pattern, listener);
                if (stopping()) break;
                log.warn("Broker subscription ended unexpectedly, retrying in {}ms", backoff.toMillis());
            } catch (RuntimeException e) {
                if (stopping()) break;
                log.error("Broker receive failed, retrying in {}ms error={}", backoff.toMillis(), e.toString());
            }
            state = BridgeState.RECONNECTING;
            retries.incrementAndGet();
            try {
                if (stopSignal.await(backoff.toMillis(), TimeUnit.MILLISECONDS)) break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            state = BridgeState.CONNECTING;
        }
    }

    /** Decodes one broker payload and hands it to the hub. Malformed payloads are skipped. */
    void deliver(String channel, String payload) {
        received.incrementAndGet();
        MatchMessage message;
        try {
            message = mapper.readValue(payload, MatchMessage.class);
        } catch (JsonProcessingException e) {
            malformed.incrementAndGet();
            log.error("Failed to decode broker message channel={} error={}", channel, e.getOriginalMessage());
            return;
        }
        if (message == null || message.type() == null || message.matchId() <= 0) {
            malformed.incrementAndGet();
            log.error("Broker message without type or match id channel={}", channel);
            return;
        }
        long channelMatchId = MatchKeys.matchIdFromChannel(channel);
        if (channelMatchId > 0 && channelMatchId != message.matchId()) {
            malformed.incrementAndGet();
            log.error("Broker message for match {} arrived on channel={}", message.matchId(), channel);
            return;
        }
        try {
            hub.submit(message);
        } catch (InterruptedException e) {
            // stop() interrupts the subscribing thread; the loop exits after this callback returns
            Thread.currentThread().interrupt();
            subscriber.unsubscribe();
        }
    }
}
