package com.gnovoa.matchfeed.ws;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;

/**
 * One live viewer of one match.
 *
 * <p>This class owns:
 * <ul>
 *   <li>A bounded outbound queue the {@link MatchHub} fills without ever blocking</li>
 *   <li>The write loop that drains the queue to the transport and sends keepalive pings</li>
 *   <li>The liveness clock fed by inbound frames (pongs, small control messages)</li>
 * </ul>
 *
 * <p>Inbound frames are pushed in by the socket handler ({@link #onInbound}, {@link #onPong}); the
 * write loop enforces the read deadline on its keepalive ticks. Any transport failure, deadline
 * expiry or oversize frame ends in {@link MatchHub#unregister}. Identity is the instance: a closed
 * connection is never registered again.
 */
public final class MatchConnection {

    private static final Logger log = LoggerFactory.getLogger(MatchConnection.class);

    /** Close status sent to a viewer evicted for not keeping up; tells it to reconnect and resync. */
    public static final CloseStatus SLOW_CONSUMER =
            CloseStatus.SERVICE_OVERLOAD.withReason("slow consumer");

    /** Poison pill; compared by identity. */
    private static final String CLOSE_SIGNAL = "\u0000close";

    private final long matchId;
    private final Long viewerId;
    private final ViewerTransport transport;
    private final MatchHub hub;
    private final BlockingQueue<String> outbound;
    private final long pingPeriodNanos;
    private final long pongWaitNanos;
    private final int maxMessageBytes;

    private final AtomicBoolean queueClosed = new AtomicBoolean(false);
    private volatile CloseStatus closeStatus = CloseStatus.NORMAL;
    private volatile long lastActivityNanos = System.nanoTime();

    public MatchConnection(
            long matchId,
            Long viewerId,
            ViewerTransport transport,
            MatchHub hub,
            int sendBufferSize,
            Duration pingPeriod,
            Duration pongWait,
            int maxMessageBytes
    ) {
        if (pingPeriod.compareTo(pongWait) >= 0) {
            throw new IllegalArgumentException("ping period must be shorter than pong wait");
        }
        this.matchId = matchId;
        this.viewerId = viewerId;
        this.transport = transport;
        this.hub = hub;
        this.outbound = new ArrayBlockingQueue<>(sendBufferSize);
        this.pingPeriodNanos = pingPeriod.toNanos();
        this.pongWaitNanos = pongWait.toNanos();
        this.maxMessageBytes = maxMessageBytes;
    }

    public String id() { return transport.id(); }
    public long matchId() { return matchId; }
    /** @return authenticated viewer id, or {@code null} for anonymous viewers. */
    public Long viewerId() { return viewerId; }

    public boolean isQueueClosed() { return queueClosed.get(); }
    public int pendingMessages() { return outbound.size(); }

    /** Starts the write loop on the given executor. */
    public void start(Executor executor) {
        executor.execute(this::writeLoop);
    }

    /**
     * Queues a serialized message without blocking.
     *
     * @return false when the queue is full or already closed; the caller evicts this connection
     */
    boolean offer(String payload) {
        if (queueClosed.get()) return false;
        return outbound.offer(payload);
    }

    /**
     * Closes the outbound queue. Only the hub calls this, once, while removing the connection.
     * Messages still queued are discarded and the write loop closes the socket with {@code status}.
     *
     * @return true if this call closed the queue
     */
    boolean closeQueue(CloseStatus status) {
        if (!queueClosed.compareAndSet(false, true)) return false;
        closeStatus = status;
        outbound.clear();
        // if a racing offer refilled the queue the write loop still sees queueClosed on its next tick
        outbound.offer(CLOSE_SIGNAL);
        return true;
    }

    /** Records an inbound frame of {@code sizeBytes}; oversize frames terminate the connection. */
    public void onInbound(int sizeBytes) {
        if (sizeBytes > maxMessageBytes) {
            log.warn("Inbound frame too large match_id={} connection={} size={} limit={}",
                    matchId, id(), sizeBytes, maxMessageBytes);
            hub.unregister(this, CloseStatus.TOO_BIG_TO_PROCESS);
            return;
        }
        markAlive();
    }

    public void onPong() {
        markAlive();
    }

    /** Read side failed or the peer went away. */
    public void onTransportClosed(CloseStatus status) {
        log.debug("Transport closed match_id={} connection={} status={}", matchId, id(), status);
        hub.unregister(this);
    }

    public void onTransportError(Throwable error) {
        log.info("Transport error match_id={} connection={} error={}", matchId, id(), error.toString());
        hub.unregister(this, CloseStatus.SERVER_ERROR);
    }

    private void markAlive() {
        lastActivityNanos = System.nanoTime();
    }

    private void writeLoop() {
        long nextPing = System.nanoTime() + pingPeriodNanos;
        try {
            while (true) {
                long now = System.nanoTime();
                long deadline = lastActivityNanos + pongWaitNanos;
                long waitNanos = Math.min(nextPing, deadline) - now;

                String message = waitNanos > 0 ? outbound.poll(waitNanos, TimeUnit.NANOSECONDS) : null;

                if (message == CLOSE_SIGNAL || queueClosed.get()) {
                    transport.close(closeStatus);
                    return;
                }
                if (message != null) {
                    transport.sendText(message);
                    continue;
                }

                now = System.nanoTime();
                if (now - (lastActivityNanos + pongWaitNanos) >= 0) {
                    log.info("Read deadline expired match_id={} connection={}", matchId, id());
                    hub.unregister(this, CloseStatus.SESSION_NOT_RELIABLE);
                    return;
                }
                if (now - nextPing >= 0) {
                    transport.sendPing();
                    nextPing = now + pingPeriodNanos;
                }
            }
        } catch (IOException | RuntimeException e) {
            log.info("Write failed match_id={} connection={} error={}", matchId, id(), e.toString());
            hub.unregister(this, CloseStatus.SERVER_ERROR);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            hub.unregister(this, CloseStatus.GOING_AWAY);
        } finally {
            transport.close(closeStatus);
        }
    }

    @Override
    public String toString() {
        return "MatchConnection[" + id() + ", match " + matchId + "]";
    }
}
