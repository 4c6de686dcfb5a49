package com.gnovoa.matchfeed.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.matchfeed.events.MatchMessage;
import com.gnovoa.matchfeed.events.MessageType;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;

/**
 * Registry of live viewers per match and the fan-out path that feeds them.
 *
 * <p>The {@code matchId -> connections} map never leaves this class. Register and unregister take
 * the write lock; fan-out takes the read lock. The lock is never held across socket I/O: fan-out
 * only offers to bounded queues and evicts whoever is full.
 *
 * <p>Updates reach the hub either through the intake queue ({@link #submit}, drained by a single
 * dispatch thread so per-match order is the submission order) or synchronously via
 * {@link #broadcast}.
 */
public final class MatchHub {

    private static final Logger log = LoggerFactory.getLogger(MatchHub.class);

    private final ObjectMapper mapper;
    private final Clock clock;
    private final BlockingQueue<MatchMessage> intake;

    private final Map<Long, Set<MatchConnection>> connections = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile ExecutorService dispatcher;

    public MatchHub(ObjectMapper mapper, Clock clock, int intakeBufferSize) {
        this.mapper = mapper;
        this.clock = clock;
        this.intake = new ArrayBlockingQueue<>(intakeBufferSize);
    }

    /** Outcome of one fan-out. */
    public record FanOut(int delivered, int evicted) {
        static final FanOut NONE = new FanOut(0, 0);
    }

    // ---- membership ----

    /**
     * Adds the connection to its match, creating the match entry if needed. Registering the same
     * connection twice is a no-op; a connection whose queue is already closed is ignored.
     */
    public void register(MatchConnection conn) {
        int total;
        lock.writeLock().lock();
        try {
            if (conn.isQueueClosed()) {
                log.debug("Ignoring register of closed connection {}", conn);
                return;
            }
            Set<MatchConnection> set = connections.computeIfAbsent(conn.matchId(), k -> new LinkedHashSet<>());
            set.add(conn);
            total = set.size();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Viewer registered match_id={} connection={} viewer_id={} total_viewers={}",
                conn.matchId(), conn.id(), conn.viewerId(), total);
    }

    /** Removes the connection and closes its queue. Safe to call any number of times. */
    public void unregister(MatchConnection conn) {
        unregister(conn, CloseStatus.NORMAL);
    }

    void unregister(MatchConnection conn, CloseStatus status) {
        boolean removed = false;
        lock.writeLock().lock();
        try {
            Set<MatchConnection> set = connections.get(conn.matchId());
            if (set != null && set.remove(conn)) {
                removed = true;
                conn.closeQueue(status);
                if (set.isEmpty()) connections.remove(conn.matchId());
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed) {
            log.info("Viewer unregistered match_id={} connection={} status={}",
                    conn.matchId(), conn.id(), status.getCode());
        }
    }

    // ---- fan-out ----

    /**
     * Serializes the message once and offers it to every viewer of its match. Viewers whose queue
     * is full are evicted with {@link MatchConnection#SLOW_CONSUMER}. No viewers means the message is
     * dropped.
     */
    public FanOut broadcast(MatchMessage message) {
        long matchId = message.matchId();
        List<MatchConnection> slow = new ArrayList<>();
        int delivered = 0;

        lock.readLock().lock();
        try {
            Set<MatchConnection> set = connections.get(matchId);
            if (set == null) {
                log.debug("Broadcast dropped, no viewers match_id={} type={}", matchId, message.type().wireName());
                return FanOut.NONE;
            }
            String payload;
            try {
                payload = mapper.writeValueAsString(message);
            } catch (JsonProcessingException e) {
                log.error("Failed to encode message match_id={} type={}", matchId, message.type().wireName(), e);
                return FanOut.NONE;
            }
            for (MatchConnection c : set) {
                if (c.offer(payload)) delivered++;
                else slow.add(c);
            }
        } finally {
            lock.readLock().unlock();
        }

        for (MatchConnection c : slow) {
            log.warn("Evicting slow viewer match_id={} connection={}", matchId, c.id());
            unregister(c, MatchConnection.SLOW_CONSUMER);
        }
        return new FanOut(delivered, slow.size());
    }

    /**
     * Queues a message for the dispatch thread. Blocks while the intake is full so the producer
     * (the broker bridge) slows down instead of losing updates.
     */
    public void submit(MatchMessage message) throws InterruptedException {
        intake.put(message);
    }

    /** Server-side broadcast that skips the broker; the envelope is stamped now. */
    public void broadcastToMatch(long matchId, MessageType type, Object data) throws InterruptedException {
        submit(new MatchMessage(type, matchId, clock.instant(), mapper.valueToTree(data)));
    }

    // ---- lifecycle ----

    public synchronized void start() {
        if (dispatcher != null) return;
        dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "match-hub-dispatch");
            t.setDaemon(true);
            return t;
        });
        dispatcher.execute(this::dispatchLoop);
        log.info("Hub dispatch started");
    }

    /** Stops consuming the intake. Registered viewers stay connected; their sockets close on their own. */
    public synchronized void stop() {
        if (dispatcher == null) return;
        dispatcher.shutdownNow();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Hub dispatch did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        dispatcher = null;
        log.info("Hub shutting down");
    }

    public boolean isRunning() {
        return dispatcher != null;
    }

    private void dispatchLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            MatchMessage message;
            try {
                message = intake.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                broadcast(message);
            } catch (RuntimeException e) {
                log.error("Broadcast failed match_id={}", message.matchId(), e);
            }
        }
    }

    // ---- observability ----

    public int connectionCount(long matchId) {
        lock.readLock().lock();
        try {
            Set<MatchConnection> set = connections.get(matchId);
            return set == null ? 0 : set.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int liveMatchCount() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int totalConnections() {
        lock.readLock().lock();
        try {
            return connections.values().stream().mapToInt(Set::size).sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** @return true if a (possibly empty) entry exists for the match; empty entries must never exist. */
    boolean hasEntry(long matchId) {
        lock.readLock().lock();
        try {
            return connections.containsKey(matchId);
        } finally {
            lock.readLock().unlock();
        }
    }
}
