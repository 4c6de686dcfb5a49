package com.gnovoa.matchfeed.bridge;

import com.gnovoa.matchfeed.out.EventChannel;
import com.gnovoa.matchfeed.out.EventLog;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Broker double: glob pattern subscriptions, channel publish and an append-only log. Messages are
 * delivered on the publishing thread.
 */
public final class InMemoryBroker implements PatternSubscriber, EventChannel, EventLog {

    public record Entry(String key, String id, Map<String, String> fields) {}

    private record Subscription(Pattern regex, BrokerListener listener) {}

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final List<Entry> log = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    private volatile CountDownLatch released = new CountDownLatch(1);
    private volatile CountDownLatch subscribed = new CountDownLatch(1);

    @Override
    public void subscribe(String pattern, BrokerListener listener) {
        CountDownLatch gate = released;
        Subscription s = new Subscription(globToRegex(pattern), listener);
        subscriptions.add(s);
        listener.onSubscribed(pattern);
        subscribed.countDown();
        try {
            gate.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            subscriptions.remove(s);
        }
    }

    @Override
    public void unsubscribe() {
        CountDownLatch gate = released;
        released = new CountDownLatch(1);
        gate.countDown();
    }

    public boolean awaitSubscribed(long millis) throws InterruptedException {
        return subscribed.await(millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public long publish(String channel, String message) {
        long receivers = 0;
        for (Subscription s : subscriptions) {
            if (s.regex().matcher(channel).matches()) {
                s.listener().onMessage(channel, message);
                receivers++;
            }
        }
        return receivers;
    }

    @Override
    public String append(String streamKey, Map<String, String> fields) {
        String id = System.currentTimeMillis() + "-" + sequence.getAndIncrement();
        log.add(new Entry(streamKey, id, Map.copyOf(fields)));
        return id;
    }

    public List<Entry> entries() {
        return List.copyOf(log);
    }

    static Pattern globToRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(sb.toString());
    }
}
