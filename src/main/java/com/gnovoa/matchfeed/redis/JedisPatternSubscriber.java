package com.gnovoa.matchfeed.redis;

import com.gnovoa.matchfeed.bridge.BrokerListener;
import com.gnovoa.matchfeed.bridge.PatternSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPubSub;
import redis.clients.jedis.exceptions.JedisException;

/**
 * {@link PatternSubscriber} on Redis {@code PSUBSCRIBE}. The subscription pins one pooled
 * connection for as long as it lasts.
 */
public class JedisPatternSubscriber implements PatternSubscriber {

    private static final Logger log = LoggerFactory.getLogger(JedisPatternSubscriber.class);

    private final JedisPool pool;
    private volatile JedisPubSub current;

    public JedisPatternSubscriber(JedisPool pool) {
        this.pool = pool;
    }

    @Override
    public void subscribe(String pattern, BrokerListener listener) {
        JedisPubSub pubSub = new JedisPubSub() {
            @Override
            public void onPSubscribe(String p, int subscribedChannels) {
                listener.onSubscribed(p);
            }

            @Override
            public void onPMessage(String p, String channel, String message) {
                listener.onMessage(channel, message);
            }
        };

        current = pubSub;
        try (Jedis jedis = pool.getResource()) {
            // blocks until punsubscribe() or a connection failure
            jedis.psubscribe(pubSub, pattern);
        } finally {
            current = null;
        }
    }

    @Override
    public void unsubscribe() {
        JedisPubSub pubSub = current;
        if (pubSub == null || !pubSub.isSubscribed()) return;
        try {
            pubSub.punsubscribe();
        } catch (JedisException e) {
            log.debug("Punsubscribe failed, connection already gone: {}", e.toString());
        }
    }
}
