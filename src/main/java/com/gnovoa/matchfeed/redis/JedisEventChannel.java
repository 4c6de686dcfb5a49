package com.gnovoa.matchfeed.redis;

import com.gnovoa.matchfeed.out.EventChannel;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;

public class JedisEventChannel implements EventChannel {

    private final JedisPool pool;

    public JedisEventChannel(JedisPool pool) {
        this.pool = pool;
    }

    @Override
    public long publish(String channel, String message) {
        try (Jedis jedis = pool.getResource()) {
            return jedis.publish(channel, message);
        }
    }
}
