package com.gnovoa.matchfeed.redis;

import com.gnovoa.matchfeed.out.MatchCache;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;

public class JedisMatchCache implements MatchCache {

    private final JedisPool pool;

    public JedisMatchCache(JedisPool pool) {
        this.pool = pool;
    }

    @Override
    public boolean delete(String key) {
        try (Jedis jedis = pool.getResource()) {
            return jedis.del(key) > 0;
        }
    }
}
