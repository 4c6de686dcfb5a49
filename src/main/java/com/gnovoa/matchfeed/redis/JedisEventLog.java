package com.gnovoa.matchfeed.redis;

import com.gnovoa.matchfeed.out.EventLog;
import java.util.Map;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.StreamEntryID;
import redis.clients.jedis.params.XAddParams;

/** {@link EventLog} on Redis streams ({@code XADD}), optionally trimmed to an approximate length. */
public class JedisEventLog implements EventLog {

    private final JedisPool pool;
    private final long maxLen;

    /** @param maxLen approximate cap per stream, 0 for unbounded */
    public JedisEventLog(JedisPool pool, long maxLen) {
        this.pool = pool;
        this.maxLen = maxLen;
    }

    @Override
    public String append(String streamKey, Map<String, String> fields) {
        XAddParams params = XAddParams.xAddParams();
        if (maxLen > 0) params.maxLen(maxLen).approximateTrimming();

        try (Jedis jedis = pool.getResource()) {
            StreamEntryID id = jedis.xadd(streamKey, params, fields);
            return id.toString();
        }
    }
}
