package com.gnovoa.matchfeed.config;

import com.gnovoa.matchfeed.bridge.PatternSubscriber;
import com.gnovoa.matchfeed.out.EventChannel;
import com.gnovoa.matchfeed.out.EventLog;
import com.gnovoa.matchfeed.out.MatchCache;
import com.gnovoa.matchfeed.redis.JedisEventChannel;
import com.gnovoa.matchfeed.redis.JedisEventLog;
import com.gnovoa.matchfeed.redis.JedisMatchCache;
import com.gnovoa.matchfeed.redis.JedisPatternSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

/**
 * Redis collaborators: stream log, pub/sub channel, cache and the wildcard subscriber all share one
 * pool. The pool connects lazily, so the application starts even while Redis is down.
 */
@Configuration
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    @Bean(destroyMethod = "close")
    public JedisPool jedisPool(FeedProperties props) {
        FeedProperties.Redis r = props.redis();
        String password = (r.password() == null || r.password().isBlank()) ? null : r.password();
        log.info("Redis pool host={} port={} database={}", r.host(), r.port(), r.database());
        return new JedisPool(new JedisPoolConfig(), r.host(), r.port(), r.timeoutMillis(), password, r.database());
    }

    @Bean
    public EventLog eventLog(JedisPool pool, FeedProperties props) {
        return new JedisEventLog(pool, props.streamMaxLen());
    }

    @Bean
    public EventChannel eventChannel(JedisPool pool) {
        return new JedisEventChannel(pool);
    }

    @Bean
    public MatchCache matchCache(JedisPool pool) {
        return new JedisMatchCache(pool);
    }

    @Bean
    public PatternSubscriber patternSubscriber(JedisPool pool) {
        return new JedisPatternSubscriber(pool);
    }
}
