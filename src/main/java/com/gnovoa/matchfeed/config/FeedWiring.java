package com.gnovoa.matchfeed.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.matchfeed.bridge.BrokerBridge;
import com.gnovoa.matchfeed.bridge.PatternSubscriber;
import com.gnovoa.matchfeed.out.BrokerEventPublisher;
import com.gnovoa.matchfeed.out.EventChannel;
import com.gnovoa.matchfeed.out.EventLog;
import com.gnovoa.matchfeed.out.EventPublisher;
import com.gnovoa.matchfeed.out.MatchCache;
import com.gnovoa.matchfeed.ws.MatchHub;
import com.gnovoa.matchfeed.ws.MatchSocketHandler;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FeedWiring {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MatchHub matchHub(ObjectMapper mapper, Clock clock, FeedProperties props) {
        return new MatchHub(mapper, clock, props.intakeBufferSize());
    }

    /** Viewer write loops and the sends they wait on; threads come and go with the sockets. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService viewerWriters() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "viewer-writer-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public MatchSocketHandler matchSocketHandler(MatchHub hub, FeedProperties props, ExecutorService viewerWriters) {
        return new MatchSocketHandler(hub, props, viewerWriters);
    }

    @Bean
    public BrokerBridge brokerBridge(PatternSubscriber subscriber, MatchHub hub, ObjectMapper mapper, FeedProperties props) {
        return new BrokerBridge(subscriber, hub, mapper, props.channelPattern(), props.bridgeBackoff());
    }

    @Bean
    public EventPublisher eventPublisher(EventLog eventLog, EventChannel channel, MatchCache cache, ObjectMapper mapper, Clock clock) {
        return new BrokerEventPublisher(eventLog, channel, cache, mapper, clock);
    }
}
