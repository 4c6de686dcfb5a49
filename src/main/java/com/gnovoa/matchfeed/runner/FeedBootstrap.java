package com.gnovoa.matchfeed.runner;

import com.gnovoa.matchfeed.bridge.BrokerBridge;
import com.gnovoa.matchfeed.config.FeedProperties;
import com.gnovoa.matchfeed.ws.MatchHub;
import jakarta.annotation.PreDestroy;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts hub dispatch, then the broker bridge, once the application is ready. Shutdown is the
 * single cancellation path: bridge first so nothing new enters the intake, then the hub.
 */
@Component
public final class FeedBootstrap {

    private final FeedProperties props;
    private final MatchHub hub;
    private final BrokerBridge bridge;

    public FeedBootstrap(FeedProperties props, MatchHub hub, BrokerBridge bridge) {
        this.props = props;
        this.hub = hub;
        this.bridge = bridge;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!props.autoStartOnBoot()) return;
        start();
    }

    public void start() {
        hub.start();
        bridge.start();
    }

    @PreDestroy
    public void stop() {
        bridge.stop();
        hub.stop();
    }
}
