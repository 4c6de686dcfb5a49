package com.gnovoa.matchfeed.runner;

import com.gnovoa.matchfeed.bridge.BridgeState;
import com.gnovoa.matchfeed.bridge.BrokerBridge;
import com.gnovoa.matchfeed.ws.MatchHub;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Reported as {@code matchFeed} under {@code /actuator/health}. DOWN while the bridge is reconnecting. */
@Component("matchFeed")
public final class FeedHealthIndicator implements HealthIndicator {

    private final MatchHub hub;
    private final BrokerBridge bridge;

    public FeedHealthIndicator(MatchHub hub, BrokerBridge bridge) {
        this.hub = hub;
        this.bridge = bridge;
    }

    @Override
    public Health health() {
        BridgeState state = bridge.state();
        Health.Builder builder = state == BridgeState.RECONNECTING ? Health.down() : Health.up();
        return builder
                .withDetail("bridge", state.name())
                .withDetail("bridgeRetries", bridge.retries())
                .withDetail("malformedMessages", bridge.malformed())
                .withDetail("dispatching", hub.isRunning())
                .withDetail("liveMatches", hub.liveMatchCount())
                .withDetail("viewers", hub.totalConnections())
                .build();
    }
}
