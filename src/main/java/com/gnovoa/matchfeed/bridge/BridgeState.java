package com.gnovoa.matchfeed.bridge;

public enum BridgeState {
    IDLE,
    CONNECTING,
    SUBSCRIBED,
    RECONNECTING,
    STOPPED
}
