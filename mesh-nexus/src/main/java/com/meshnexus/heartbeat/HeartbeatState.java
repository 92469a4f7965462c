package com.meshnexus.heartbeat;

public enum HeartbeatState {
    UNREGISTERED,
    DISCOVERING,
    REGISTERED,
    HEARTBEATING
}
