package com.meshnexus.realtime;

import lombok.Getter;

import java.io.IOException;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Getter
public class ClientSession {
    private final String id;
    private final ObserverChannel channel;
    private final Instant connectedAt;
    private volatile Instant lastActivity;
    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();

    public ClientSession(ObserverChannel channel, Instant connectedAt) {
        this.id = channel.id();
        this.channel = channel;
        this.connectedAt = connectedAt;
        this.lastActivity = connectedAt;
    }

    public void touch(Instant now) {
        lastActivity = now;
    }

    public boolean isSubscribed(String stream) {
        return subscriptions.contains(stream);
    }

    /**
     * Frames to one session go out one at a time and in the order they were handed over.
     */
    public synchronized void deliver(String frame) throws IOException {
        channel.send(frame);
    }
}
