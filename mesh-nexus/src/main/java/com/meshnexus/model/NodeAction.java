package com.meshnexus.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeAction {
    PING,
    DISCONNECT,
    RECONNECT,
    /**
     * Advisory only. Queues a restart command for the peer, which acts on it only if it is
     * heartbeating against this coordinator.
     */
    RESTART;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeAction fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Action is required");
        }
        try {
            return NodeAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action: " + value);
        }
    }
}
