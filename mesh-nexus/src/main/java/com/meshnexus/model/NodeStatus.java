package com.meshnexus.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeStatus {
    ONLINE,
    WARNING,
    OFFLINE,
    ERROR,
    BLOCKED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ONLINE;
        }
        return NodeStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
