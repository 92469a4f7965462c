package com.meshnexus.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MeshHealthStatus {
    GOOD,
    FAIR,
    POOR,
    DISCONNECTED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
