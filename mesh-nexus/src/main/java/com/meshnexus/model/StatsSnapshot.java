package com.meshnexus.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsSnapshot {
    @Builder.Default
    private SystemMetrics system = SystemMetrics.empty();
    @Builder.Default
    private Map<String, Object> network = new HashMap<>();
    @Builder.Default
    private MeshStats mesh = MeshStats.empty();
    @Builder.Default
    private OverlayStats overlay = OverlayStats.empty();
    private Instant timestamp;

    public static StatsSnapshot empty(Instant timestamp) {
        return StatsSnapshot.builder().timestamp(timestamp).build();
    }
}
