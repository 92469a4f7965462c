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
public class HeartbeatRecord {
    private String nodeId;
    private Instant timestamp;
    private NodeStatus status;
    @Builder.Default
    private Map<String, Object> system = new HashMap<>();
    @Builder.Default
    private Map<String, Object> network = new HashMap<>();
}
