package com.meshnexus.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverlayStats {
    @Builder.Default
    private Map<String, Object> status = new HashMap<>();
    @Builder.Default
    private List<OverlayNetwork> networks = new ArrayList<>();
    @Builder.Default
    private List<OverlayPeer> peers = new ArrayList<>();
    private int networkCount;
    private int connectedNetworks;
    private int peerCount;
    private boolean online;

    public static OverlayStats empty() {
        return OverlayStats.builder().build();
    }
}
