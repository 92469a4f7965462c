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
@NoArgsConstructor
@AllArgsConstructor
public class NetworkTopology {
    private List<TopologyNode> nodes = new ArrayList<>();
    private List<TopologyLink> links = new ArrayList<>();
    private Map<String, Object> metadata = new HashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TopologyNode {
        private String id;
        private String address;
        private String name;
        private String status;
        private String type;   // "coordinator", "node", "mesh-node"
        private String source; // "coordinator", "registered", "mesh-route", "mesh-nexthop", "mesh-neighbor"
        private String quality;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TopologyLink {
        private String linkId;
        private String source;
        private String target;
        private String type; // "direct", "multi-hop"
        private String quality;
        private String iface;
        private boolean bestPath;
    }
}
