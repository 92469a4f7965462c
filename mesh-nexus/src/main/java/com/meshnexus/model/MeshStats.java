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
public class MeshStats {
    @Builder.Default
    private Map<String, Object> status = new HashMap<>();
    @Builder.Default
    private List<MeshNeighbor> neighbors = new ArrayList<>();
    @Builder.Default
    private List<MeshRoute> routes = new ArrayList<>();
    @Builder.Default
    private MeshHealthScore health = MeshHealthScore.DISCONNECTED;
    private int neighborCount;
    private int routeCount;
    private double avgQuality;

    public static MeshStats empty() {
        return MeshStats.builder().build();
    }
}
