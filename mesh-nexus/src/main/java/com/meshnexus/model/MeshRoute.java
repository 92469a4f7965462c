package com.meshnexus.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeshRoute {
    private String originator;
    private String quality;
    private String nextHop;
    private String iface;
    private String lastSeen;
    private boolean bestPath;
}
