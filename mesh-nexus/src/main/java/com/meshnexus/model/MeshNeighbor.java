package com.meshnexus.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One direct neighbor as reported by the mesh routing layer.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MeshNeighbor {
    private String address;
    private String lastSeen;
    private String quality; // raw indicator, e.g. "0.95" or "(242)"
    private String iface;
}
