package com.meshnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MeshHealthScore {
    public static final MeshHealthScore DISCONNECTED = new MeshHealthScore(0, 0, 0, MeshHealthStatus.DISCONNECTED);

    private int connectivity;
    private int quality;
    private int redundancy;
    private MeshHealthStatus status;
}
