package com.meshnexus.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemMetrics {
    private double cpuUsage;      // percent
    private int cpuCores;
    private double loadAverage;
    private long memoryTotal;
    private long memoryUsed;
    private long memoryFree;
    private double memoryUsage;   // percent
    private long uptimeSeconds;

    public static SystemMetrics empty() {
        return new SystemMetrics();
    }
}
