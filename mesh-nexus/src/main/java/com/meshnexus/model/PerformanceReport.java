package com.meshnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceReport {
    private SeriesSummary cpu;
    private SeriesSummary memory;
    private SeriesSummary neighbors;
    private int dataPoints;
    private Instant windowStart;
    private Instant windowEnd;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SeriesSummary {
        private double current;
        private double average;
        private double min;
        private double max;
    }
}
