package com.meshnexus.service;

import com.meshnexus.model.MeshHealthScore;
import com.meshnexus.model.MeshHealthStatus;
import com.meshnexus.model.MeshNeighbor;
import com.meshnexus.model.MeshRoute;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores the local mesh from its neighbor and route tables.
 *
 * <ul>
 *   <li>connectivity: neighbor count against a target of ten, 0..100</li>
 *   <li>quality: mean neighbor link quality, 0..100</li>
 *   <li>redundancy: routes per reachable originator, scaled by 20 and capped at 100</li>
 * </ul>
 */
public final class MeshHealthCalculator {

    static final int TARGET_NEIGHBORS = 10;

    private static final Pattern DECIMAL_QUALITY = Pattern.compile("(\\d+\\.\\d+)");

    private MeshHealthCalculator() {
    }

    public static MeshHealthScore score(List<MeshNeighbor> neighbors, List<MeshRoute> routes) {
        if (neighbors == null || neighbors.isEmpty()) {
            return MeshHealthScore.DISCONNECTED;
        }
        double connectivity = Math.min((double) neighbors.size() / TARGET_NEIGHBORS, 1.0) * 100;
        double avgQuality = averageQuality(neighbors);

        int redundancy = 0;
        if (routes != null && !routes.isEmpty()) {
            Set<String> originators = new HashSet<>();
            for (MeshRoute route : routes) {
                originators.add(route.getOriginator());
            }
            redundancy = (int) Math.min(Math.round((double) routes.size() / originators.size() * 20), 100);
        }

        MeshHealthStatus status;
        if (avgQuality < 0.5 || connectivity < 30) {
            status = MeshHealthStatus.POOR;
        } else if (avgQuality < 0.8 || connectivity < 60) {
            status = MeshHealthStatus.FAIR;
        } else {
            status = MeshHealthStatus.GOOD;
        }

        return new MeshHealthScore((int) Math.round(connectivity), (int) Math.round(avgQuality * 100),
                redundancy, status);
    }

    public static double averageQuality(List<MeshNeighbor> neighbors) {
        if (neighbors == null || neighbors.isEmpty()) {
            return 0;
        }
        double total = 0;
        for (MeshNeighbor neighbor : neighbors) {
            total += parseQuality(neighbor.getQuality());
        }
        return total / neighbors.size();
    }

    /**
     * Reads a decimal link quality such as {@code "0.95"}. Anything without a decimal number,
     * including raw TQ values like {@code "(242)"}, counts as 0. Values above 1 are capped at 1.
     */
    public static double parseQuality(String raw) {
        if (raw == null) {
            return 0;
        }
        Matcher matcher = DECIMAL_QUALITY.matcher(raw);
        return matcher.find() ? Math.min(Double.parseDouble(matcher.group(1)), 1.0) : 0;
    }
}
