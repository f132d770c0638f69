package com.ili.align.dto;

import java.util.List;

/**
 * Raw DTW output before the acceptance thresholds are applied.
 */
public record DtwPath(
        String run1Id,
        String run2Id,
        List<MatchedPair> pairs,
        double matchRate,
        double rmse,
        double dtwDistance,
        int sequence1Length,
        int sequence2Length) {

    public DtwPath {
        pairs = List.copyOf(pairs);
    }
}
