package com.ili.align.models;

import lombok.Builder;

import java.util.List;

import static com.ili.align.validation.ModelValidationUtility.*;

/**
 * Cluster of co-located anomalies in one run, treated as a single defect for ASME B31G
 * interaction purposes. Members are referenced by id only.
 */
@Builder
public record InteractionZone(
        String zoneId,
        String runId,
        List<String> anomalyIds,
        int anomalyCount,
        double centroidDistance,
        double centroidClock,
        double spanDistanceFt,
        double spanClock,
        double maxDepthPct,
        double combinedLengthIn) {

    public InteractionZone {
        requireId(zoneId, "zoneId");
        requireId(runId, "runId");
        requireNonNull(anomalyIds, "anomalyIds");
        anomalyIds = List.copyOf(anomalyIds);
    }
}
