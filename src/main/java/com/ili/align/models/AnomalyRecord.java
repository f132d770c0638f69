package com.ili.align.models;

import com.ili.align.dto.enums.FeatureType;
import lombok.Builder;

import java.time.LocalDate;

import static com.ili.align.validation.ModelValidationUtility.*;

/**
 * A single anomaly reported by one inspection run.
 * <p>
 * Instances are never modified: distance correction and cluster stamping return copies,
 * so pre- and post-correction states can be compared. {@code clusterId} only names an
 * {@link InteractionZone}; the zone itself lives in a separate collection.
 * </p>
 */
@Builder
public record AnomalyRecord(
        String id,
        String runId,
        double distance,
        double clockPosition,
        double depthPct,
        double length,
        double width,
        FeatureType featureType,
        LocalDate inspectionDate,
        String clusterId) {

    public AnomalyRecord {
        requireId(id, "id");
        requireId(runId, "runId");
        requireNonNegative(distance, "distance");
        requireInRange(clockPosition, 1.0, 12.0, "clockPosition");
        requireInRange(depthPct, 0.0, 100.0, "depthPct");
        requirePositive(length, "length");
        requirePositive(width, "width");
        requireNonNull(featureType, "featureType");
        requireNonNull(inspectionDate, "inspectionDate");
    }

    public AnomalyRecord withDistance(double correctedDistance) {
        return new AnomalyRecord(id, runId, correctedDistance, clockPosition, depthPct, length, width,
                featureType, inspectionDate, clusterId);
    }

    public AnomalyRecord withClusterId(String zoneId) {
        return new AnomalyRecord(id, runId, distance, clockPosition, depthPct, length, width,
                featureType, inspectionDate, zoneId);
    }

    public boolean isClustered() {
        return clusterId != null;
    }
}
