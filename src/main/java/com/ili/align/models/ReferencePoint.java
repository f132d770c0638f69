package com.ili.align.models;

import com.ili.align.dto.enums.PointType;
import lombok.Builder;

import static com.ili.align.validation.ModelValidationUtility.*;

/**
 * Physical landmark (girth weld, valve, tee) used only to align two runs.
 */
@Builder
public record ReferencePoint(String id, String runId, double distance, PointType pointType, String description) {

    public ReferencePoint {
        requireId(id, "id");
        requireId(runId, "runId");
        requireNonNegative(distance, "distance");
        requireNonNull(pointType, "pointType");
    }

    public boolean isGirthWeld() {
        return pointType == PointType.GIRTH_WELD;
    }
}
