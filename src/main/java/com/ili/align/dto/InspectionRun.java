package com.ili.align.dto;

import com.ili.align.models.AnomalyRecord;
import com.ili.align.models.ReferencePoint;
import lombok.Builder;

import java.time.LocalDate;
import java.util.List;

import static com.ili.align.validation.ModelValidationUtility.requireId;

/**
 * One run's worth of validated, unit-normalized records, as handed over by ingestion.
 */
@Builder
public record InspectionRun(
        String runId,
        LocalDate inspectionDate,
        List<AnomalyRecord> anomalies,
        List<ReferencePoint> referencePoints) {

    public InspectionRun {
        requireId(runId, "runId");
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
        referencePoints = referencePoints == null ? List.of() : List.copyOf(referencePoints);
    }
}
