package com.ili.align.dto;

import com.ili.align.models.AnomalyRecord;

import java.util.List;

/**
 * Result of aligning one interval: either corrected anomalies with diagnostics, or the
 * untouched input with the reason correction was skipped. {@code validation} is present
 * whenever DTW actually ran, including runs that missed the quality gate.
 */
public record AlignmentOutcome(
        List<AnomalyRecord> anomalies,
        boolean correctionApplied,
        String fallbackReason,
        Double matchRate,
        Double rmse,
        Integer matchedPairs,
        CorrectionInfo correctionInfo,
        AlignmentValidation validation) {

    public AlignmentOutcome {
        anomalies = List.copyOf(anomalies);
    }

    public static AlignmentOutcome applied(List<AnomalyRecord> corrected, DtwPath path, CorrectionInfo info,
                                           AlignmentValidation validation) {
        return new AlignmentOutcome(corrected, true, null, path.matchRate(), path.rmse(), path.pairs().size(),
                info, validation);
    }

    public static AlignmentOutcome fallback(List<AnomalyRecord> original, String reason,
                                            AlignmentValidation validation) {
        return new AlignmentOutcome(original, false, reason, null, null, null, null, validation);
    }
}
