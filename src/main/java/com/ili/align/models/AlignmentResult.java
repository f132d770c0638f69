package com.ili.align.models;

import com.ili.align.exceptions.AlignmentQualityException;
import lombok.Builder;
import org.apache.commons.lang3.tuple.Pair;

import java.util.List;
import java.util.Locale;

import static com.ili.align.validation.ModelValidationUtility.*;

/**
 * An accepted DTW alignment between two runs.
 * <p>
 * Construction fails fast: out-of-range metrics raise a
 * {@link com.ili.align.exceptions.ValidationException}, and metrics outside the
 * acceptance thresholds raise an {@link AlignmentQualityException}. An instance that
 * exists is therefore always good enough to build a correction function from.
 * </p>
 */
@Builder
public record AlignmentResult(
        String run1Id,
        String run2Id,
        List<Pair<String, String>> matchedPoints,
        double matchRate,
        double rmse,
        CorrectionParams correctionFunctionParams) {

    public static final double MIN_MATCH_RATE = 95.0;
    public static final double MAX_RMSE_FT = 10.0;

    public AlignmentResult {
        requireId(run1Id, "run1Id");
        requireId(run2Id, "run2Id");
        requireNonNull(matchedPoints, "matchedPoints");
        requireNonNull(correctionFunctionParams, "correctionFunctionParams");
        requireInRange(matchRate, 0.0, 100.0, "matchRate");
        requireNonNegative(rmse, "rmse");
        matchedPoints = List.copyOf(matchedPoints);

        if (matchRate < MIN_MATCH_RATE) {
            throw new AlignmentQualityException(
                    String.format(Locale.ROOT, "Match rate %.1f%% below %.0f%% threshold", matchRate, MIN_MATCH_RATE),
                    matchRate, rmse);
        }
        if (rmse > MAX_RMSE_FT) {
            throw new AlignmentQualityException(
                    String.format(Locale.ROOT, "RMSE %.2f ft exceeds %.0f ft threshold", rmse, MAX_RMSE_FT),
                    matchRate, rmse);
        }
    }
}
