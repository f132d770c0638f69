package com.ili.align.alignment;

import com.ili.align.dto.AlignmentValidation;
import com.ili.align.dto.DtwPath;
import com.ili.align.dto.MatchedPair;
import com.ili.align.dto.UnmatchedReferencePoint;
import com.ili.align.models.AlignmentResult;
import com.ili.align.models.ReferencePoint;
import lombok.Getter;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * Diagnoses a raw DTW path: threshold checks plus a reason for every reference point the
 * warping path skipped.
 */
@Getter
public class AlignmentValidator {
    static final double ISOLATION_GAP_FT = 100.0;
    static final double NEAR_MATCH_FT = 20.0;

    private final double minMatchRate;
    private final double maxRmse;

    public AlignmentValidator() {
        this(AlignmentResult.MIN_MATCH_RATE, AlignmentResult.MAX_RMSE_FT);
    }

    public AlignmentValidator(double minMatchRate, double maxRmse) {
        this.minMatchRate = minMatchRate;
        this.maxRmse = maxRmse;
    }

    public AlignmentValidation validate(DtwPath path, List<ReferencePoint> refPoints1, List<ReferencePoint> refPoints2) {
        boolean matchRatePassed = path.matchRate() >= minMatchRate;
        boolean rmsePassed = path.rmse() <= maxRmse;

        List<UnmatchedReferencePoint> unmatched1 = findUnmatched(refPoints1, path.pairs(), MatchedPair::index1);
        List<UnmatchedReferencePoint> unmatched2 = findUnmatched(refPoints2, path.pairs(), MatchedPair::index2);

        List<String> warnings = new ArrayList<>();
        if (!matchRatePassed) {
            warnings.add(String.format(Locale.ROOT, "Match rate %.1f%% is below threshold %.1f%%", path.matchRate(), minMatchRate));
        }
        if (!rmsePassed) {
            warnings.add(String.format(Locale.ROOT, "RMSE %.2f ft exceeds threshold %.2f ft", path.rmse(), maxRmse));
        }
        if (!unmatched1.isEmpty()) {
            warnings.add(unmatched1.size() + " reference points unmatched in run " + path.run1Id());
        }
        if (!unmatched2.isEmpty()) {
            warnings.add(unmatched2.size() + " reference points unmatched in run " + path.run2Id());
        }

        DescriptiveStatistics errors = new DescriptiveStatistics();
        path.pairs().forEach(pair -> errors.addValue(pair.distanceDiff()));
        boolean hasErrors = errors.getN() > 0;
        double std = hasErrors ? Math.sqrt(errors.getPopulationVariance()) : 0.0;

        return AlignmentValidation.builder()
                .valid(matchRatePassed && rmsePassed)
                .matchRate(path.matchRate())
                .matchRatePassed(matchRatePassed)
                .rmse(path.rmse())
                .rmsePassed(rmsePassed)
                .unmatchedRun1(unmatched1)
                .unmatchedRun2(unmatched2)
                .warnings(warnings)
                .meanDistanceError(hasErrors ? errors.getMean() : 0.0)
                .maxDistanceError(hasErrors ? errors.getMax() : 0.0)
                .stdDistanceError(std)
                .dtwDistance(path.dtwDistance())
                .build();
    }

    private List<UnmatchedReferencePoint> findUnmatched(List<ReferencePoint> points, List<MatchedPair> pairs,
                                                        ToIntFunction<MatchedPair> side) {
        Set<Integer> matched = new HashSet<>();
        pairs.forEach(pair -> matched.add(side.applyAsInt(pair)));

        List<UnmatchedReferencePoint> unmatched = new ArrayList<>();
        for (int idx = 0; idx < points.size(); idx++) {
            if (!matched.contains(idx)) {
                ReferencePoint point = points.get(idx);
                unmatched.add(new UnmatchedReferencePoint(idx, point.id(), point.distance(),
                        diagnose(idx, points, matched)));
            }
        }
        return unmatched;
    }

    String diagnose(int idx, List<ReferencePoint> points, Set<Integer> matched) {
        if (matched.isEmpty()) {
            return "No alignment pairs found";
        }
        if (idx == 0) {
            return "Point at beginning of run - may be outside alignment window";
        }
        if (idx == points.size() - 1) {
            return "Point at end of run - may be outside alignment window";
        }

        double here = points.get(idx).distance();
        double gapBefore = Math.abs(here - points.get(idx - 1).distance());
        double gapAfter = Math.abs(points.get(idx + 1).distance() - here);
        if (gapBefore > ISOLATION_GAP_FT || gapAfter > ISOLATION_GAP_FT) {
            return String.format(Locale.ROOT, "Isolated point (gaps: %.1fft before, %.1fft after)", gapBefore, gapAfter);
        }

        double nearest = Double.POSITIVE_INFINITY;
        for (int m : matched) {
            if (m < points.size()) {
                nearest = Math.min(nearest, Math.abs(here - points.get(m).distance()));
            }
        }
        if (nearest < NEAR_MATCH_FT) {
            return String.format(Locale.ROOT, "Close to matched point (%.1fft) but not selected by DTW", nearest);
        }
        return "Could not be aligned - possible data quality issue";
    }
}
