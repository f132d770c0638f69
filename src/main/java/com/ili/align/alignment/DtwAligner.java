package com.ili.align.alignment;

import com.ili.align.dto.DtwPath;
import com.ili.align.dto.MatchedPair;
import com.ili.align.exceptions.ValidationException;
import com.ili.align.models.AlignmentResult;
import com.ili.align.models.CorrectionParams;
import com.ili.align.models.ReferencePoint;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.ili.align.validation.ModelValidationUtility.requirePositive;

/**
 * Dynamic time warping over reference-point odometer readings.
 * <p>
 * A pair of points is only admissible when their distance difference stays within
 * {@code driftConstraint} of the pair's mean distance; everything else costs infinity.
 * </p>
 */
@Slf4j
@Getter
public class DtwAligner {
    public static final double DEFAULT_DRIFT_CONSTRAINT = 0.10;

    private final double driftConstraint;

    public DtwAligner() {
        this(DEFAULT_DRIFT_CONSTRAINT);
    }

    public DtwAligner(double driftConstraint) {
        requirePositive(driftConstraint, "driftConstraint");
        this.driftConstraint = driftConstraint;
    }

    /**
     * Aligns two reference-point sequences and applies the acceptance thresholds.
     *
     * @throws ValidationException if either sequence is empty.
     * @throws com.ili.align.exceptions.AlignmentQualityException if the alignment is too poor.
     */
    public AlignmentResult align(List<ReferencePoint> seq1, List<ReferencePoint> seq2, String run1Id, String run2Id) {
        return toAlignmentResult(computeAlignment(seq1, seq2, run1Id, run2Id));
    }

    /**
     * Same as {@link #align(List, List, String, String)} with a drift constraint for this call only.
     */
    public AlignmentResult align(List<ReferencePoint> seq1, List<ReferencePoint> seq2, String run1Id, String run2Id,
                                 double driftConstraint) {
        return toAlignmentResult(computeAlignment(seq1, seq2, run1Id, run2Id, driftConstraint));
    }

    /**
     * Runs DTW without applying the acceptance thresholds.
     */
    public DtwPath computeAlignment(List<ReferencePoint> seq1, List<ReferencePoint> seq2, String run1Id, String run2Id) {
        return computeAlignment(seq1, seq2, run1Id, run2Id, driftConstraint);
    }

    public DtwPath computeAlignment(List<ReferencePoint> seq1, List<ReferencePoint> seq2, String run1Id, String run2Id,
                                    double driftConstraint) {
        requirePositive(driftConstraint, "driftConstraint");
        if (seq1 == null || seq2 == null || seq1.isEmpty() || seq2.isEmpty()) {
            throw new ValidationException("Cannot align empty reference point sequences");
        }

        double[] d1 = seq1.stream().mapToDouble(ReferencePoint::distance).toArray();
        double[] d2 = seq2.stream().mapToDouble(ReferencePoint::distance).toArray();

        double[][] distances = distanceMatrix(d1, d2, driftConstraint);
        double[][] cost = accumulate(distances);
        List<int[]> path = backtrack(cost);

        List<MatchedPair> pairs = new ArrayList<>(path.size());
        for (int[] step : path) {
            ReferencePoint p1 = seq1.get(step[0]);
            ReferencePoint p2 = seq2.get(step[1]);
            pairs.add(new MatchedPair(step[0], step[1], p1.id(), p2.id(), p1.distance(), p2.distance()));
        }

        double matchRate = Math.min(100.0, (double) pairs.size() / Math.max(d1.length, d2.length) * 100.0);
        double rmse = rmse(pairs);
        double dtwDistance = cost[d1.length][d2.length];

        log.debug("DTW {} -> {}: {} pairs, matchRate={}, rmse={}", run1Id, run2Id, pairs.size(), matchRate, rmse);
        return new DtwPath(run1Id, run2Id, pairs, matchRate, rmse, dtwDistance, d1.length, d2.length);
    }

    /**
     * Converts a raw path into an accepted {@link AlignmentResult}.
     *
     * @throws com.ili.align.exceptions.AlignmentQualityException if the path misses a threshold.
     */
    public static AlignmentResult toAlignmentResult(DtwPath path) {
        List<Pair<String, String>> matchedPoints = new ArrayList<>(path.pairs().size());
        double[] source = new double[path.pairs().size()];
        double[] target = new double[path.pairs().size()];
        for (int k = 0; k < path.pairs().size(); k++) {
            MatchedPair pair = path.pairs().get(k);
            matchedPoints.add(Pair.of(pair.refPoint1Id(), pair.refPoint2Id()));
            source[k] = pair.distance1();
            target[k] = pair.distance2();
        }

        return AlignmentResult.builder()
                .run1Id(path.run1Id())
                .run2Id(path.run2Id())
                .matchedPoints(matchedPoints)
                .matchRate(path.matchRate())
                .rmse(path.rmse())
                .correctionFunctionParams(new CorrectionParams(source, target, CorrectionParams.LINEAR))
                .build();
    }

    double[][] distanceMatrix(double[] d1, double[] d2) {
        return distanceMatrix(d1, d2, driftConstraint);
    }

    static double[][] distanceMatrix(double[] d1, double[] d2, double driftConstraint) {
        double[][] matrix = new double[d1.length][d2.length];
        for (int i = 0; i < d1.length; i++) {
            for (int j = 0; j < d2.length; j++) {
                double diff = Math.abs(d1[i] - d2[j]);
                double maxDrift = (d1[i] + d2[j]) / 2.0 * driftConstraint;
                matrix[i][j] = diff <= maxDrift ? diff : Double.POSITIVE_INFINITY;
            }
        }
        return matrix;
    }

    private double[][] accumulate(double[][] distances) {
        int n = distances.length;
        int m = distances[0].length;
        double[][] cost = new double[n + 1][m + 1];
        for (double[] row : cost) {
            Arrays.fill(row, Double.POSITIVE_INFINITY);
        }
        cost[0][0] = 0.0;

        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= m; j++) {
                double dist = distances[i - 1][j - 1];
                if (!Double.isInfinite(dist)) {
                    cost[i][j] = dist + Math.min(cost[i - 1][j - 1], Math.min(cost[i - 1][j], cost[i][j - 1]));
                }
            }
        }
        return cost;
    }

    // Ties resolve diagonal, then vertical, then horizontal.
    private List<int[]> backtrack(double[][] cost) {
        List<int[]> path = new ArrayList<>();
        int i = cost.length - 1;
        int j = cost[0].length - 1;

        while (i > 0 && j > 0) {
            path.add(new int[]{i - 1, j - 1});

            int nextI = i - 1;
            int nextJ = j - 1;
            double best = cost[i - 1][j - 1];
            if (cost[i - 1][j] < best) {
                best = cost[i - 1][j];
                nextI = i - 1;
                nextJ = j;
            }
            if (cost[i][j - 1] < best) {
                nextI = i;
                nextJ = j - 1;
            }
            i = nextI;
            j = nextJ;
        }

        Collections.reverse(path);
        return path;
    }

    private static double rmse(List<MatchedPair> pairs) {
        if (pairs.isEmpty()) {
            return 0.0;
        }
        DescriptiveStatistics diffs = new DescriptiveStatistics();
        pairs.forEach(pair -> diffs.addValue(pair.distanceDiff()));
        return Math.sqrt(diffs.getSumsq() / diffs.getN());
    }
}
