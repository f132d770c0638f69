package com.ili.align.alignment;

import com.ili.align.dto.CorrectionInfo;
import com.ili.align.exceptions.ValidationException;
import com.ili.align.models.AlignmentResult;
import com.ili.align.models.AnomalyRecord;
import com.ili.align.models.CorrectionParams;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Piecewise-linear map from the older run's odometer frame into the newer run's frame,
 * anchored on DTW-matched reference points. Outside the anchored range the end segments
 * are extended linearly.
 */
@Slf4j
public class DistanceCorrectionFunction {
    private final double[] source;
    private final double[] target;
    private final String method;

    public DistanceCorrectionFunction(CorrectionParams params) {
        if (params == null) {
            throw new ValidationException("Correction parameters must not be null");
        }
        double[] src = params.sourceDistances();
        double[] tgt = params.targetDistances();
        if (src.length == 0 || tgt.length == 0) {
            throw new ValidationException("Cannot create correction function with empty distance arrays");
        }
        if (src.length != tgt.length) {
            throw new ValidationException(String.format(
                    "Distance arrays must have same length: run1=%d, run2=%d", src.length, tgt.length));
        }
        if (src.length < 2) {
            throw new ValidationException(
                    "Need at least 2 matched points for interpolation, got " + src.length);
        }
        if (!CorrectionParams.LINEAR.equalsIgnoreCase(params.interpolationMethod())) {
            throw new ValidationException("Unsupported interpolation method: " + params.interpolationMethod());
        }

        Integer[] order = IntStream.range(0, src.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(k -> src[k]));
        this.source = new double[src.length];
        this.target = new double[src.length];
        for (int k = 0; k < order.length; k++) {
            source[k] = src[order[k]];
            target[k] = tgt[order[k]];
        }
        this.method = params.interpolationMethod();
    }

    public static DistanceCorrectionFunction from(AlignmentResult alignment) {
        return new DistanceCorrectionFunction(alignment.correctionFunctionParams());
    }

    public double correct(double distance) {
        int last = source.length - 1;
        if (distance <= source[0]) {
            return extend(0, 1, distance);
        }
        if (distance >= source[last]) {
            return extend(last - 1, last, distance);
        }

        int idx = Arrays.binarySearch(source, distance);
        if (idx >= 0) {
            return target[idx];
        }
        int upper = -idx - 1;
        return interpolate(upper - 1, upper, distance);
    }

    public double[] correct(double[] distances) {
        double[] corrected = new double[distances.length];
        for (int k = 0; k < distances.length; k++) {
            corrected[k] = correct(distances[k]);
        }
        return corrected;
    }

    /**
     * Returns corrected copies of the anomalies; only {@code distance} changes. Corrections
     * that would land before the start of the line are clamped to zero.
     */
    public List<AnomalyRecord> correctAnomalies(List<AnomalyRecord> anomalies) {
        List<AnomalyRecord> corrected = new ArrayList<>(anomalies.size());
        int clamped = 0;
        for (AnomalyRecord anomaly : anomalies) {
            double value = correct(anomaly.distance());
            if (value < 0) {
                value = 0.0;
                clamped++;
            }
            corrected.add(anomaly.withDistance(value));
        }
        if (clamped > 0) {
            log.warn("Clamped {} corrected distances to 0 ft", clamped);
        }
        return corrected;
    }

    public boolean isExtrapolating(double distance) {
        return distance < source[0] || distance > source[source.length - 1];
    }

    public CorrectionInfo getCorrectionInfo() {
        int n = source.length;
        DescriptiveStatistics corrections = new DescriptiveStatistics();
        DescriptiveStatistics targets = new DescriptiveStatistics(target);
        for (int k = 0; k < n; k++) {
            corrections.addValue(target[k] - source[k]);
        }

        return CorrectionInfo.builder()
                .numReferencePoints(n)
                .minSourceDistance(source[0])
                .maxSourceDistance(source[n - 1])
                .minTargetDistance(targets.getMin())
                .maxTargetDistance(targets.getMax())
                .interpolationMethod(method)
                .maxCorrection(Math.max(Math.abs(corrections.getMax()), Math.abs(corrections.getMin())))
                .meanCorrection(corrections.getMean())
                .stdCorrection(Math.sqrt(corrections.getPopulationVariance()))
                .build();
    }

    private double extend(int lo, int hi, double distance) {
        if (source[hi] == source[lo]) {
            return target[distance <= source[lo] ? lo : hi] + (distance - source[lo]);
        }
        return interpolate(lo, hi, distance);
    }

    private double interpolate(int lo, int hi, double distance) {
        double span = source[hi] - source[lo];
        if (span == 0.0) {
            return target[lo];
        }
        double slope = (target[hi] - target[lo]) / span;
        return target[lo] + slope * (distance - source[lo]);
    }
}
