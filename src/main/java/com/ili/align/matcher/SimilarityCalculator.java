package com.ili.align.matcher;

import com.ili.align.config.SimilarityConfig;
import com.ili.align.dto.SimilarityBreakdown;
import com.ili.align.exceptions.ValidationException;
import com.ili.align.models.AnomalyRecord;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.ili.align.validation.ModelValidationUtility.requirePositive;
import static com.ili.align.validation.ModelValidationUtility.requireWeightsSumToOne;

/**
 * Multi-criteria similarity between two anomalies from different runs.
 * <p>
 * Continuous features decay as {@code exp(-(delta/sigma)^2)}; clock positions use the
 * shorter way around the pipe; feature type is an exact match. The overall score is the
 * weighted sum of the six components.
 * </p>
 */
@Getter
public class SimilarityCalculator {
    public static final String DISTANCE = "distance";
    public static final String CLOCK = "clock";
    public static final String TYPE = "type";
    public static final String DEPTH = "depth";
    public static final String LENGTH = "length";
    public static final String WIDTH = "width";

    private static final double RELATIVE_EPSILON = 1e-6;

    private final double distanceSigma;
    private final double clockSigma;
    private final Double dimensionSigma;
    private final Map<String, Double> weights;

    public SimilarityCalculator() {
        this(SimilarityConfig.defaults());
    }

    public SimilarityCalculator(SimilarityConfig config) {
        this.distanceSigma = requirePositive(config.getDistanceSigma(), "distanceSigma");
        this.clockSigma = requirePositive(config.getClockSigma(), "clockSigma");
        if (config.getDimensionSigma() != null) {
            requirePositive(config.getDimensionSigma(), "dimensionSigma");
        }
        this.dimensionSigma = config.getDimensionSigma();

        Map<String, Double> merged = defaultWeights();
        if (config.getWeights() != null) {
            config.getWeights().forEach((key, value) -> {
                if (!merged.containsKey(key)) {
                    throw new ValidationException("Unknown similarity weight: " + key);
                }
                merged.put(key, value);
            });
        }
        requireWeightsSumToOne(merged);
        this.weights = Collections.unmodifiableMap(merged);
    }

    public static Map<String, Double> defaultWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(DISTANCE, 0.35);
        weights.put(CLOCK, 0.20);
        weights.put(TYPE, 0.15);
        weights.put(DEPTH, 0.15);
        weights.put(LENGTH, 0.075);
        weights.put(WIDTH, 0.075);
        return weights;
    }

    public SimilarityBreakdown calculate(AnomalyRecord a1, AnomalyRecord a2) {
        double distance = distanceSimilarity(a1.distance(), a2.distance());
        double clock = clockSimilarity(a1.clockPosition(), a2.clockPosition());
        double type = a1.featureType() == a2.featureType() ? 1.0 : 0.0;
        double depth = dimensionSimilarity(a1.depthPct(), a2.depthPct());
        double length = dimensionSimilarity(a1.length(), a2.length());
        double width = dimensionSimilarity(a1.width(), a2.width());

        double overall = weights.get(DISTANCE) * distance
                + weights.get(CLOCK) * clock
                + weights.get(TYPE) * type
                + weights.get(DEPTH) * depth
                + weights.get(LENGTH) * length
                + weights.get(WIDTH) * width;
        // weights sum to 1 only within tolerance
        overall = Math.max(0.0, Math.min(1.0, overall));

        return new SimilarityBreakdown(overall, distance, clock, type, depth, length, width);
    }

    public double distanceSimilarity(double d1, double d2) {
        return decay(Math.abs(d1 - d2), distanceSigma);
    }

    public double clockSimilarity(double c1, double c2) {
        double direct = Math.abs(c1 - c2);
        return decay(Math.min(direct, 12.0 - direct), clockSigma);
    }

    public double dimensionSimilarity(double v1, double v2) {
        if (dimensionSigma != null) {
            return decay(Math.abs(v1 - v2), dimensionSigma);
        }
        double relative = Math.abs(v1 - v2) / (v1 + v2 + RELATIVE_EPSILON);
        return Math.exp(-(relative * relative));
    }

    private static double decay(double delta, double sigma) {
        double scaled = delta / sigma;
        return Math.exp(-(scaled * scaled));
    }
}
