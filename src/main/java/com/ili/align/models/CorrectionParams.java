package com.ili.align.models;

import com.ili.align.exceptions.ValidationException;

import java.util.Arrays;

/**
 * Parallel arrays of matched reference-point distances: {@code sourceDistances[i]} in the
 * older run corresponds to {@code targetDistances[i]} in the newer run.
 */
public record CorrectionParams(double[] sourceDistances, double[] targetDistances, String interpolationMethod) {
    public static final String LINEAR = "linear";

    public CorrectionParams {
        if (sourceDistances == null || targetDistances == null) {
            throw new ValidationException("Correction distance arrays must not be null");
        }
        sourceDistances = sourceDistances.clone();
        targetDistances = targetDistances.clone();
        interpolationMethod = interpolationMethod == null ? LINEAR : interpolationMethod;
    }

    public CorrectionParams(double[] sourceDistances, double[] targetDistances) {
        this(sourceDistances, targetDistances, LINEAR);
    }

    @Override
    public double[] sourceDistances() {
        return sourceDistances.clone();
    }

    @Override
    public double[] targetDistances() {
        return targetDistances.clone();
    }

    public int size() {
        return sourceDistances.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorrectionParams other)) return false;
        return Arrays.equals(sourceDistances, other.sourceDistances)
                && Arrays.equals(targetDistances, other.targetDistances)
                && interpolationMethod.equals(other.interpolationMethod);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(sourceDistances) + Arrays.hashCode(targetDistances))
                + interpolationMethod.hashCode();
    }

    @Override
    public String toString() {
        return "CorrectionParams[source=" + Arrays.toString(sourceDistances)
                + ", target=" + Arrays.toString(targetDistances)
                + ", method=" + interpolationMethod + "]";
    }
}
