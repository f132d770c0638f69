package com.ili.align.validation;

import com.ili.align.exceptions.ValidationException;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

public final class ModelValidationUtility {
    private static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    private ModelValidationUtility() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static String requireId(String value, String field) {
        if (StringUtils.isBlank(value)) {
            throw new ValidationException(field + " must not be blank");
        }
        return value;
    }

    public static <T> T requireNonNull(T value, String field) {
        if (value == null) {
            throw new ValidationException(field + " must not be null");
        }
        return value;
    }

    public static double requireInRange(double value, double min, double max, String field) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new ValidationException(field + " must be within [" + min + ", " + max + "], got " + value);
        }
        return value;
    }

    public static double requireNonNegative(double value, String field) {
        if (Double.isNaN(value) || value < 0) {
            throw new ValidationException(field + " must be >= 0, got " + value);
        }
        return value;
    }

    public static double requirePositive(double value, String field) {
        if (Double.isNaN(value) || value <= 0) {
            throw new ValidationException(field + " must be > 0, got " + value);
        }
        return value;
    }

    public static void requireWeightsSumToOne(Map<String, Double> weights) {
        double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(total - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new ValidationException("Weights must sum to 1.0, got " + total);
        }
    }
}
