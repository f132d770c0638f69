package com.ili.align.dto.enums;

public enum MatchConfidence {
    HIGH,
    MEDIUM,
    LOW;

    private static final double HIGH_THRESHOLD = 0.8;
    private static final double MEDIUM_THRESHOLD = 0.6;

    public static MatchConfidence fromScore(double similarityScore) {
        if (similarityScore >= HIGH_THRESHOLD) return HIGH;
        if (similarityScore >= MEDIUM_THRESHOLD) return MEDIUM;
        return LOW;
    }
}
