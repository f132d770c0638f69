package com.ili.align.config;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * Tuning for {@link com.ili.align.matcher.SimilarityCalculator}. {@code weights} only needs
 * the keys being overridden; missing keys keep their defaults.
 */
@Getter
@Builder
public class SimilarityConfig {
    @Builder.Default
    private final double distanceSigma = 5.0;
    @Builder.Default
    private final double clockSigma = 1.0;
    private final Double dimensionSigma;
    @Builder.Default
    private final Map<String, Double> weights = Map.of();

    public static SimilarityConfig defaults() {
        return SimilarityConfig.builder().build();
    }
}
