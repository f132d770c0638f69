package com.ili.align.config;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class AnalysisConfig {
    @Builder.Default
    private final boolean explainEnabled = true;
    @Builder.Default
    private final int topNExplain = 10;
    @Builder.Default
    private final int topNRisk = 20;
    @Builder.Default
    private final double nominalYears0715 = 8.0;
    @Builder.Default
    private final double nominalYears1522 = 7.0;
    @Builder.Default
    private final int minGirthWelds = 3;

    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder().build();
    }
}
