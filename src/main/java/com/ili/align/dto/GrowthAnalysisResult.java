package com.ili.align.dto;

import com.ili.align.models.GrowthMetrics;

import java.util.List;

public record GrowthAnalysisResult(
        List<GrowthMetrics> growthMetrics,
        GrowthStatistics statistics,
        List<RapidGrowthAnomaly> rapidGrowthAnomalies) {

    public GrowthAnalysisResult {
        growthMetrics = List.copyOf(growthMetrics);
        rapidGrowthAnomalies = List.copyOf(rapidGrowthAnomalies);
    }
}
