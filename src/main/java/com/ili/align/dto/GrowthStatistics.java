package com.ili.align.dto;

import lombok.Builder;

@Builder
public record GrowthStatistics(
        int totalMatches,
        int rapidGrowthCount,
        double rapidGrowthPercentage,
        DimensionStatistics depthGrowth,
        DimensionStatistics lengthGrowth,
        DimensionStatistics widthGrowth) {

    public static GrowthStatistics empty() {
        return new GrowthStatistics(0, 0, 0.0, DimensionStatistics.EMPTY, DimensionStatistics.EMPTY,
                DimensionStatistics.EMPTY);
    }
}
