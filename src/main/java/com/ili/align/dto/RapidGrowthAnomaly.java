package com.ili.align.dto;

public record RapidGrowthAnomaly(
        String anomalyId,
        double depthGrowthRate,
        double currentDepth,
        double distance,
        double clockPosition) {}
