package com.ili.align.dto;

import lombok.Builder;

@Builder
public record RiskScoreBreakdown(
        String anomalyId,
        double riskScore,
        double depthPct,
        double growthRate,
        double locationFactor,
        double depthContribution,
        double growthContribution,
        double locationContribution,
        double clusterContribution,
        boolean clustered) {}
