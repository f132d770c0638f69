package com.ili.align.models;

import static com.ili.align.validation.ModelValidationUtility.*;

/**
 * Growth of one matched defect between two runs. Rates are signed: negative values mean
 * apparent shrinkage from repair or measurement noise.
 */
public record GrowthMetrics(
        String matchId,
        String anomaly1Id,
        String anomaly2Id,
        double timeIntervalYears,
        double depthGrowthRate,
        double lengthGrowthRate,
        double widthGrowthRate,
        boolean rapidGrowth,
        double riskScore) {

    public GrowthMetrics {
        requireId(matchId, "matchId");
        requirePositive(timeIntervalYears, "timeIntervalYears");
        requireInRange(riskScore, 0.0, 1.0, "riskScore");
    }

    public static GrowthMetrics of(Match match, double timeIntervalYears, double depthRate, double lengthRate,
                                   double widthRate, double rapidGrowthThreshold) {
        return new GrowthMetrics(match.id(), match.anomaly1Id(), match.anomaly2Id(), timeIntervalYears,
                depthRate, lengthRate, widthRate, depthRate > rapidGrowthThreshold, 0.0);
    }

    public GrowthMetrics withRiskScore(double score) {
        return new GrowthMetrics(matchId, anomaly1Id, anomaly2Id, timeIntervalYears, depthGrowthRate,
                lengthGrowthRate, widthGrowthRate, rapidGrowth, score);
    }
}
