package com.ili.align.models;

import lombok.Builder;

import static com.ili.align.validation.ModelValidationUtility.*;

/**
 * The same physical defect followed through three runs via two successive matches.
 */
@Builder
public record AnomalyChain(
        String chainId,
        String anomaly2007Id,
        String anomaly2015Id,
        String anomaly2022Id,
        double matchConfidence0715,
        double matchConfidence1522,
        double depth2007,
        double depth2015,
        double depth2022,
        double growthRate0715,
        double growthRate1522,
        double acceleration,
        boolean accelerating,
        double riskScore,
        Double yearsTo80Pct) {

    public static final double ACCELERATION_THRESHOLD = 0.1;

    public AnomalyChain {
        requireId(chainId, "chainId");
        requireId(anomaly2007Id, "anomaly2007Id");
        requireId(anomaly2015Id, "anomaly2015Id");
        requireId(anomaly2022Id, "anomaly2022Id");
        requireInRange(matchConfidence0715, 0.0, 1.0, "matchConfidence0715");
        requireInRange(matchConfidence1522, 0.0, 1.0, "matchConfidence1522");
        requireInRange(riskScore, 0.0, 1.0, "riskScore");
    }

    public static boolean isAccelerating(double acceleration) {
        return acceleration > ACCELERATION_THRESHOLD;
    }

    public boolean isDecelerating() {
        return acceleration < -ACCELERATION_THRESHOLD;
    }
}
