package com.ili.align.growth;

import com.ili.align.dto.RiskScoreBreakdown;
import com.ili.align.exceptions.ValidationException;
import com.ili.align.models.AnomalyRecord;
import com.ili.align.models.GrowthMetrics;
import com.ili.align.models.ReferencePoint;
import lombok.Getter;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.ili.align.validation.ModelValidationUtility.requireNonNegative;
import static com.ili.align.validation.ModelValidationUtility.requireWeightsSumToOne;

/**
 * Composite risk for a single anomaly: weighted depth, depth growth rate and proximity to
 * reference points, plus a flat boost for members of an interaction zone.
 */
@Getter
public class RiskScorer {
    public static final double DEFAULT_HIGH_RISK_THRESHOLD = 0.7;

    private static final double NEAR_FEATURE_FT = 3.0;
    private static final double FAR_FEATURE_FT = 10.0;
    private static final double BASELINE_LOCATION_FACTOR = 0.5;

    private final double depthWeight;
    private final double growthWeight;
    private final double locationWeight;
    private final double clusterBoost;

    public RiskScorer() {
        this(0.6, 0.3, 0.1, 0.1);
    }

    public RiskScorer(double depthWeight, double growthWeight, double locationWeight, double clusterBoost) {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("depth", depthWeight);
        weights.put("growth", growthWeight);
        weights.put("location", locationWeight);
        requireWeightsSumToOne(weights);
        this.depthWeight = depthWeight;
        this.growthWeight = growthWeight;
        this.locationWeight = locationWeight;
        this.clusterBoost = requireNonNegative(clusterBoost, "clusterBoost");
    }

    public double score(double depthPct, double growthRate, double locationFactor) {
        return Math.min(1.0, depthWeight * clip(depthPct / 100.0)
                + growthWeight * clip(growthRate / 10.0)
                + locationWeight * locationFactor);
    }

    public double locationFactor(AnomalyRecord anomaly, List<ReferencePoint> referencePoints) {
        if (referencePoints == null || referencePoints.isEmpty()) {
            return BASELINE_LOCATION_FACTOR;
        }
        double nearest = referencePoints.stream()
                .mapToDouble(rp -> Math.abs(anomaly.distance() - rp.distance()))
                .min()
                .orElse(Double.POSITIVE_INFINITY);
        if (nearest < NEAR_FEATURE_FT) {
            return 1.0;
        }
        if (nearest < FAR_FEATURE_FT) {
            return 1.0 - (nearest - NEAR_FEATURE_FT) / (FAR_FEATURE_FT - NEAR_FEATURE_FT) * 0.5;
        }
        return BASELINE_LOCATION_FACTOR;
    }

    public RiskScoreBreakdown scoreAnomaly(AnomalyRecord anomaly, GrowthMetrics growth,
                                           List<ReferencePoint> referencePoints) {
        double growthRate = growth == null ? 0.0 : growth.depthGrowthRate();
        double location = locationFactor(anomaly, referencePoints);
        double risk = score(anomaly.depthPct(), growthRate, location);

        double clusterContribution = 0.0;
        if (anomaly.isClustered()) {
            clusterContribution = clusterBoost;
            risk = Math.min(risk + clusterBoost, 1.0);
        }

        return RiskScoreBreakdown.builder()
                .anomalyId(anomaly.id())
                .riskScore(risk)
                .depthPct(anomaly.depthPct())
                .growthRate(growthRate)
                .locationFactor(location)
                .depthContribution(depthWeight * clip(anomaly.depthPct() / 100.0))
                .growthContribution(growthWeight * clip(growthRate / 10.0))
                .locationContribution(locationWeight * location)
                .clusterContribution(clusterContribution)
                .clustered(anomaly.isClustered())
                .build();
    }

    /**
     * Scores every anomaly; growth metrics are looked up by their newer anomaly id.
     */
    public List<RiskScoreBreakdown> scoreAnomalies(List<AnomalyRecord> anomalies, List<GrowthMetrics> growthMetrics,
                                                   List<ReferencePoint> referencePoints) {
        Map<String, GrowthMetrics> byNewerAnomaly = growthMetrics == null ? Map.of()
                : growthMetrics.stream().collect(Collectors.toMap(GrowthMetrics::anomaly2Id, Function.identity(),
                (a, b) -> a));
        return anomalies.stream()
                .map(a -> scoreAnomaly(a, byNewerAnomaly.get(a.id()), referencePoints))
                .collect(Collectors.toList());
    }

    /**
     * Scores and sorts by descending risk. A null {@code topN} keeps every anomaly.
     */
    public List<RiskScoreBreakdown> rankByRisk(List<AnomalyRecord> anomalies, List<GrowthMetrics> growthMetrics,
                                               List<ReferencePoint> referencePoints, Integer topN) {
        if (topN != null && topN < 0) {
            throw new ValidationException("topN must be non-negative, got " + topN);
        }
        List<RiskScoreBreakdown> ranked = scoreAnomalies(anomalies, growthMetrics, referencePoints).stream()
                .sorted(Comparator.comparingDouble(RiskScoreBreakdown::riskScore).reversed())
                .collect(Collectors.toList());
        return topN == null ? ranked : ranked.subList(0, Math.min(topN, ranked.size()));
    }

    public List<RiskScoreBreakdown> getHighRiskAnomalies(List<AnomalyRecord> anomalies,
                                                         List<GrowthMetrics> growthMetrics,
                                                         List<ReferencePoint> referencePoints, double threshold) {
        return rankByRisk(anomalies, growthMetrics, referencePoints, null).stream()
                .filter(score -> score.riskScore() >= threshold)
                .collect(Collectors.toList());
    }

    /**
     * Returns copies of the growth metrics carrying the risk score of their newer anomaly.
     */
    public List<GrowthMetrics> applyRiskScores(List<GrowthMetrics> growthMetrics, List<AnomalyRecord> newerRun,
                                               List<ReferencePoint> referencePoints) {
        Map<String, AnomalyRecord> byId = newerRun.stream()
                .collect(Collectors.toMap(AnomalyRecord::id, Function.identity(), (a, b) -> a));
        return growthMetrics.stream()
                .map(gm -> {
                    AnomalyRecord anomaly = byId.get(gm.anomaly2Id());
                    return anomaly == null ? gm
                            : gm.withRiskScore(scoreAnomaly(anomaly, gm, referencePoints).riskScore());
                })
                .collect(Collectors.toList());
    }

    private static double clip(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
