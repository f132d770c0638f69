package com.ili.align.analysis;

import com.ili.align.dto.ChainExplanation;
import com.ili.align.dto.enums.TrendClassification;
import com.ili.align.dto.enums.UrgencyLevel;
import com.ili.align.models.AnomalyChain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based lifecycle narrative for an anomaly chain: growth trend, projection to the
 * 80% wall-loss threshold, urgency and the resulting recommendation.
 */
public class ChainExplainer {
    public static final double CRITICAL_DEPTH_PCT = 80.0;
    public static final double IMMEDIATE_DEPTH_PCT = 70.0;

    static final double ACCELERATION_HORIZON_YEARS = 2.5;
    static final double CONCERN_DEPTH_PCT = 60.0;
    static final double CONCERN_GROWTH_RATE = 5.0;
    static final double CONCERN_CONFIDENCE = 0.7;

    public ChainExplanation explain(AnomalyChain chain, double years0715, double years1522) {
        TrendClassification trend = classifyTrend(chain.acceleration());
        UrgencyLevel urgency = assessUrgency(chain.yearsTo80Pct(), chain.depth2022());

        String trendAnalysis = format(
                "Growth rate changed from %.2f pp/yr (2007-2015) to %.2f pp/yr (2015-2022). "
                        + "Acceleration: %+.3f pp/yr². Trend: %s (%s).",
                chain.growthRate0715(), chain.growthRate1522(), chain.acceleration(),
                severity(trend, chain.acceleration()), trend);
        String projection = projectionText(chain);

        String narrative = format(
                "This anomaly was first detected in 2007 at %.1f%% depth. "
                        + "By 2015, it had grown to %.1f%% (growth rate: %.2f pp/yr over %.1f years). "
                        + "By 2022, it reached %.1f%% (growth rate: %.2f pp/yr over %.1f years).",
                chain.depth2007(), chain.depth2015(), chain.growthRate0715(), years0715,
                chain.depth2022(), chain.growthRate1522(), years1522)
                + "\n\nTrend Analysis: " + trendAnalysis
                + "\n\nProjection: " + projection;

        return ChainExplanation.builder()
                .chainId(chain.chainId())
                .trendClassification(trend)
                .urgencyLevel(urgency)
                .lifecycleNarrative(narrative)
                .trendAnalysis(trendAnalysis)
                .projectionAnalysis(projection)
                .recommendation(recommendation(urgency))
                .concerns(concerns(chain, trend))
                .build();
    }

    public static TrendClassification classifyTrend(double acceleration) {
        if (acceleration > AnomalyChain.ACCELERATION_THRESHOLD) {
            return TrendClassification.ACCELERATING;
        }
        if (acceleration < -AnomalyChain.ACCELERATION_THRESHOLD) {
            return TrendClassification.DECELERATING;
        }
        return TrendClassification.STABLE;
    }

    /**
     * Years until the depth reaches 80%. A positive acceleration is assumed to persist,
     * which shortens the estimate. Returns {@code null} when the anomaly is not growing.
     */
    public static Double projectYearsToCritical(double currentDepth, double growthRate, double acceleration) {
        if (currentDepth >= CRITICAL_DEPTH_PCT) {
            return 0.0;
        }
        double effectiveRate = growthRate;
        if (acceleration > 0) {
            effectiveRate = growthRate + acceleration * ACCELERATION_HORIZON_YEARS;
        }
        if (effectiveRate <= 0) {
            return null;
        }
        return (CRITICAL_DEPTH_PCT - currentDepth) / effectiveRate;
    }

    public static UrgencyLevel assessUrgency(Double yearsToCritical, double currentDepth) {
        if (currentDepth >= IMMEDIATE_DEPTH_PCT) {
            return UrgencyLevel.IMMEDIATE;
        }
        if (yearsToCritical == null) {
            return UrgencyLevel.MONITOR;
        }
        if (yearsToCritical <= 3) {
            return UrgencyLevel.IMMEDIATE;
        }
        if (yearsToCritical <= 7) {
            return UrgencyLevel.NEAR_TERM;
        }
        if (yearsToCritical <= 15) {
            return UrgencyLevel.SCHEDULED;
        }
        return UrgencyLevel.MONITOR;
    }

    static String recommendation(UrgencyLevel urgency) {
        switch (urgency) {
            case IMMEDIATE:
                return "IMMEDIATE ACTION REQUIRED. Schedule excavation and direct assessment. "
                        + "This anomaly poses a near-term integrity threat.";
            case NEAR_TERM:
                return "Schedule repair within the next inspection cycle (3-7 years). "
                        + "Increase monitoring frequency for this location.";
            case SCHEDULED:
                return "Include in next scheduled maintenance program. Continue standard monitoring.";
            default:
                return "Continue standard monitoring. No immediate action required. Reassess at next inspection.";
        }
    }

    static List<String> concerns(AnomalyChain chain, TrendClassification trend) {
        List<String> concerns = new ArrayList<>();
        if (trend == TrendClassification.ACCELERATING) {
            concerns.add(format("Growth is accelerating (%+.3f pp/yr²)", chain.acceleration()));
        }
        if (chain.depth2022() > CONCERN_DEPTH_PCT) {
            concerns.add(format("Current depth (%.1f%%) exceeds 60%% threshold", chain.depth2022()));
        }
        if (chain.growthRate1522() > CONCERN_GROWTH_RATE) {
            concerns.add(format("Rapid growth rate (%.2f pp/yr) exceeds ASME B31.8S high-risk threshold",
                    chain.growthRate1522()));
        }
        double minConfidence = Math.min(chain.matchConfidence0715(), chain.matchConfidence1522());
        if (minConfidence < CONCERN_CONFIDENCE) {
            concerns.add(format("Low match confidence (%.3f) - verify chain linkage", minConfidence));
        }
        return concerns;
    }

    private static String severity(TrendClassification trend, double acceleration) {
        double magnitude = Math.abs(acceleration);
        if (trend == TrendClassification.STABLE) {
            return "stable";
        }
        String direction = trend == TrendClassification.ACCELERATING ? "accelerating" : "decelerating";
        if (magnitude > 1.0) {
            return "rapidly " + direction;
        }
        if (magnitude > 0.5) {
            return "moderately " + direction;
        }
        return "slightly " + direction;
    }

    private static String projectionText(AnomalyChain chain) {
        Double years = chain.yearsTo80Pct();
        if (years != null && years > 0) {
            return format("At current growth rate (%.2f pp/yr), this anomaly will reach the 80%% critical "
                    + "threshold in approximately %.1f years.", chain.growthRate1522(), years);
        }
        if (years != null) {
            return format("This anomaly has ALREADY exceeded the 80%% critical threshold at %.1f%% depth. "
                    + "Immediate action required.", chain.depth2022());
        }
        return format("Growth rate is not positive (%.2f pp/yr). The anomaly is stable or shrinking. "
                + "Current depth: %.1f%%.", chain.growthRate1522(), chain.depth2022());
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
