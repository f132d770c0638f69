package com.ili.align.dto;

import com.ili.align.dto.enums.AnalysisStage;
import com.ili.align.dto.enums.AnalysisStatus;
import com.ili.align.models.AnomalyChain;
import com.ili.align.models.GrowthMetrics;
import com.ili.align.models.InteractionZone;
import com.ili.align.models.Match;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Everything a completed three-run analysis produced. Growth metrics carry the risk score
 * of their newer anomaly.
 */
@Getter
@Builder(toBuilder = true)
public class ThreeWayAnalysisResult {
    private final String analysisId;
    private final Instant timestamp;

    private final int totalAnomalies2007;
    private final int totalAnomalies2015;
    private final int totalAnomalies2022;

    private final double years0715;
    private final double years1522;

    private final AlignmentOutcome alignment0715;
    private final AlignmentOutcome alignment1522;

    private final MatchingStatistics matching0715;
    private final MatchingStatistics matching1522;
    private final int matched0715;
    private final int matched1522;
    @Builder.Default
    private final List<Match> matches0715 = List.of();
    @Builder.Default
    private final List<Match> matches1522 = List.of();

    @Builder.Default
    private final List<InteractionZone> interactionZones2007 = List.of();
    @Builder.Default
    private final List<InteractionZone> interactionZones2015 = List.of();
    @Builder.Default
    private final List<InteractionZone> interactionZones2022 = List.of();
    private final int totalClusters;
    private final double clusteredAnomalyPct;

    private final int totalChains;
    @Builder.Default
    private final List<AnomalyChain> chains = List.of();
    @Builder.Default
    private final List<ChainExplanation> explanations = List.of();
    private final int acceleratingCount;
    private final int stableCount;
    private final int deceleratingCount;
    private final int immediateActionCount;
    private final int highRiskChainCount;
    private final double avgGrowthRate0715;
    private final double avgGrowthRate1522;

    private final GrowthStatistics growth0715;
    private final GrowthStatistics growth1522;
    @Builder.Default
    private final List<GrowthMetrics> growthMetrics0715 = List.of();
    @Builder.Default
    private final List<GrowthMetrics> growthMetrics1522 = List.of();
    @Builder.Default
    private final List<RiskScoreBreakdown> highestRiskAnomalies2022 = List.of();

    private final AnalysisStage stage;
    private final AnalysisStatus status;
}
