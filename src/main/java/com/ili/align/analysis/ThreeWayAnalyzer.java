package com.ili.align.analysis;

import com.ili.align.alignment.AlignmentValidator;
import com.ili.align.alignment.DistanceCorrectionFunction;
import com.ili.align.alignment.DtwAligner;
import com.ili.align.config.AnalysisConfig;
import com.ili.align.dto.AlignmentOutcome;
import com.ili.align.dto.AlignmentValidation;
import com.ili.align.dto.ChainExplanation;
import com.ili.align.dto.ClusteringResult;
import com.ili.align.dto.CorrectionInfo;
import com.ili.align.dto.DtwPath;
import com.ili.align.dto.GrowthAnalysisResult;
import com.ili.align.dto.InspectionRun;
import com.ili.align.dto.MatchingResult;
import com.ili.align.dto.RiskScoreBreakdown;
import com.ili.align.dto.ThreeWayAnalysisResult;
import com.ili.align.dto.enums.AnalysisStage;
import com.ili.align.dto.enums.AnalysisStatus;
import com.ili.align.exceptions.AlignmentQualityException;
import com.ili.align.exceptions.ValidationException;
import com.ili.align.growth.GrowthAnalyzer;
import com.ili.align.growth.RiskScorer;
import com.ili.align.matcher.HungarianMatcher;
import com.ili.align.metrics.AnalysisMetrics;
import com.ili.align.models.AlignmentResult;
import com.ili.align.models.AnomalyChain;
import com.ili.align.models.AnomalyRecord;
import com.ili.align.models.Match;
import com.ili.align.models.ReferencePoint;
import com.ili.align.utils.basic.BasicUtility;
import com.ili.align.utils.basic.Constant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.ili.align.validation.ModelValidationUtility.requireNonNull;

/**
 * Runs the full 2007 → 2015 → 2022 pipeline: clustering, DTW drift correction, matching
 * for both intervals, chain building, growth, risk and explanations.
 * <p>
 * Poor alignments never abort the run; the affected interval is matched on raw odometer
 * distances and the reason is recorded. Any other failure stops the pipeline: the failure
 * is counted against the stage reached and the exception propagates to the caller.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class ThreeWayAnalyzer {
    public static final double HIGH_RISK_CHAIN_THRESHOLD = 0.7;

    private final ClusterDetector clusterDetector;
    private final DtwAligner dtwAligner;
    private final AlignmentValidator alignmentValidator;
    private final HungarianMatcher matcher;
    private final GrowthAnalyzer growthAnalyzer;
    private final RiskScorer riskScorer;
    private final ChainExplainer chainExplainer;
    private final AnalysisMetrics metrics;
    private final AnalysisConfig config;

    public ThreeWayAnalysisResult analyze(InspectionRun run2007, InspectionRun run2015, InspectionRun run2022) {
        String analysisId = UUID.randomUUID().toString().substring(0, 8);
        long startTime = System.currentTimeMillis();
        ThreeWayAnalysisResult.ThreeWayAnalysisResultBuilder result = ThreeWayAnalysisResult.builder()
                .analysisId(analysisId)
                .timestamp(Instant.now())
                .status(AnalysisStatus.RUNNING);

        AnalysisStage stage = AnalysisStage.LOAD;
        try {
            requireNonNull(run2007, "run2007");
            requireNonNull(run2015, "run2015");
            requireNonNull(run2022, "run2022");
            double years0715 = intervalYears(run2007, run2015, config.getNominalYears0715());
            double years1522 = intervalYears(run2015, run2022, config.getNominalYears1522());
            result.totalAnomalies2007(run2007.anomalies().size())
                    .totalAnomalies2015(run2015.anomalies().size())
                    .totalAnomalies2022(run2022.anomalies().size())
                    .years0715(years0715)
                    .years1522(years1522);
            log.info("Analysis {}: loaded {} + {} + {} anomalies", analysisId,
                    run2007.anomalies().size(), run2015.anomalies().size(), run2022.anomalies().size());

            stage = AnalysisStage.CLUSTER;
            ClusteringResult clusters2007 = clusterDetector.detect(run2007.anomalies(), run2007.runId());
            ClusteringResult clusters2015 = clusterDetector.detect(run2015.anomalies(), run2015.runId());
            ClusteringResult clusters2022 = clusterDetector.detect(run2022.anomalies(), run2022.runId());
            int totalAnomalies = run2007.anomalies().size() + run2015.anomalies().size() + run2022.anomalies().size();
            long clustered = clusters2007.clusteredCount() + clusters2015.clusteredCount() + clusters2022.clusteredCount();
            result.interactionZones2007(clusters2007.zones())
                    .interactionZones2015(clusters2015.zones())
                    .interactionZones2022(clusters2022.zones())
                    .totalClusters(clusters2007.zones().size() + clusters2015.zones().size() + clusters2022.zones().size())
                    .clusteredAnomalyPct(totalAnomalies == 0 ? 0.0 : 100.0 * clustered / totalAnomalies);

            stage = AnalysisStage.EXTRACT_REF_POINTS;
            List<ReferencePoint> ref2007 = sortedByDistance(run2007.referencePoints());
            List<ReferencePoint> ref2015 = sortedByDistance(run2015.referencePoints());
            List<ReferencePoint> ref2022 = sortedByDistance(run2022.referencePoints());

            stage = AnalysisStage.ALIGN_07_15;
            AlignmentOutcome alignment0715 = alignAndCorrect(clusters2007.anomalies(), ref2007, ref2015,
                    run2007.runId(), run2015.runId());
            metrics.recordAlignment(Constant.INTERVAL_07_15, alignment0715.correctionApplied());
            result.alignment0715(alignment0715);

            stage = AnalysisStage.ALIGN_15_22;
            AlignmentOutcome alignment1522 = alignAndCorrect(clusters2015.anomalies(), ref2015, ref2022,
                    run2015.runId(), run2022.runId());
            metrics.recordAlignment(Constant.INTERVAL_15_22, alignment1522.correctionApplied());
            result.alignment1522(alignment1522);

            stage = AnalysisStage.MATCH_07_15;
            MatchingResult matches0715 = timedMatch(alignment0715.anomalies(), clusters2015.anomalies(),
                    Constant.INTERVAL_07_15);
            result.matching0715(matches0715.statistics())
                    .matched0715(matches0715.statistics().matched())
                    .matches0715(matches0715.matches());

            stage = AnalysisStage.MATCH_15_22;
            MatchingResult matches1522 = timedMatch(alignment1522.anomalies(), clusters2022.anomalies(),
                    Constant.INTERVAL_15_22);
            result.matching1522(matches1522.statistics())
                    .matched1522(matches1522.statistics().matched())
                    .matches1522(matches1522.matches());

            stage = AnalysisStage.BUILD_CHAINS;
            List<ChainLink> links = buildChains(alignment0715.anomalies(), clusters2015.anomalies(),
                    clusters2022.anomalies(), matches0715.matches(), matches1522.matches());
            log.info("Analysis {}: {} complete three-run chains", analysisId, links.size());

            stage = AnalysisStage.GROWTH_AND_RISK;
            List<AnomalyChain> chains = new ArrayList<>(links.size());
            for (int k = 0; k < links.size(); k++) {
                chains.add(toChain(k, links.get(k), years0715, years1522));
            }
            chains.sort(Comparator.comparingDouble(AnomalyChain::riskScore).reversed());
            chains.forEach(c -> metrics.recordChainRisk(c.riskScore()));
            metrics.incrementChainCount(chains.size());

            GrowthAnalysisResult growth0715 = growthAnalyzer.analyze(matches0715.matches(), alignment0715.anomalies(),
                    clusters2015.anomalies(), years0715);
            GrowthAnalysisResult growth1522 = growthAnalyzer.analyze(matches1522.matches(), alignment1522.anomalies(),
                    clusters2022.anomalies(), years1522);
            List<RiskScoreBreakdown> topRisk = riskScorer.rankByRisk(clusters2022.anomalies(),
                    growth1522.growthMetrics(), ref2022, config.getTopNRisk());
            summarizeChains(result, chains);
            result.growth0715(growth0715.statistics())
                    .growth1522(growth1522.statistics())
                    .growthMetrics0715(riskScorer.applyRiskScores(growth0715.growthMetrics(),
                            clusters2015.anomalies(), ref2015))
                    .growthMetrics1522(riskScorer.applyRiskScores(growth1522.growthMetrics(),
                            clusters2022.anomalies(), ref2022))
                    .highestRiskAnomalies2022(topRisk);

            stage = AnalysisStage.EXPLAIN;
            if (config.isExplainEnabled() && !chains.isEmpty()) {
                List<ChainExplanation> explanations = chains.stream()
                        .limit(config.getTopNExplain())
                        .map(chain -> chainExplainer.explain(chain, years0715, years1522))
                        .collect(Collectors.toList());
                result.explanations(explanations);
                log.info("Analysis {}: explained top {} chains", analysisId, explanations.size());
            }

            stage = AnalysisStage.DONE;
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordAnalysisDuration(duration, AnalysisStatus.COMPLETE);
            log.info("Analysis {} complete in {} ms: {} chains", analysisId, duration, chains.size());
            ThreeWayAnalysisResult completed = result.stage(stage).status(AnalysisStatus.COMPLETE).build();
            if (log.isDebugEnabled()) {
                log.debug("Analysis {} result: {}", analysisId, BasicUtility.stringifyObject(completed));
            }
            return completed;
        } catch (RuntimeException e) {
            log.error("Analysis {} failed at stage {}: {}", analysisId, stage, e.getMessage(), e);
            metrics.recordAnalysisFailure(stage);
            metrics.recordAnalysisDuration(System.currentTimeMillis() - startTime, AnalysisStatus.FAILED);
            throw e;
        }
    }

    /**
     * Aligns {@code source} reference points onto {@code target} and moves the source-run
     * anomalies into the target frame. Girth welds are used when both runs have enough of
     * them; otherwise every reference point type takes part.
     */
    AlignmentOutcome alignAndCorrect(List<AnomalyRecord> anomalies, List<ReferencePoint> source,
                                     List<ReferencePoint> target, String sourceRunId, String targetRunId) {
        List<ReferencePoint> sourcePoints = source;
        List<ReferencePoint> targetPoints = target;
        List<ReferencePoint> sourceWelds = girthWelds(source);
        List<ReferencePoint> targetWelds = girthWelds(target);
        if (sourceWelds.size() >= config.getMinGirthWelds() && targetWelds.size() >= config.getMinGirthWelds()) {
            sourcePoints = sourceWelds;
            targetPoints = targetWelds;
        }

        if (sourcePoints.size() < 2 || targetPoints.size() < 2) {
            String reason = String.format("Insufficient reference points: %d in %s, %d in %s (minimum: 2 each)",
                    sourcePoints.size(), sourceRunId, targetPoints.size(), targetRunId);
            log.warn("Skipping distance correction for {} -> {}: {}", sourceRunId, targetRunId, reason);
            return AlignmentOutcome.fallback(anomalies, reason, null);
        }

        AlignmentValidation validation = null;
        try {
            DtwPath path = dtwAligner.computeAlignment(sourcePoints, targetPoints, sourceRunId, targetRunId);
            validation = alignmentValidator.validate(path, sourcePoints, targetPoints);
            for (String warning : validation.warnings()) {
                log.warn("Alignment {} -> {}: {}", sourceRunId, targetRunId, warning);
            }

            AlignmentResult alignment = DtwAligner.toAlignmentResult(path);
            DistanceCorrectionFunction corrector = DistanceCorrectionFunction.from(alignment);
            CorrectionInfo info = corrector.getCorrectionInfo();
            log.info("Alignment {} -> {}: {}% match rate, RMSE {} ft, max shift {} ft over {} pairs",
                    sourceRunId, targetRunId, BasicUtility.round(path.matchRate(), 1),
                    BasicUtility.round(path.rmse(), 2), BasicUtility.round(info.maxCorrection(), 2),
                    path.pairs().size());
            return AlignmentOutcome.applied(corrector.correctAnomalies(anomalies), path, info, validation);
        } catch (AlignmentQualityException | ValidationException e) {
            log.warn("DTW alignment failed for {} -> {}: {}. Proceeding with raw odometer distances.",
                    sourceRunId, targetRunId, e.getMessage());
            return AlignmentOutcome.fallback(anomalies, "DTW alignment failed: " + e.getMessage(), validation);
        }
    }

    private MatchingResult timedMatch(List<AnomalyRecord> older, List<AnomalyRecord> newer, String interval) {
        long start = System.currentTimeMillis();
        MatchingResult matching = matcher.match(older, newer);
        long duration = System.currentTimeMillis() - start;
        metrics.recordMatchingDuration(duration, interval);
        metrics.recordMatches(interval, matching.statistics());
        log.info("Matched {} pairs for {} in {} ms", matching.statistics().matched(), interval, duration);
        return matching;
    }

    List<ChainLink> buildChains(List<AnomalyRecord> anomalies2007, List<AnomalyRecord> anomalies2015,
                                List<AnomalyRecord> anomalies2022, List<Match> matches0715, List<Match> matches1522) {
        Map<String, Match> byNewer0715 = new LinkedHashMap<>();
        matches0715.forEach(m -> byNewer0715.put(m.anomaly2Id(), m));
        Map<String, Match> byOlder1522 = new LinkedHashMap<>();
        matches1522.forEach(m -> byOlder1522.put(m.anomaly1Id(), m));

        Map<String, AnomalyRecord> lookup2007 = index(anomalies2007);
        Map<String, AnomalyRecord> lookup2015 = index(anomalies2015);
        Map<String, AnomalyRecord> lookup2022 = index(anomalies2022);

        List<ChainLink> links = new ArrayList<>();
        byNewer0715.forEach((id2015, first) -> {
            Match second = byOlder1522.get(id2015);
            if (second == null) {
                return;
            }
            AnomalyRecord a2007 = lookup2007.get(first.anomaly1Id());
            AnomalyRecord a2015 = lookup2015.get(id2015);
            AnomalyRecord a2022 = lookup2022.get(second.anomaly2Id());
            if (a2007 != null && a2015 != null && a2022 != null) {
                links.add(new ChainLink(first, second, a2007, a2015, a2022));
            }
        });
        return links;
    }

    AnomalyChain toChain(int index, ChainLink link, double years0715, double years1522) {
        double depth2007 = link.anomaly2007().depthPct();
        double depth2015 = link.anomaly2015().depthPct();
        double depth2022 = link.anomaly2022().depthPct();
        double rate0715 = GrowthAnalyzer.growthRate(depth2007, depth2015, years0715);
        double rate1522 = GrowthAnalyzer.growthRate(depth2015, depth2022, years1522);
        double acceleration = rate1522 - rate0715;

        return AnomalyChain.builder()
                .chainId(String.format("CHAIN_%04d", index))
                .anomaly2007Id(link.anomaly2007().id())
                .anomaly2015Id(link.anomaly2015().id())
                .anomaly2022Id(link.anomaly2022().id())
                .matchConfidence0715(link.match0715().similarityScore())
                .matchConfidence1522(link.match1522().similarityScore())
                .depth2007(depth2007)
                .depth2015(depth2015)
                .depth2022(depth2022)
                .growthRate0715(rate0715)
                .growthRate1522(rate1522)
                .acceleration(acceleration)
                .accelerating(AnomalyChain.isAccelerating(acceleration))
                .riskScore(chainRisk(depth2022, rate1522, acceleration))
                .yearsTo80Pct(ChainExplainer.projectYearsToCritical(depth2022, rate1522, acceleration))
                .build();
    }

    /**
     * Chain risk weighs current depth, the latest growth rate and any positive acceleration.
     */
    static double chainRisk(double depth2022, double growthRate1522, double acceleration) {
        double risk = 0.5 * Math.min(depth2022 / 100.0, 1.0)
                + 0.3 * Math.min(Math.max(growthRate1522, 0.0) / 10.0, 1.0)
                + 0.2 * Math.min(Math.max(acceleration, 0.0) / 5.0, 1.0);
        return Math.min(risk, 1.0);
    }

    static boolean needsImmediateAction(AnomalyChain chain) {
        return chain.depth2022() >= ChainExplainer.IMMEDIATE_DEPTH_PCT
                || (chain.yearsTo80Pct() != null && chain.yearsTo80Pct() <= 3.0);
    }

    private static void summarizeChains(ThreeWayAnalysisResult.ThreeWayAnalysisResultBuilder result,
                                        List<AnomalyChain> chains) {
        int accelerating = (int) chains.stream().filter(AnomalyChain::accelerating).count();
        int decelerating = (int) chains.stream().filter(AnomalyChain::isDecelerating).count();
        result.chains(chains)
                .totalChains(chains.size())
                .acceleratingCount(accelerating)
                .deceleratingCount(decelerating)
                .stableCount(chains.size() - accelerating - decelerating)
                .immediateActionCount((int) chains.stream().filter(ThreeWayAnalyzer::needsImmediateAction).count())
                .highRiskChainCount((int) chains.stream()
                        .filter(c -> c.riskScore() >= HIGH_RISK_CHAIN_THRESHOLD).count())
                .avgGrowthRate0715(chains.stream().mapToDouble(AnomalyChain::growthRate0715).average().orElse(0.0))
                .avgGrowthRate1522(chains.stream().mapToDouble(AnomalyChain::growthRate1522).average().orElse(0.0));
    }

    private static double intervalYears(InspectionRun older, InspectionRun newer, double nominalYears) {
        double years = BasicUtility.yearsBetween(older.inspectionDate(), newer.inspectionDate(), nominalYears);
        if (years <= 0) {
            throw new ValidationException(String.format("Inspection of %s must precede %s",
                    older.runId(), newer.runId()));
        }
        return years;
    }

    private static List<ReferencePoint> sortedByDistance(List<ReferencePoint> points) {
        return points.stream()
                .sorted(Comparator.comparingDouble(ReferencePoint::distance))
                .collect(Collectors.toList());
    }

    private static List<ReferencePoint> girthWelds(List<ReferencePoint> points) {
        return points.stream().filter(ReferencePoint::isGirthWeld).collect(Collectors.toList());
    }

    private static Map<String, AnomalyRecord> index(List<AnomalyRecord> anomalies) {
        return anomalies.stream()
                .collect(Collectors.toMap(AnomalyRecord::id, Function.identity(), (a, b) -> a));
    }

    record ChainLink(Match match0715, Match match1522, AnomalyRecord anomaly2007, AnomalyRecord anomaly2015,
                     AnomalyRecord anomaly2022) {
    }
}
