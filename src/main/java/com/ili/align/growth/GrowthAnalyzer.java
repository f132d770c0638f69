package com.ili.align.growth;

import com.ili.align.dto.DimensionStatistics;
import com.ili.align.dto.GrowthAnalysisResult;
import com.ili.align.dto.GrowthStatistics;
import com.ili.align.dto.RapidGrowthAnomaly;
import com.ili.align.dto.enums.FeatureType;
import com.ili.align.exceptions.ValidationException;
import com.ili.align.models.AnomalyRecord;
import com.ili.align.models.GrowthMetrics;
import com.ili.align.models.Match;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Per-match growth rates between two runs and their summary statistics.
 */
@Slf4j
@Getter
public class GrowthAnalyzer {
    public static final double DEFAULT_RAPID_GROWTH_THRESHOLD = 5.0;

    private final double rapidGrowthThreshold;

    public GrowthAnalyzer() {
        this(DEFAULT_RAPID_GROWTH_THRESHOLD);
    }

    public GrowthAnalyzer(double rapidGrowthThreshold) {
        this.rapidGrowthThreshold = rapidGrowthThreshold;
    }

    /**
     * Signed change per year, {@code (finalValue - initialValue) / years}.
     *
     * @throws ValidationException if {@code years} is not positive.
     */
    public static double growthRate(double initialValue, double finalValue, double years) {
        if (years <= 0) {
            throw new ValidationException("Time interval must be positive, got " + years);
        }
        return (finalValue - initialValue) / years;
    }

    public GrowthMetrics measure(Match match, AnomalyRecord older, AnomalyRecord newer, double years) {
        return GrowthMetrics.of(match, years,
                growthRate(older.depthPct(), newer.depthPct(), years),
                growthRate(older.length(), newer.length(), years),
                growthRate(older.width(), newer.width(), years),
                rapidGrowthThreshold);
    }

    public GrowthAnalysisResult analyze(List<Match> matches, List<AnomalyRecord> run1, List<AnomalyRecord> run2,
                                        double years) {
        if (years <= 0) {
            throw new ValidationException("Time interval must be positive, got " + years);
        }
        Map<String, AnomalyRecord> older = index(run1);
        Map<String, AnomalyRecord> newer = index(run2);

        List<GrowthMetrics> metrics = new ArrayList<>(matches.size());
        List<RapidGrowthAnomaly> rapid = new ArrayList<>();
        int skipped = 0;
        for (Match match : matches) {
            AnomalyRecord a1 = older.get(match.anomaly1Id());
            AnomalyRecord a2 = newer.get(match.anomaly2Id());
            if (a1 == null || a2 == null) {
                skipped++;
                continue;
            }
            GrowthMetrics gm = measure(match, a1, a2, years);
            metrics.add(gm);
            if (gm.rapidGrowth()) {
                rapid.add(new RapidGrowthAnomaly(a2.id(), gm.depthGrowthRate(), a2.depthPct(), a2.distance(),
                        a2.clockPosition()));
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} matches whose anomalies were not found", skipped);
        }

        return new GrowthAnalysisResult(metrics, statistics(metrics), rapid);
    }

    /**
     * Statistics grouped by the feature type of the newer anomaly in each match.
     */
    public Map<FeatureType, GrowthStatistics> growthByFeatureType(List<GrowthMetrics> metrics,
                                                                  List<AnomalyRecord> run2) {
        Map<String, AnomalyRecord> newer = index(run2);
        Map<FeatureType, List<GrowthMetrics>> grouped = new EnumMap<>(FeatureType.class);
        for (GrowthMetrics gm : metrics) {
            AnomalyRecord anomaly = newer.get(gm.anomaly2Id());
            if (anomaly == null) {
                log.debug("No run2 anomaly {} for growth metrics {}", gm.anomaly2Id(), gm.matchId());
                continue;
            }
            grouped.computeIfAbsent(anomaly.featureType(), k -> new ArrayList<>()).add(gm);
        }

        Map<FeatureType, GrowthStatistics> result = new EnumMap<>(FeatureType.class);
        grouped.forEach((type, list) -> result.put(type, statistics(list)));
        return result;
    }

    public GrowthStatistics statistics(List<GrowthMetrics> metrics) {
        if (metrics.isEmpty()) {
            return GrowthStatistics.empty();
        }
        int rapid = (int) metrics.stream().filter(GrowthMetrics::rapidGrowth).count();
        return GrowthStatistics.builder()
                .totalMatches(metrics.size())
                .rapidGrowthCount(rapid)
                .rapidGrowthPercentage(100.0 * rapid / metrics.size())
                .depthGrowth(describe(metrics, GrowthMetrics::depthGrowthRate))
                .lengthGrowth(describe(metrics, GrowthMetrics::lengthGrowthRate))
                .widthGrowth(describe(metrics, GrowthMetrics::widthGrowthRate))
                .build();
    }

    static DimensionStatistics describe(List<GrowthMetrics> metrics, ToDoubleFunction<GrowthMetrics> rate) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        metrics.forEach(gm -> stats.addValue(rate.applyAsDouble(gm)));
        if (stats.getN() == 0) {
            return DimensionStatistics.EMPTY;
        }
        return new DimensionStatistics(
                stats.getMean(),
                stats.getPercentile(50),
                stats.getN() > 1 ? stats.getStandardDeviation() : 0.0,
                stats.getMin(),
                stats.getMax());
    }

    private static Map<String, AnomalyRecord> index(List<AnomalyRecord> anomalies) {
        return anomalies.stream()
                .collect(Collectors.toMap(AnomalyRecord::id, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    }
}
