package com.ili.align.metrics;

import com.ili.align.dto.MatchingStatistics;
import com.ili.align.dto.enums.AnalysisStage;
import com.ili.align.dto.enums.AnalysisStatus;
import com.ili.align.dto.enums.MatchConfidence;
import com.ili.align.utils.basic.Constant;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.TimeUnit;

public class AnalysisMetrics {
    private final MeterRegistry meterRegistry;
    private final DistributionSummary chainRiskSummary;

    public AnalysisMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.chainRiskSummary = DistributionSummary.builder("ili_chain_risk_score")
                .description("Composite risk score of three-run anomaly chains")
                .register(meterRegistry);
    }

    public void recordAlignment(String interval, boolean applied) {
        meterRegistry.counter("ili_alignment_total", Constant.INTERVAL, interval,
                Constant.OUTCOME, applied ? "applied" : "fallback").increment();
    }

    public void recordMatches(String interval, MatchingStatistics statistics) {
        meterRegistry.counter("ili_matches_total", Constant.INTERVAL, interval,
                Constant.CONFIDENCE, MatchConfidence.HIGH.name()).increment(statistics.highConfidence());
        meterRegistry.counter("ili_matches_total", Constant.INTERVAL, interval,
                Constant.CONFIDENCE, MatchConfidence.MEDIUM.name()).increment(statistics.mediumConfidence());
        meterRegistry.counter("ili_matches_total", Constant.INTERVAL, interval,
                Constant.CONFIDENCE, MatchConfidence.LOW.name()).increment(statistics.lowConfidence());
    }

    public void recordMatchingDuration(long durationMs, String interval) {
        meterRegistry.timer("ili_matching_duration", Constant.INTERVAL, interval)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordChainRisk(double riskScore) {
        chainRiskSummary.record(riskScore);
    }

    public void incrementChainCount(long count) {
        meterRegistry.counter("ili_chains_total").increment(count);
    }

    public void recordAnalysisDuration(long durationMs, AnalysisStatus status) {
        meterRegistry.timer("ili_analysis_duration", Constant.STATUS, status.name())
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordAnalysisFailure(AnalysisStage stage) {
        meterRegistry.counter("ili_analysis_failures", Constant.STAGE, stage.name()).increment();
    }
}
