package com.ili.align.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.ili.align.alignment.AlignmentValidator;
import com.ili.align.alignment.DtwAligner;
import com.ili.align.analysis.ChainExplainer;
import com.ili.align.analysis.ClusterDetector;
import com.ili.align.analysis.ThreeWayAnalyzer;
import com.ili.align.growth.GrowthAnalyzer;
import com.ili.align.growth.RiskScorer;
import com.ili.align.matcher.HungarianMatcher;
import com.ili.align.matcher.SimilarityCalculator;
import com.ili.align.matcher.strategies.MatchingStrategy;
import com.ili.align.metrics.AnalysisMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;


@Configuration
@Slf4j
public class Beans {

    @Bean(name = "similarityExecutor", destroyMethod = "shutdown")
    public ExecutorService similarityExecutor(@Value("${ili.matching.threads:0}") int configuredThreads,
                                              MeterRegistry meterRegistry) {
        int threads = configuredThreads > 0 ? configuredThreads : Runtime.getRuntime().availableProcessors();
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("similarity-band-%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler((t, e) -> log.error("Uncaught error in {}", t.getName(), e))
                .build();

        return new ThreadPoolExecutor(
                threads, threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        meterRegistry.counter("ili_similarity_executor_rejections").increment();
                        log.warn("similarity band rejected: queue size={}", e.getQueue().size());
                        super.rejectedExecution(r, e);
                    }
                }
        );
    }

    @Bean
    public SimilarityCalculator similarityCalculator(
            @Value("${ili.similarity.distance-sigma:5.0}") double distanceSigma,
            @Value("${ili.similarity.clock-sigma:1.0}") double clockSigma,
            @Value("${ili.similarity.dimension-sigma:#{null}}") Double dimensionSigma) {
        return new SimilarityCalculator(SimilarityConfig.builder()
                .distanceSigma(distanceSigma)
                .clockSigma(clockSigma)
                .dimensionSigma(dimensionSigma)
                .build());
    }

    @Bean
    public HungarianMatcher hungarianMatcher(
            SimilarityCalculator similarityCalculator,
            List<MatchingStrategy> strategies,
            @Qualifier("similarityExecutor") ExecutorService executor,
            @Value("${ili.matching.mode:HUNGARIAN}") String mode,
            @Value("${ili.matching.confidence-threshold:0.6}") double confidenceThreshold,
            @Value("${ili.matching.band-size:64}") int bandSize) {
        MatchingStrategy strategy = strategies.stream()
                .filter(s -> s.supports(mode))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No matching strategy supports mode " + mode));
        return new HungarianMatcher(similarityCalculator, strategy, executor, confidenceThreshold, bandSize);
    }

    @Bean
    public DtwAligner dtwAligner(@Value("${ili.alignment.drift-constraint:0.10}") double driftConstraint) {
        return new DtwAligner(driftConstraint);
    }

    @Bean
    public AlignmentValidator alignmentValidator() {
        return new AlignmentValidator();
    }

    @Bean
    public ClusterDetector clusterDetector(
            @Value("${ili.clustering.axial-threshold-ft:1.0}") double axialThresholdFt,
            @Value("${ili.clustering.clock-threshold:1.5}") double clockThreshold,
            @Value("${ili.clustering.min-cluster-size:2}") int minClusterSize) {
        return new ClusterDetector(axialThresholdFt, clockThreshold, minClusterSize);
    }

    @Bean
    public GrowthAnalyzer growthAnalyzer(@Value("${ili.growth.rapid-growth-threshold:5.0}") double threshold) {
        return new GrowthAnalyzer(threshold);
    }

    @Bean
    public RiskScorer riskScorer(
            @Value("${ili.risk.depth-weight:0.6}") double depthWeight,
            @Value("${ili.risk.growth-weight:0.3}") double growthWeight,
            @Value("${ili.risk.location-weight:0.1}") double locationWeight,
            @Value("${ili.risk.cluster-boost:0.1}") double clusterBoost) {
        return new RiskScorer(depthWeight, growthWeight, locationWeight, clusterBoost);
    }

    @Bean
    public ChainExplainer chainExplainer() {
        return new ChainExplainer();
    }

    @Bean
    public AnalysisMetrics analysisMetrics(MeterRegistry meterRegistry) {
        return new AnalysisMetrics(meterRegistry);
    }

    @Bean
    public ThreeWayAnalyzer threeWayAnalyzer(
            ClusterDetector clusterDetector,
            DtwAligner dtwAligner,
            AlignmentValidator alignmentValidator,
            HungarianMatcher hungarianMatcher,
            GrowthAnalyzer growthAnalyzer,
            RiskScorer riskScorer,
            ChainExplainer chainExplainer,
            AnalysisMetrics analysisMetrics,
            @Value("${ili.analysis.explain-enabled:true}") boolean explainEnabled,
            @Value("${ili.analysis.top-n-explain:10}") int topNExplain,
            @Value("${ili.analysis.top-n-risk:20}") int topNRisk) {
        AnalysisConfig config = AnalysisConfig.builder()
                .explainEnabled(explainEnabled)
                .topNExplain(topNExplain)
                .topNRisk(topNRisk)
                .build();
        return new ThreeWayAnalyzer(clusterDetector, dtwAligner, alignmentValidator, hungarianMatcher,
                growthAnalyzer, riskScorer, chainExplainer, analysisMetrics, config);
    }
}
