package com.ili.align.matcher;

import com.google.common.collect.Lists;
import com.ili.align.dto.MatchingResult;
import com.ili.align.dto.MatchingStatistics;
import com.ili.align.dto.SimilarityBreakdown;
import com.ili.align.dto.UnmatchedAnomalies;
import com.ili.align.dto.enums.MatchConfidence;
import com.ili.align.matcher.strategies.MatchingStrategy;
import com.ili.align.models.AnomalyRecord;
import com.ili.align.models.Match;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.ili.align.validation.ModelValidationUtility.requireInRange;
import static com.ili.align.validation.ModelValidationUtility.requireNonNull;

/**
 * Optimal one-to-one matching of anomalies between an older and a newer run.
 * <p>
 * Similarity rows are filled in bands on the supplied executor; the assignment itself is
 * delegated to a {@link MatchingStrategy} over {@code 1 - similarity} costs. Assigned pairs
 * scoring below {@code confidenceThreshold} are discarded and both sides count as unmatched.
 * </p>
 */
@Slf4j
@Getter
public class HungarianMatcher {
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.6;
    public static final int DEFAULT_BAND_SIZE = 64;

    private final SimilarityCalculator similarityCalculator;
    private final MatchingStrategy matchingStrategy;
    private final Executor executor;
    private final double confidenceThreshold;
    private final int bandSize;

    public HungarianMatcher(SimilarityCalculator similarityCalculator, MatchingStrategy matchingStrategy,
                            Executor executor) {
        this(similarityCalculator, matchingStrategy, executor, DEFAULT_CONFIDENCE_THRESHOLD, DEFAULT_BAND_SIZE);
    }

    public HungarianMatcher(SimilarityCalculator similarityCalculator, MatchingStrategy matchingStrategy,
                            Executor executor, double confidenceThreshold, int bandSize) {
        this.similarityCalculator = requireNonNull(similarityCalculator, "similarityCalculator");
        this.matchingStrategy = requireNonNull(matchingStrategy, "matchingStrategy");
        this.executor = requireNonNull(executor, "executor");
        this.confidenceThreshold = requireInRange(confidenceThreshold, 0.0, 1.0, "confidenceThreshold");
        this.bandSize = Math.max(1, bandSize);
    }

    public MatchingResult match(List<AnomalyRecord> run1, List<AnomalyRecord> run2) {
        if (run1.isEmpty() || run2.isEmpty()) {
            log.info("Nothing to match: run1={} anomalies, run2={} anomalies", run1.size(), run2.size());
            return new MatchingResult(List.of(), new UnmatchedAnomalies(run2, run1),
                    statistics(run1.size(), run2.size(), List.of()));
        }

        SimilarityBreakdown[][] similarity = similarityMatrix(run1, run2);
        double[][] cost = new double[run1.size()][run2.size()];
        for (int i = 0; i < run1.size(); i++) {
            for (int j = 0; j < run2.size(); j++) {
                cost[i][j] = 1.0 - similarity[i][j].overall();
            }
        }

        int[] assignment = matchingStrategy.assign(cost);

        List<Match> matches = new ArrayList<>();
        Set<String> matched1 = new HashSet<>();
        Set<String> matched2 = new HashSet<>();
        int discarded = 0;
        for (int i = 0; i < assignment.length; i++) {
            int j = assignment[i];
            if (j < 0) {
                continue;
            }
            SimilarityBreakdown breakdown = similarity[i][j];
            if (breakdown.overall() < confidenceThreshold) {
                discarded++;
                continue;
            }
            AnomalyRecord a1 = run1.get(i);
            AnomalyRecord a2 = run2.get(j);
            matches.add(Match.of(a1.id(), a2.id(), breakdown));
            matched1.add(a1.id());
            matched2.add(a2.id());
        }

        List<AnomalyRecord> newAnomalies = run2.stream()
                .filter(a -> !matched2.contains(a.id()))
                .collect(Collectors.toList());
        List<AnomalyRecord> repairedOrRemoved = run1.stream()
                .filter(a -> !matched1.contains(a.id()))
                .collect(Collectors.toList());

        log.info("Matched {} of {}x{} anomalies ({} assignments below threshold {})",
                matches.size(), run1.size(), run2.size(), discarded, confidenceThreshold);
        return new MatchingResult(matches, new UnmatchedAnomalies(newAnomalies, repairedOrRemoved),
                statistics(run1.size(), run2.size(), matches));
    }

    SimilarityBreakdown[][] similarityMatrix(List<AnomalyRecord> run1, List<AnomalyRecord> run2) {
        SimilarityBreakdown[][] matrix = new SimilarityBreakdown[run1.size()][run2.size()];
        List<Integer> rows = IntStream.range(0, run1.size()).boxed().collect(Collectors.toList());

        List<CompletableFuture<Void>> bands = Lists.partition(rows, bandSize).stream()
                .map(band -> CompletableFuture.runAsync(() -> {
                    for (int i : band) {
                        AnomalyRecord a1 = run1.get(i);
                        for (int j = 0; j < run2.size(); j++) {
                            matrix[i][j] = similarityCalculator.calculate(a1, run2.get(j));
                        }
                    }
                }, executor))
                .collect(Collectors.toList());

        try {
            CompletableFuture.allOf(bands.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        return matrix;
    }

    private static MatchingStatistics statistics(int total1, int total2, List<Match> matches) {
        int smaller = Math.min(total1, total2);
        return MatchingStatistics.builder()
                .totalRun1(total1)
                .totalRun2(total2)
                .matched(matches.size())
                .unmatchedRun1(total1 - matches.size())
                .unmatchedRun2(total2 - matches.size())
                .matchRate(smaller > 0 ? (double) matches.size() / smaller : 0.0)
                .highConfidence(countByConfidence(matches, MatchConfidence.HIGH))
                .mediumConfidence(countByConfidence(matches, MatchConfidence.MEDIUM))
                .lowConfidence(countByConfidence(matches, MatchConfidence.LOW))
                .build();
    }

    private static int countByConfidence(List<Match> matches, MatchConfidence confidence) {
        return (int) matches.stream().filter(m -> m.confidence() == confidence).count();
    }
}
