package com.ili.align.models;

import com.ili.align.dto.SimilarityBreakdown;
import com.ili.align.dto.enums.MatchConfidence;

import static com.ili.align.validation.ModelValidationUtility.*;

/**
 * One-to-one pairing of an anomaly in the older run with an anomaly in the newer run.
 */
public record Match(
        String id,
        String anomaly1Id,
        String anomaly2Id,
        double similarityScore,
        MatchConfidence confidence,
        double distanceSimilarity,
        double clockSimilarity,
        double typeSimilarity,
        double depthSimilarity,
        double lengthSimilarity,
        double widthSimilarity) {

    public Match {
        requireId(id, "id");
        requireId(anomaly1Id, "anomaly1Id");
        requireId(anomaly2Id, "anomaly2Id");
        requireInRange(similarityScore, 0.0, 1.0, "similarityScore");
        requireNonNull(confidence, "confidence");
    }

    public static Match of(String anomaly1Id, String anomaly2Id, SimilarityBreakdown similarity) {
        return new Match(
                anomaly1Id + "_" + anomaly2Id,
                anomaly1Id,
                anomaly2Id,
                similarity.overall(),
                MatchConfidence.fromScore(similarity.overall()),
                similarity.distance(),
                similarity.clock(),
                similarity.type(),
                similarity.depth(),
                similarity.length(),
                similarity.width());
    }
}
