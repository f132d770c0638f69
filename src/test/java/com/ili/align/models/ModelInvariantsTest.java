package com.ili.align.models;

import com.ili.align.dto.SimilarityBreakdown;
import com.ili.align.dto.enums.MatchConfidence;
import com.ili.align.exceptions.AlignmentQualityException;
import com.ili.align.exceptions.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ili.align.TestFixtures.anomaly;
import static org.assertj.core.api.Assertions.*;

@DisplayName("Model invariant Tests")
class ModelInvariantsTest {

    @Nested
    @DisplayName("AnomalyRecord")
    class Anomalies {

        @Test
        @DisplayName("Clock positions outside 1-12 are rejected")
        void clockRange() {
            assertThatThrownBy(() -> anomaly("A1", "R", 100.0, 0.5, 10.0))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("clockPosition");
            assertThatThrownBy(() -> anomaly("A1", "R", 100.0, 12.5, 10.0))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Depth above 100% and negative distance are rejected")
        void depthAndDistance() {
            assertThatThrownBy(() -> anomaly("A1", "R", 100.0, 3.0, 101.0)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> anomaly("A1", "R", -1.0, 3.0, 10.0)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> anomaly(" ", "R", 1.0, 3.0, 10.0)).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Copies change one field only")
        void copies() {
            AnomalyRecord original = anomaly("A1", "R", 100.0, 3.0, 10.0);

            AnomalyRecord stamped = original.withClusterId("ZONE_R_0000");

            assertThat(original.isClustered()).isFalse();
            assertThat(stamped.isClustered()).isTrue();
            assertThat(stamped.withClusterId(null)).isEqualTo(original);
        }
    }

    @Nested
    @DisplayName("AlignmentResult")
    class Alignments {

        private final CorrectionParams params = new CorrectionParams(new double[]{0, 100}, new double[]{0, 101});

        @Test
        @DisplayName("Match rate below 95% fails the quality gate")
        void lowMatchRate() {
            assertThatThrownBy(() -> result(94.0, 1.0)).isInstanceOf(AlignmentQualityException.class);
        }

        @Test
        @DisplayName("RMSE above 10 ft fails the quality gate")
        void highRmse() {
            assertThatThrownBy(() -> result(100.0, 11.0))
                    .isInstanceOf(AlignmentQualityException.class)
                    .hasMessageContaining("RMSE");
        }

        @Test
        @DisplayName("Impossible metrics are validation errors")
        void outOfRange() {
            assertThatThrownBy(() -> result(101.0, 1.0)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> result(100.0, -1.0)).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Thresholds are inclusive")
        void boundaries() {
            assertThat(result(95.0, 10.0).matchRate()).isEqualTo(95.0);
        }

        private AlignmentResult result(double matchRate, double rmse) {
            return AlignmentResult.builder()
                    .run1Id("A")
                    .run2Id("B")
                    .matchedPoints(List.of())
                    .matchRate(matchRate)
                    .rmse(rmse)
                    .correctionFunctionParams(params)
                    .build();
        }
    }

    @Test
    @DisplayName("Match confidence bands")
    void matchConfidence() {
        assertThat(MatchConfidence.fromScore(0.8)).isEqualTo(MatchConfidence.HIGH);
        assertThat(MatchConfidence.fromScore(0.79)).isEqualTo(MatchConfidence.MEDIUM);
        assertThat(MatchConfidence.fromScore(0.6)).isEqualTo(MatchConfidence.MEDIUM);
        assertThat(MatchConfidence.fromScore(0.59)).isEqualTo(MatchConfidence.LOW);

        Match match = Match.of("A1", "B1", new SimilarityBreakdown(0.85, 0.9, 1.0, 1.0, 0.7, 0.8, 0.6));
        assertThat(match.id()).isEqualTo("A1_B1");
        assertThat(match.confidence()).isEqualTo(MatchConfidence.HIGH);
        assertThat(match.depthSimilarity()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("Chain risk must lie in [0, 1]")
    void chainRiskRange() {
        assertThatThrownBy(() -> AnomalyChain.builder()
                .chainId("CHAIN_0000")
                .anomaly2007Id("A")
                .anomaly2015Id("B")
                .anomaly2022Id("C")
                .riskScore(1.2)
                .build())
                .isInstanceOf(ValidationException.class);
    }
}
