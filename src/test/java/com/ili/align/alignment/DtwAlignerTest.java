package com.ili.align.alignment;

import com.ili.align.dto.DtwPath;
import com.ili.align.dto.MatchedPair;
import com.ili.align.exceptions.AlignmentQualityException;
import com.ili.align.exceptions.ValidationException;
import com.ili.align.models.AlignmentResult;
import com.ili.align.models.ReferencePoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ili.align.TestFixtures.welds;
import static org.assertj.core.api.Assertions.*;

@DisplayName("DtwAligner Tests")
class DtwAlignerTest {

    private final DtwAligner aligner = new DtwAligner();

    @Nested
    @DisplayName("Accepted alignments")
    class AcceptedAlignments {

        @Test
        @DisplayName("Identical sequences align one-to-one with zero error")
        void identicalSequences() {
            List<ReferencePoint> run1 = welds("RUN_2007", 0, 100, 200, 300);
            List<ReferencePoint> run2 = welds("RUN_2015", 0, 100, 200, 300);

            AlignmentResult result = aligner.align(run1, run2, "RUN_2007", "RUN_2015");

            assertThat(result.matchRate()).isEqualTo(100.0);
            assertThat(result.rmse()).isEqualTo(0.0);
            assertThat(result.matchedPoints()).hasSize(4);
            assertThat(result.matchedPoints().get(2).getLeft()).isEqualTo("RUN_2007_GW2");
            assertThat(result.matchedPoints().get(2).getRight()).isEqualTo("RUN_2015_GW2");
            assertThat(result.correctionFunctionParams().sourceDistances()).containsExactly(0, 100, 200, 300);
        }

        @Test
        @DisplayName("Small drift stays within the quality gate")
        void smallDrift() {
            List<ReferencePoint> run1 = welds("RUN_2007", 0, 1000, 2000, 3000, 4000);
            List<ReferencePoint> run2 = welds("RUN_2015", 0, 1003, 2006, 3009, 4012);

            AlignmentResult result = aligner.align(run1, run2, "RUN_2007", "RUN_2015");

            assertThat(result.matchRate()).isEqualTo(100.0);
            assertThat(result.rmse()).isCloseTo(Math.sqrt(54.0), within(1e-9));
            assertThat(result.correctionFunctionParams().targetDistances()).containsExactly(0, 1003, 2006, 3009, 4012);
        }
    }

    @Nested
    @DisplayName("Raw path computation")
    class RawPath {

        @Test
        @DisplayName("Reports match rate and RMSE before the quality gate")
        void rawMetrics() {
            List<ReferencePoint> run1 = welds("A", 0, 500, 1000);
            List<ReferencePoint> run2 = welds("B", 0, 520, 980);

            DtwPath path = aligner.computeAlignment(run1, run2, "A", "B");

            assertThat(path.pairs()).extracting(MatchedPair::index1).containsExactly(0, 1, 2);
            assertThat(path.pairs()).extracting(MatchedPair::index2).containsExactly(0, 1, 2);
            assertThat(path.matchRate()).isEqualTo(100.0);
            assertThat(path.rmse()).isCloseTo(Math.sqrt(800.0 / 3.0), within(1e-9));
            assertThat(path.dtwDistance()).isEqualTo(40.0);
        }

        @Test
        @DisplayName("RMSE above 10 ft is rejected with the offending metrics")
        void rejectsHighRmse() {
            List<ReferencePoint> run1 = welds("A", 0, 500, 1000);
            List<ReferencePoint> run2 = welds("B", 0, 520, 980);

            assertThatThrownBy(() -> aligner.align(run1, run2, "A", "B"))
                    .isInstanceOf(AlignmentQualityException.class)
                    .satisfies(e -> {
                        AlignmentQualityException aqe = (AlignmentQualityException) e;
                        assertThat(aqe.getMatchRate()).isEqualTo(100.0);
                        assertThat(aqe.getRmse()).isCloseTo(16.33, within(0.01));
                    });
        }

        @Test
        @DisplayName("Equal-cost steps prefer the diagonal")
        void tiesPreferDiagonal() {
            List<ReferencePoint> run1 = welds("A", 100, 100, 200);
            List<ReferencePoint> run2 = welds("B", 100, 100, 200);

            DtwPath path = aligner.computeAlignment(run1, run2, "A", "B");

            assertThat(path.pairs()).extracting(MatchedPair::index1).containsExactly(0, 1, 2);
            assertThat(path.pairs()).extracting(MatchedPair::index2).containsExactly(0, 1, 2);
            assertThat(path.dtwDistance()).isZero();
        }

        @Test
        @DisplayName("Pairs outside the drift window cost infinity")
        void driftWindow() {
            double[][] matrix = aligner.distanceMatrix(new double[]{1000}, new double[]{1050, 1200});

            assertThat(matrix[0][0]).isEqualTo(50.0);
            assertThat(matrix[0][1]).isInfinite();
        }
    }

    @Test
    @DisplayName("A per-call drift constraint overrides the configured one for that call only")
    void perCallDriftConstraint() {
        List<ReferencePoint> run1 = welds("A", 0, 1000, 2000, 3000, 4000);
        List<ReferencePoint> run2 = welds("B", 0, 1003, 2006, 3009, 4012);

        DtwPath tight = aligner.computeAlignment(run1, run2, "A", "B", 0.001);
        DtwPath configured = aligner.computeAlignment(run1, run2, "A", "B");
        AlignmentResult wide = aligner.align(run1, run2, "A", "B", 0.2);

        assertThat(tight.dtwDistance()).isInfinite();
        assertThat(configured.dtwDistance()).isEqualTo(30.0);
        assertThat(wide.rmse()).isCloseTo(Math.sqrt(54.0), within(1e-9));
        assertThat(aligner.getDriftConstraint()).isEqualTo(DtwAligner.DEFAULT_DRIFT_CONSTRAINT);
        assertThatThrownBy(() -> aligner.align(run1, run2, "A", "B", 0.0)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Empty sequences are a validation error")
    void emptySequence() {
        assertThatThrownBy(() -> aligner.computeAlignment(List.of(), welds("B", 0, 100), "A", "B"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Drift constraint must be positive")
    void driftConstraintValidated() {
        assertThatThrownBy(() -> new DtwAligner(0.0)).isInstanceOf(ValidationException.class);
        assertThat(aligner.getDriftConstraint()).isEqualTo(DtwAligner.DEFAULT_DRIFT_CONSTRAINT);
    }
}
