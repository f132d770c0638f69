package com.ili.align.alignment;

import com.ili.align.dto.CorrectionInfo;
import com.ili.align.exceptions.ValidationException;
import com.ili.align.models.AnomalyRecord;
import com.ili.align.models.CorrectionParams;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ili.align.TestFixtures.anomaly;
import static org.assertj.core.api.Assertions.*;

@DisplayName("DistanceCorrectionFunction Tests")
class DistanceCorrectionFunctionTest {

    private static DistanceCorrectionFunction function(double[] source, double[] target) {
        return new DistanceCorrectionFunction(new CorrectionParams(source, target));
    }

    @Nested
    @DisplayName("Interpolation")
    class Interpolation {

        private final DistanceCorrectionFunction corrector =
                function(new double[]{0, 500, 1000}, new double[]{0, 520, 980});

        @Test
        @DisplayName("Interpolates linearly between anchored points")
        void interpolates() {
            assertThat(corrector.correct(250.0)).isCloseTo(260.0, within(1e-9));
            assertThat(corrector.correct(750.0)).isCloseTo(750.0, within(1e-9));
            assertThat(corrector.isExtrapolating(250.0)).isFalse();
        }

        @Test
        @DisplayName("Extends the end segment beyond the anchored range")
        void extrapolates() {
            assertThat(corrector.isExtrapolating(1500.0)).isTrue();
            assertThat(corrector.correct(1500.0)).isCloseTo(1440.0, within(1e-9));
        }

        @Test
        @DisplayName("Array and scalar correction agree")
        void arrayMatchesScalar() {
            double[] input = {100.0, 250.0, 999.0, 1200.0};
            double[] corrected = corrector.correct(input);

            for (int k = 0; k < input.length; k++) {
                assertThat(corrected[k]).isEqualTo(corrector.correct(input[k]));
            }
        }
    }

    @Test
    @DisplayName("Constant offset is reproduced exactly at and beyond the anchors")
    void constantOffset() {
        DistanceCorrectionFunction corrector =
                function(new double[]{300, 100, 200}, new double[]{305, 105, 205});

        assertThat(corrector.correct(100.0)).isCloseTo(105.0, within(1e-9));
        assertThat(corrector.correct(200.0)).isCloseTo(205.0, within(1e-9));
        assertThat(corrector.correct(300.0)).isCloseTo(305.0, within(1e-9));
        assertThat(corrector.correct(150.0)).isCloseTo(155.0, within(1e-9));
        assertThat(corrector.correct(50.0)).isCloseTo(55.0, within(1e-9));
        assertThat(corrector.correct(400.0)).isCloseTo(405.0, within(1e-9));
    }

    @Test
    @DisplayName("Corrected anomalies differ only in distance")
    void correctsAnomalies() {
        DistanceCorrectionFunction corrector = function(new double[]{0, 500, 1000}, new double[]{0, 520, 980});
        AnomalyRecord original = anomaly("A1", "RUN_2007", 250.0, 3.0, 40.0);

        List<AnomalyRecord> corrected = corrector.correctAnomalies(List.of(original));

        assertThat(corrected).hasSize(1);
        assertThat(corrected.get(0).distance()).isCloseTo(260.0, within(1e-9));
        assertThat(corrected.get(0).withDistance(250.0)).isEqualTo(original);
        assertThat(original.distance()).isEqualTo(250.0);
    }

    @Test
    @DisplayName("Corrections landing before the line start are clamped to zero")
    void clampsNegative() {
        DistanceCorrectionFunction corrector = function(new double[]{100, 200}, new double[]{0, 100});

        List<AnomalyRecord> corrected = corrector.correctAnomalies(List.of(anomaly("A1", "R", 50.0, 3.0, 10.0)));

        assertThat(corrector.correct(50.0)).isCloseTo(-50.0, within(1e-9));
        assertThat(corrected.get(0).distance()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Correction info summarises the anchor shifts")
    void correctionInfo() {
        CorrectionInfo info = function(new double[]{0, 500, 1000}, new double[]{0, 520, 980}).getCorrectionInfo();

        assertThat(info.numReferencePoints()).isEqualTo(3);
        assertThat(info.minSourceDistance()).isEqualTo(0.0);
        assertThat(info.maxSourceDistance()).isEqualTo(1000.0);
        assertThat(info.maxTargetDistance()).isEqualTo(980.0);
        assertThat(info.interpolationMethod()).isEqualTo("linear");
        assertThat(info.maxCorrection()).isEqualTo(20.0);
        assertThat(info.meanCorrection()).isCloseTo(0.0, within(1e-9));
        assertThat(info.stdCorrection()).isCloseTo(Math.sqrt(800.0 / 3.0), within(1e-9));
    }

    @Test
    @DisplayName("Largest correction is taken by magnitude when every anchor moves backwards")
    void correctionInfoNegativeShift() {
        CorrectionInfo info = function(new double[]{0, 1000, 2000}, new double[]{10, 980, 1990}).getCorrectionInfo();

        assertThat(info.minTargetDistance()).isEqualTo(10.0);
        assertThat(info.maxTargetDistance()).isEqualTo(1990.0);
        assertThat(info.maxCorrection()).isEqualTo(20.0);
        assertThat(info.meanCorrection()).isCloseTo(-20.0 / 3.0, within(1e-9));
        assertThat(info.stdCorrection()).isCloseTo(Math.sqrt(1400.0 / 9.0), within(1e-9));
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Rejects a single anchor")
        void singlePoint() {
            assertThatThrownBy(() -> function(new double[]{100}, new double[]{105}))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("at least 2");
        }

        @Test
        @DisplayName("Rejects mismatched arrays")
        void mismatched() {
            assertThatThrownBy(() -> function(new double[]{100, 200}, new double[]{105}))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("same length");
        }

        @Test
        @DisplayName("Rejects empty arrays")
        void empty() {
            assertThatThrownBy(() -> function(new double[0], new double[0]))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Rejects unsupported interpolation methods")
        void unsupportedMethod() {
            CorrectionParams params = new CorrectionParams(new double[]{0, 100}, new double[]{0, 100}, "cubic");

            assertThatThrownBy(() -> new DistanceCorrectionFunction(params))
                    .isInstanceOf(ValidationException.class);
        }
    }
}
