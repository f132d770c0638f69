package com.ili.align.growth;

import com.ili.align.dto.GrowthAnalysisResult;
import com.ili.align.dto.GrowthStatistics;
import com.ili.align.dto.enums.FeatureType;
import com.ili.align.exceptions.ValidationException;
import com.ili.align.models.AnomalyRecord;
import com.ili.align.models.GrowthMetrics;
import com.ili.align.models.Match;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.ili.align.TestFixtures.anomaly;
import static com.ili.align.TestFixtures.match;
import static org.assertj.core.api.Assertions.*;

@DisplayName("GrowthAnalyzer Tests")
class GrowthAnalyzerTest {

    private final GrowthAnalyzer analyzer = new GrowthAnalyzer();

    @Nested
    @DisplayName("Growth rate")
    class Rate {

        @Test
        @DisplayName("Rate is the signed change per year")
        void signedRate() {
            assertThat(GrowthAnalyzer.growthRate(40.0, 50.0, 2.0)).isEqualTo(5.0);
            assertThat(GrowthAnalyzer.growthRate(50.0, 40.0, 2.0)).isEqualTo(-5.0);
        }

        @Test
        @DisplayName("Non-positive intervals are rejected")
        void nonPositiveInterval() {
            assertThatThrownBy(() -> GrowthAnalyzer.growthRate(40.0, 50.0, 0.0))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> analyzer.analyze(List.of(), List.of(), List.of(), -1.0))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Rapid growth is strictly above the threshold")
        void rapidThreshold() {
            AnomalyRecord older = anomaly("A1", "RUN_2007", 100.0, 3.0, 40.0);

            GrowthMetrics atThreshold = analyzer.measure(match("A1", "B1", 0.9), older,
                    anomaly("B1", "RUN_2015", 100.0, 3.0, 50.0), 2.0);
            GrowthMetrics above = analyzer.measure(match("A1", "B2", 0.9), older,
                    anomaly("B2", "RUN_2015", 100.0, 3.0, 52.0), 2.0);

            assertThat(atThreshold.rapidGrowth()).isFalse();
            assertThat(above.rapidGrowth()).isTrue();
            assertThat(above.depthGrowthRate()).isEqualTo(6.0);
            assertThat(above.lengthGrowthRate()).isEqualTo(0.0);
        }
    }

    @Test
    @DisplayName("Analysis skips matches whose anomalies are missing")
    void analyze() {
        List<AnomalyRecord> run1 = List.of(
                anomaly("A1", "RUN_2007", 100.0, 3.0, 20.0),
                anomaly("A2", "RUN_2007", 200.0, 3.0, 30.0));
        List<AnomalyRecord> run2 = List.of(
                anomaly("B1", "RUN_2015", 100.0, 3.0, 28.0),
                anomaly("B2", "RUN_2015", 200.0, 3.0, 80.0));
        List<Match> matches = List.of(
                match("A1", "B1", 0.9),
                match("A2", "B2", 0.9),
                match("A3", "B3", 0.9));

        GrowthAnalysisResult result = analyzer.analyze(matches, run1, run2, 8.0);

        assertThat(result.growthMetrics()).hasSize(2);
        assertThat(result.growthMetrics().get(0).depthGrowthRate()).isEqualTo(1.0);
        assertThat(result.rapidGrowthAnomalies()).hasSize(1);
        assertThat(result.rapidGrowthAnomalies().get(0).anomalyId()).isEqualTo("B2");
        assertThat(result.rapidGrowthAnomalies().get(0).depthGrowthRate()).isEqualTo(6.25);
        assertThat(result.statistics().rapidGrowthPercentage()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Statistics use the sample standard deviation and the median")
    void statistics() {
        List<GrowthMetrics> metrics = List.of(metrics("M1", 1.0), metrics("M2", 2.0), metrics("M3", 3.0),
                metrics("M4", 10.0));

        GrowthStatistics stats = analyzer.statistics(metrics);

        assertThat(stats.totalMatches()).isEqualTo(4);
        assertThat(stats.rapidGrowthCount()).isEqualTo(1);
        assertThat(stats.depthGrowth().mean()).isEqualTo(4.0);
        assertThat(stats.depthGrowth().median()).isEqualTo(2.5);
        assertThat(stats.depthGrowth().stdDev()).isCloseTo(Math.sqrt(50.0 / 3.0), within(1e-9));
        assertThat(stats.depthGrowth().min()).isEqualTo(1.0);
        assertThat(stats.depthGrowth().max()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Empty input gives empty statistics")
    void emptyStatistics() {
        GrowthStatistics stats = analyzer.statistics(List.of());

        assertThat(stats.totalMatches()).isZero();
        assertThat(stats.depthGrowth().mean()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Statistics are grouped by the newer anomaly's feature type")
    void byFeatureType() {
        List<AnomalyRecord> run2 = List.of(
                anomaly("B1", "RUN_2015", 100.0, 3.0, 28.0, FeatureType.EXTERNAL_CORROSION),
                anomaly("B2", "RUN_2015", 200.0, 3.0, 80.0, FeatureType.DENT));
        List<GrowthMetrics> metrics = List.of(
                new GrowthMetrics("A1_B1", "A1", "B1", 8.0, 1.0, 0.0, 0.0, false, 0.0),
                new GrowthMetrics("A2_B2", "A2", "B2", 8.0, 6.0, 0.0, 0.0, true, 0.0),
                new GrowthMetrics("A3_B3", "A3", "B3", 8.0, 2.0, 0.0, 0.0, false, 0.0));

        Map<FeatureType, GrowthStatistics> grouped = analyzer.growthByFeatureType(metrics, run2);

        assertThat(grouped).containsOnlyKeys(FeatureType.EXTERNAL_CORROSION, FeatureType.DENT);
        assertThat(grouped.get(FeatureType.DENT).rapidGrowthCount()).isEqualTo(1);
        assertThat(grouped.get(FeatureType.EXTERNAL_CORROSION).depthGrowth().mean()).isEqualTo(1.0);
    }

    private static GrowthMetrics metrics(String id, double depthRate) {
        return new GrowthMetrics(id, "A" + id, "B" + id, 1.0, depthRate, 0.0, 0.0, depthRate > 5.0, 0.0);
    }
}
