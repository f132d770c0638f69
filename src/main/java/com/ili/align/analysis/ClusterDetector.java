package com.ili.align.analysis;

import com.ili.align.dto.ClusteringResult;
import com.ili.align.exceptions.ValidationException;
import com.ili.align.models.AnomalyRecord;
import com.ili.align.models.InteractionZone;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Groups anomalies of one run into interaction zones with density-based clustering.
 * <p>
 * Each anomaly is embedded as {@code (distance / axialThreshold, cos θ / chord, sin θ / chord)}
 * where θ is its clock angle and {@code chord} the chord length at the clock threshold, so
 * a unit radius captures both the axial and circumferential proximity rules.
 * </p>
 */
@Slf4j
@Getter
public class ClusterDetector {
    public static final double DEFAULT_AXIAL_THRESHOLD_FT = 1.0;
    public static final double DEFAULT_CLOCK_THRESHOLD = 1.5;
    public static final int DEFAULT_MIN_CLUSTER_SIZE = 2;

    private static final double EPS = 1.0;
    private static final double MIN_CHORD = 1e-9;

    private final double axialThresholdFt;
    private final double clockThreshold;
    private final int minClusterSize;

    public ClusterDetector() {
        this(DEFAULT_AXIAL_THRESHOLD_FT, DEFAULT_CLOCK_THRESHOLD, DEFAULT_MIN_CLUSTER_SIZE);
    }

    public ClusterDetector(double axialThresholdFt, double clockThreshold, int minClusterSize) {
        if (axialThresholdFt <= 0) {
            throw new ValidationException("axialThresholdFt must be positive");
        }
        if (clockThreshold <= 0) {
            throw new ValidationException("clockThreshold must be positive");
        }
        if (minClusterSize < 2) {
            throw new ValidationException("minClusterSize must be >= 2");
        }
        this.axialThresholdFt = axialThresholdFt;
        this.clockThreshold = clockThreshold;
        this.minClusterSize = minClusterSize;
    }

    public ClusteringResult detect(List<AnomalyRecord> anomalies, String runId) {
        if (anomalies.size() < minClusterSize) {
            return new ClusteringResult(anomalies, List.of());
        }

        double chord = chordAtThreshold();
        List<EmbeddedAnomaly> points = new ArrayList<>(anomalies.size());
        for (int k = 0; k < anomalies.size(); k++) {
            points.add(new EmbeddedAnomaly(k, embed(anomalies.get(k), chord)));
        }

        // the clusterer does not count the point itself as its own neighbour
        DBSCANClusterer<EmbeddedAnomaly> clusterer = new DBSCANClusterer<>(EPS, minClusterSize - 1);
        List<Cluster<EmbeddedAnomaly>> clusters = clusterer.cluster(points);

        List<InteractionZone> zones = new ArrayList<>(clusters.size());
        Map<String, String> zoneByAnomaly = new HashMap<>();
        for (int label = 0; label < clusters.size(); label++) {
            List<AnomalyRecord> members = clusters.get(label).getPoints().stream()
                    .sorted(Comparator.comparingInt(EmbeddedAnomaly::index))
                    .map(p -> anomalies.get(p.index()))
                    .collect(Collectors.toList());
            InteractionZone zone = buildZone(String.format("ZONE_%s_%04d", runId, label), runId, members);
            zones.add(zone);
            members.forEach(m -> zoneByAnomaly.put(m.id(), zone.zoneId()));
        }

        List<AnomalyRecord> stamped = anomalies.stream()
                .map(a -> zoneByAnomaly.containsKey(a.id()) ? a.withClusterId(zoneByAnomaly.get(a.id())) : a)
                .collect(Collectors.toList());

        log.info("Run {}: {} interaction zones covering {} of {} anomalies",
                runId, zones.size(), zoneByAnomaly.size(), anomalies.size());
        return new ClusteringResult(stamped, zones);
    }

    double chordAtThreshold() {
        double angle = clockThreshold / 11.0 * Math.PI;
        double chord = angle < Math.PI ? 2.0 * Math.sin(angle) : 2.0;
        return Math.max(chord, MIN_CHORD);
    }

    private double[] embed(AnomalyRecord anomaly, double chord) {
        double theta = clockAngle(anomaly.clockPosition());
        return new double[]{
                anomaly.distance() / axialThresholdFt,
                Math.cos(theta) / chord,
                Math.sin(theta) / chord
        };
    }

    private static InteractionZone buildZone(String zoneId, String runId, List<AnomalyRecord> members) {
        List<Double> clocks = members.stream().map(AnomalyRecord::clockPosition).collect(Collectors.toList());
        double minDistance = members.stream().mapToDouble(AnomalyRecord::distance).min().orElse(0.0);
        double maxDistance = members.stream().mapToDouble(AnomalyRecord::distance).max().orElse(0.0);

        return InteractionZone.builder()
                .zoneId(zoneId)
                .runId(runId)
                .anomalyIds(members.stream().map(AnomalyRecord::id).collect(Collectors.toList()))
                .anomalyCount(members.size())
                .centroidDistance(members.stream().mapToDouble(AnomalyRecord::distance).average().orElse(0.0))
                .centroidClock(Math.round(circularMeanClock(clocks) * 100.0) / 100.0)
                .spanDistanceFt(maxDistance - minDistance)
                .spanClock(circularSpanClock(clocks))
                .maxDepthPct(members.stream().mapToDouble(AnomalyRecord::depthPct).max().orElse(0.0))
                .combinedLengthIn(members.stream().mapToDouble(AnomalyRecord::length).sum())
                .build();
    }

    static double clockAngle(double clock) {
        return (clock - 1.0) / 11.0 * 2.0 * Math.PI;
    }

    static double circularMeanClock(List<Double> clocks) {
        double sin = 0.0;
        double cos = 0.0;
        for (double clock : clocks) {
            sin += Math.sin(clockAngle(clock));
            cos += Math.cos(clockAngle(clock));
        }
        double angle = Math.atan2(sin / clocks.size(), cos / clocks.size());
        if (angle < 0) {
            angle += 2.0 * Math.PI;
        }
        return angle / (2.0 * Math.PI) * 11.0 + 1.0;
    }

    /**
     * Smallest arc, in clock hours, containing every position.
     */
    static double circularSpanClock(List<Double> clocks) {
        if (clocks.size() <= 1) {
            return 0.0;
        }
        List<Double> sorted = clocks.stream().sorted().collect(Collectors.toList());
        double maxGap = (12.0 - sorted.get(sorted.size() - 1)) + (sorted.get(0) - 1.0) + 1.0;
        for (int k = 0; k < sorted.size() - 1; k++) {
            maxGap = Math.max(maxGap, sorted.get(k + 1) - sorted.get(k));
        }
        return Math.max(11.0 - maxGap, 0.0);
    }

    // Identity equality keeps anomalies with identical coordinates distinct inside the clusterer.
    private static final class EmbeddedAnomaly implements Clusterable {
        private final int index;
        private final double[] point;

        private EmbeddedAnomaly(int index, double[] point) {
            this.index = index;
            this.point = point;
        }

        int index() {
            return index;
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }
}
