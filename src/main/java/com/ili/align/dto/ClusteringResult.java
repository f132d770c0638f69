package com.ili.align.dto;

import com.ili.align.models.AnomalyRecord;
import com.ili.align.models.InteractionZone;

import java.util.List;

public record ClusteringResult(List<AnomalyRecord> anomalies, List<InteractionZone> zones) {

    public ClusteringResult {
        anomalies = List.copyOf(anomalies);
        zones = List.copyOf(zones);
    }

    public long clusteredCount() {
        return anomalies.stream().filter(AnomalyRecord::isClustered).count();
    }
}
