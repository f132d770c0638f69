package com.ili.align.dto;

import com.ili.align.models.AnomalyRecord;

import java.util.List;

/**
 * Anomalies left without a partner: {@code newAnomalies} come from the newer run,
 * {@code repairedOrRemoved} from the older one.
 */
public record UnmatchedAnomalies(List<AnomalyRecord> newAnomalies, List<AnomalyRecord> repairedOrRemoved) {

    public UnmatchedAnomalies {
        newAnomalies = List.copyOf(newAnomalies);
        repairedOrRemoved = List.copyOf(repairedOrRemoved);
    }
}
