package com.ili.align.dto;

import com.ili.align.dto.enums.TrendClassification;
import com.ili.align.dto.enums.UrgencyLevel;
import lombok.Builder;

import java.util.List;

@Builder
public record ChainExplanation(
        String chainId,
        TrendClassification trendClassification,
        UrgencyLevel urgencyLevel,
        String lifecycleNarrative,
        String trendAnalysis,
        String projectionAnalysis,
        String recommendation,
        List<String> concerns) {

    public ChainExplanation {
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
    }
}
