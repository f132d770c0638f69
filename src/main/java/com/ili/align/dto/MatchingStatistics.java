package com.ili.align.dto;

import lombok.Builder;

@Builder
public record MatchingStatistics(
        int totalRun1,
        int totalRun2,
        int matched,
        int unmatchedRun1,
        int unmatchedRun2,
        double matchRate,
        int highConfidence,
        int mediumConfidence,
        int lowConfidence) {}
