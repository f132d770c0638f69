package com.ili.align.dto;

import lombok.Builder;

import java.util.List;

@Builder
public record AlignmentValidation(
        boolean valid,
        double matchRate,
        boolean matchRatePassed,
        double rmse,
        boolean rmsePassed,
        List<UnmatchedReferencePoint> unmatchedRun1,
        List<UnmatchedReferencePoint> unmatchedRun2,
        List<String> warnings,
        double meanDistanceError,
        double maxDistanceError,
        double stdDistanceError,
        double dtwDistance) {}
