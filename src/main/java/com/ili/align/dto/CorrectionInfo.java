package com.ili.align.dto;

import lombok.Builder;

@Builder
public record CorrectionInfo(
        int numReferencePoints,
        double minSourceDistance,
        double maxSourceDistance,
        double minTargetDistance,
        double maxTargetDistance,
        String interpolationMethod,
        double maxCorrection,
        double meanCorrection,
        double stdCorrection) {}
