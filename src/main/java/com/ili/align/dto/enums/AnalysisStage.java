package com.ili.align.dto.enums;

public enum AnalysisStage {
    LOAD,
    CLUSTER,
    EXTRACT_REF_POINTS,
    ALIGN_07_15,
    ALIGN_15_22,
    MATCH_07_15,
    MATCH_15_22,
    BUILD_CHAINS,
    GROWTH_AND_RISK,
    EXPLAIN,
    DONE
}
