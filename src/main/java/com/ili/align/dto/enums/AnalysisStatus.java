package com.ili.align.dto.enums;

public enum AnalysisStatus {
    RUNNING,
    COMPLETE,
    FAILED
}
