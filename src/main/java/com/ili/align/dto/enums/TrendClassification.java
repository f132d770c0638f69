package com.ili.align.dto.enums;

public enum TrendClassification {
    ACCELERATING,
    STABLE,
    DECELERATING
}
