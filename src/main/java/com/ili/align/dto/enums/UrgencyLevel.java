package com.ili.align.dto.enums;

public enum UrgencyLevel {
    IMMEDIATE,
    NEAR_TERM,
    SCHEDULED,
    MONITOR
}
