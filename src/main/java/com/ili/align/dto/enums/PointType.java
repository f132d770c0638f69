package com.ili.align.dto.enums;

public enum PointType {
    GIRTH_WELD,
    VALVE,
    TEE,
    OTHER
}
