package com.ili.align.dto.enums;

public enum FeatureType {
    EXTERNAL_CORROSION,
    INTERNAL_CORROSION,
    DENT,
    CRACK,
    OTHER
}
