package com.ili.align.dto;

public record DimensionStatistics(double mean, double median, double stdDev, double min, double max) {

    public static final DimensionStatistics EMPTY = new DimensionStatistics(0.0, 0.0, 0.0, 0.0, 0.0);
}
