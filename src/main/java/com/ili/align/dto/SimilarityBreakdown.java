package com.ili.align.dto;

public record SimilarityBreakdown(
        double overall,
        double distance,
        double clock,
        double type,
        double depth,
        double length,
        double width) {}
