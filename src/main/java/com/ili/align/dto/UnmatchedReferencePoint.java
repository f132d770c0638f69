package com.ili.align.dto;

public record UnmatchedReferencePoint(int index, String referencePointId, double distance, String reason) {}
