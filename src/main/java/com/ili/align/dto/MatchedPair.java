package com.ili.align.dto;

public record MatchedPair(
        int index1,
        int index2,
        String refPoint1Id,
        String refPoint2Id,
        double distance1,
        double distance2) {

    public double distanceDiff() {
        return Math.abs(distance1 - distance2);
    }
}
