package com.ili.align.dto;

import com.ili.align.models.Match;

import java.util.List;

public record MatchingResult(List<Match> matches, UnmatchedAnomalies unmatched, MatchingStatistics statistics) {

    public MatchingResult {
        matches = List.copyOf(matches);
    }
}
