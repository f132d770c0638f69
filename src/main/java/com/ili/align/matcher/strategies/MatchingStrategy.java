package com.ili.align.matcher.strategies;

/**
 * Solves a minimum-cost assignment over a (possibly rectangular) cost matrix.
 */
public interface MatchingStrategy {

    /**
     * @param cost {@code cost[i][j]} for assigning row {@code i} to column {@code j}.
     * @return for each row, the assigned column, or {@code -1} if the row stays unassigned.
     */
    int[] assign(double[][] cost);

    boolean supports(String mode);
}
