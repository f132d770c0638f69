package com.ili.align.matcher.strategies;

import com.ili.align.models.HungarianContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Kuhn-Munkres with row and column potentials. Rectangular inputs are padded to a square
 * with zero-cost dummy rows or columns, so every real row of the smaller side is assigned.
 */
@Component("hungarianMatchingStrategy")
@Slf4j
public class HungarianMatchingStrategy implements MatchingStrategy {
    private static final int UNMATCHED = 0;

    @Override
    public int[] assign(double[][] cost) {
        int n = cost.length;
        int m = n == 0 ? 0 : cost[0].length;
        if (n == 0 || m == 0) {
            int[] none = new int[n];
            Arrays.fill(none, -1);
            return none;
        }

        int size = Math.max(n, m);
        double[][] square = new double[size][size];
        for (int i = 0; i < n; i++) {
            System.arraycopy(cost[i], 0, square[i], 0, m);
        }

        int[] assignment = runHungarian(square);

        int[] result = new int[n];
        for (int i = 0; i < n; i++) {
            result[i] = assignment[i] < m ? assignment[i] : -1;
        }
        log.debug("Hungarian solved {}x{} (padded to {})", n, m, size);
        return result;
    }

    private int[] runHungarian(double[][] costMatrix) {
        int size = costMatrix.length;
        HungarianContext ctx = new HungarianContext(size);

        for (int row = 1; row <= size; row++) {
            ctx.getMatchColumn()[UNMATCHED] = row;
            ctx.resetForAugmentation();
            augment(costMatrix, ctx);
        }

        return extractMatches(ctx.getMatchColumn(), size);
    }

    private void augment(double[][] costMatrix, HungarianContext ctx) {
        int currentColumn = UNMATCHED;
        int nextColumn;
        do {
            ctx.getVisitedColumns()[currentColumn] = true;
            int currentRow = ctx.getMatchColumn()[currentColumn];
            double delta = Double.POSITIVE_INFINITY;
            nextColumn = -1;

            for (int col = 1; col <= ctx.getSize(); col++) {
                if (!ctx.getVisitedColumns()[col]) {
                    double reducedCost = costMatrix[currentRow - 1][col - 1]
                            - ctx.getRowPotential()[currentRow]
                            - ctx.getColumnPotential()[col];

                    if (reducedCost < ctx.getMinValues()[col]) {
                        ctx.getMinValues()[col] = reducedCost;
                        ctx.getColumnPath()[col] = currentColumn;
                    }
                    if (nextColumn == -1 || ctx.getMinValues()[col] < delta) {
                        delta = ctx.getMinValues()[col];
                        nextColumn = col;
                    }
                }
            }

            updatePotentials(ctx, delta);
            currentColumn = nextColumn;
        } while (ctx.getMatchColumn()[currentColumn] != UNMATCHED);

        updateMatching(ctx.getColumnPath(), ctx.getMatchColumn(), currentColumn);
    }

    private void updatePotentials(HungarianContext ctx, double delta) {
        for (int col = 0; col <= ctx.getSize(); col++) {
            if (ctx.getVisitedColumns()[col]) {
                ctx.getRowPotential()[ctx.getMatchColumn()[col]] += delta;
                ctx.getColumnPotential()[col] -= delta;
            } else {
                ctx.getMinValues()[col] -= delta;
            }
        }
    }

    private void updateMatching(int[] columnPath, int[] matchColumn, int column) {
        int prev;
        do {
            prev = columnPath[column];
            matchColumn[column] = matchColumn[prev];
            column = prev;
        } while (column != UNMATCHED);
    }

    private int[] extractMatches(int[] matchColumn, int size) {
        int[] matches = new int[size];
        Arrays.fill(matches, -1);
        for (int col = 1; col <= size; col++) {
            if (matchColumn[col] != UNMATCHED) {
                matches[matchColumn[col] - 1] = col - 1;
            }
        }
        return matches;
    }

    @Override
    public boolean supports(String mode) {
        return "HUNGARIAN".equalsIgnoreCase(mode);
    }
}
