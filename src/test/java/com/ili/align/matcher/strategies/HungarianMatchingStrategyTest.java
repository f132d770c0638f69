package com.ili.align.matcher.strategies;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

@DisplayName("HungarianMatchingStrategy Tests")
class HungarianMatchingStrategyTest {

    private final HungarianMatchingStrategy strategy = new HungarianMatchingStrategy();

    @Test
    @DisplayName("Square matrix yields the minimum-cost assignment")
    void square() {
        double[][] cost = {{4, 1, 3}, {2, 0, 5}, {3, 2, 2}};

        assertThat(strategy.assign(cost)).containsExactly(1, 0, 2);
    }

    @Test
    @DisplayName("Wide matrix assigns every row")
    void moreColumns() {
        double[][] cost = {{0.9, 0.1, 0.5}, {0.2, 0.8, 0.05}};

        assertThat(strategy.assign(cost)).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Tall matrix leaves the costliest row unassigned")
    void moreRows() {
        double[][] cost = {{0.1, 0.9}, {0.8, 0.2}, {0.05, 0.95}};

        assertThat(strategy.assign(cost)).containsExactly(-1, 1, 0);
    }

    @Test
    @DisplayName("Empty matrices produce empty or unassigned results")
    void empty() {
        assertThat(strategy.assign(new double[0][0])).isEmpty();
        assertThat(strategy.assign(new double[][]{{}, {}})).containsExactly(-1, -1);
    }

    @Test
    @DisplayName("Total cost matches exhaustive search")
    void matchesBruteForce() {
        Random random = new Random(42);
        for (int trial = 0; trial < 20; trial++) {
            double[][] cost = new double[6][6];
            for (double[] row : cost) {
                for (int j = 0; j < row.length; j++) {
                    row[j] = random.nextDouble();
                }
            }

            int[] assignment = strategy.assign(cost);

            double total = 0.0;
            for (int i = 0; i < assignment.length; i++) {
                total += cost[i][assignment[i]];
            }
            assertThat(assignment).doesNotHaveDuplicates();
            assertThat(total).isCloseTo(bestCost(cost, 0, new boolean[6]), within(1e-9));
        }
    }

    @Test
    @DisplayName("Only the HUNGARIAN mode is supported")
    void supportsMode() {
        assertThat(strategy.supports("hungarian")).isTrue();
        assertThat(strategy.supports("GREEDY")).isFalse();
    }

    private static double bestCost(double[][] cost, int row, boolean[] used) {
        if (row == cost.length) {
            return 0.0;
        }
        double best = Double.POSITIVE_INFINITY;
        for (int col = 0; col < cost[row].length; col++) {
            if (!used[col]) {
                used[col] = true;
                best = Math.min(best, cost[row][col] + bestCost(cost, row + 1, used));
                used[col] = false;
            }
        }
        return best;
    }
}
