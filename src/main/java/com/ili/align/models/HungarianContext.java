package com.ili.align.models;

import lombok.Getter;

import java.util.Arrays;

/**
 * Working state of one Hungarian solve. All arrays are 1-indexed; slot 0 holds the
 * virtual column used to seed each augmentation.
 */
@Getter
public class HungarianContext {
    private final int size;
    private final int[] matchColumn;
    private final double[] rowPotential;
    private final double[] columnPotential;
    private final double[] minValues;
    private final int[] columnPath;
    private final boolean[] visitedColumns;

    public HungarianContext(int size) {
        this.size = size;
        this.matchColumn = new int[size + 1];
        this.rowPotential = new double[size + 1];
        this.columnPotential = new double[size + 1];
        this.minValues = new double[size + 1];
        this.columnPath = new int[size + 1];
        this.visitedColumns = new boolean[size + 1];
    }

    public void resetForAugmentation() {
        Arrays.fill(minValues, Double.POSITIVE_INFINITY);
        Arrays.fill(visitedColumns, false);
    }
}
