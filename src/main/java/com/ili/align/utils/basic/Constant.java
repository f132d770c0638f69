package com.ili.align.utils.basic;

public final class Constant {
    private Constant() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static final String INTERVAL = "interval";
    public static final String CONFIDENCE = "confidence";
    public static final String STAGE = "stage";
    public static final String STATUS = "status";
    public static final String OUTCOME = "outcome";

    public static final String INTERVAL_07_15 = "2007-2015";
    public static final String INTERVAL_15_22 = "2015-2022";
}
