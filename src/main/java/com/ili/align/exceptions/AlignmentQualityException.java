package com.ili.align.exceptions;

import lombok.Getter;

/**
 * Exception thrown when a DTW alignment does not meet the acceptance thresholds.
 * <p>
 * Unlike {@link ValidationException}, this signals usable but low quality input: the
 * orchestrator catches it and continues with uncorrected distances. The offending
 * metrics are kept so the fallback reason can be recorded.
 * </p>
 */
@Getter
public class AlignmentQualityException extends RuntimeException {
    private final double matchRate;
    private final double rmse;

    /**
     * Constructs a new {@link AlignmentQualityException}.
     *
     * @param message   the detail message explaining which threshold failed.
     * @param matchRate the match rate of the rejected alignment, in percent.
     * @param rmse      the RMSE of the rejected alignment, in feet.
     */
    public AlignmentQualityException(String message, double matchRate, double rmse) {
        super(message);
        this.matchRate = matchRate;
        this.rmse = rmse;
    }
}
