package com.ili.align.exceptions;

/**
 * Exception thrown when a model or component is constructed from invalid input.
 * <p>
 * Raised for empty sequences, mismatched array lengths, too few reference points,
 * weights that do not sum to one and non-positive time intervals. Callers are not
 * expected to recover from it.
 * </p>
 */
public class ValidationException extends RuntimeException {

    /**
     * Constructs a new ValidationException with the specified detail message.
     *
     * @param message the detail message which explains the violated invariant.
     */
    public ValidationException(String message) {
        super(message);
    }
}
