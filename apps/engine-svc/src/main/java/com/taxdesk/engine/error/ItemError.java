package com.taxdesk.engine.error;

/**
 * Failure attached to a single entry of a batch result.
 */
public record ItemError(ErrorKind errorKind, String message) {

    public static ItemError from(CalculationException ex) {
        return new ItemError(ex.kind(), ex.getMessage());
    }
}
