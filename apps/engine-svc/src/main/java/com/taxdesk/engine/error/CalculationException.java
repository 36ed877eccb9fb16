package com.taxdesk.engine.error;

/**
 * Raised by every engine component when a calculation cannot produce a trustworthy number.
 * Batch pipelines catch it per item; the REST layer maps {@link #kind()} to the error payload.
 */
public class CalculationException extends RuntimeException {

    private final ErrorKind kind;

    public CalculationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CalculationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static CalculationException invalidInput(String message) {
        return new CalculationException(ErrorKind.INVALID_INPUT, message);
    }

    public static CalculationException unsupportedEntityType(String entityType) {
        return new CalculationException(ErrorKind.UNSUPPORTED_ENTITY_TYPE, "Unsupported entity type: " + entityType);
    }

    public static CalculationException unsupportedJurisdiction(String jurisdiction) {
        return new CalculationException(ErrorKind.UNSUPPORTED_JURISDICTION, "Unsupported jurisdiction: " + jurisdiction);
    }

    public static CalculationException configuration(String message) {
        return new CalculationException(ErrorKind.CONFIGURATION_ERROR, message);
    }

    public static CalculationException configuration(String message, Throwable cause) {
        return new CalculationException(ErrorKind.CONFIGURATION_ERROR, message, cause);
    }
}
