package uk.gegc.aianswers.shared.exception;

/**
 * Malformed client input. Carries the offending field path when one can be named.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
