package uk.gegc.aianswers.shared.exception;

/**
 * The document store timed out or could not be reached. Safe to retry.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
