package uk.gegc.aianswers.shared.exception;

/**
 * An optimistic merge kept losing to concurrent writers for the same record and gave up.
 */
public class ConflictRetryExhaustedException extends RuntimeException {

    private final int attempts;

    public ConflictRetryExhaustedException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
