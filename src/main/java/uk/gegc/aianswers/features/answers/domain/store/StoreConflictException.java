package uk.gegc.aianswers.features.answers.domain.store;

/**
 * Thrown by {@link AnswerRecordStore#put} when the stored version no longer matches the one the caller read.
 */
public class StoreConflictException extends RuntimeException {

    public StoreConflictException(String userId, Long expectedVersion) {
        super("Answer record for user " + userId + " changed since version " + expectedVersion);
    }

    public StoreConflictException(String userId, Long expectedVersion, Throwable cause) {
        super("Answer record for user " + userId + " changed since version " + expectedVersion, cause);
    }
}
