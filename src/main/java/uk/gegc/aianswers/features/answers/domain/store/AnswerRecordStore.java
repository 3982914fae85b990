package uk.gegc.aianswers.features.answers.domain.store;

import uk.gegc.aianswers.features.answers.domain.model.AnswerRecord;
import uk.gegc.aianswers.features.answers.domain.model.StoredAnswerRecord;
import uk.gegc.aianswers.shared.exception.StoreUnavailableException;

import java.util.Optional;

/**
 * Durable owner of answer records, one document per user id.
 *
 * <p>Every call is bounded in time; a timeout or transport failure is reported as
 * {@link StoreUnavailableException}.
 */
public interface AnswerRecordStore {

    Optional<StoredAnswerRecord> find(String userId);

    /**
     * Replaces the whole document for {@code record.userId()}, provided the stored
     * version still equals {@code expectedVersion}.
     *
     * @param expectedVersion the version read before the merge, or {@code null} when
     *                        no document existed and this write creates one
     * @return the record as stored, with its new version
     * @throws StoreConflictException when another writer committed in between
     */
    StoredAnswerRecord put(AnswerRecord record, Long expectedVersion);

    /**
     * Removes the document if present. Deleting a missing document is not an error.
     *
     * @return whether a document was removed
     */
    boolean delete(String userId);
}
