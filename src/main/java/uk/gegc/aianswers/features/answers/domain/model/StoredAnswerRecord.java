package uk.gegc.aianswers.features.answers.domain.model;

/**
 * An {@link AnswerRecord} as read from the store, together with the version
 * a conditional write must present to replace it.
 */
public record StoredAnswerRecord(AnswerRecord record, long version) {
}
