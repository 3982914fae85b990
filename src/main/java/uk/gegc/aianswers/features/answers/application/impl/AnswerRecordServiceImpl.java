package uk.gegc.aianswers.features.answers.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.aianswers.features.answers.application.AnswerRecordService;
import uk.gegc.aianswers.features.answers.config.AnswerStoreProperties;
import uk.gegc.aianswers.features.answers.domain.model.AnswerRecord;
import uk.gegc.aianswers.features.answers.domain.model.AnswerStats;
import uk.gegc.aianswers.features.answers.domain.model.StoredAnswerRecord;
import uk.gegc.aianswers.features.answers.domain.store.AnswerRecordStore;
import uk.gegc.aianswers.features.answers.domain.store.StoreConflictException;
import uk.gegc.aianswers.shared.exception.ConflictRetryExhaustedException;
import uk.gegc.aianswers.shared.exception.ResourceNotFoundException;
import uk.gegc.aianswers.shared.exception.ValidationException;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class AnswerRecordServiceImpl implements AnswerRecordService {

    private final AnswerRecordStore store;
    private final AnswerStoreProperties properties;
    private final Clock clock;

    private final Counter mergeConflictCounter;
    private final Counter mergeExhaustedCounter;

    public AnswerRecordServiceImpl(AnswerRecordStore store,
                                   AnswerStoreProperties properties,
                                   Clock clock,
                                   MeterRegistry meterRegistry) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
        this.mergeConflictCounter = Counter.builder("ai_answers.merge.conflicts")
                .description("Optimistic merge rounds lost to a concurrent writer")
                .register(meterRegistry);
        this.mergeExhaustedCounter = Counter.builder("ai_answers.merge.exhausted")
                .description("Merges abandoned after running out of attempts")
                .register(meterRegistry);
    }

    @Override
    public AnswerRecord saveAnswers(String userId, Map<String, String> answers) {
        validateAnswers(answers);
        return mergeWithRetry(userId, answers);
    }

    @Override
    public AnswerRecord getAnswers(String userId) {
        return findExisting(userId).record();
    }

    @Override
    public void deleteAnswers(String userId) {
        if (store.delete(userId)) {
            log.info("Deleted AI answers for user {}", userId);
        } else {
            log.debug("No AI answers to delete for user {}", userId);
        }
    }

    @Override
    public AnswerRecord updateSingleAnswer(String userId, String questionId, String answerText) {
        if (questionId == null || questionId.isBlank()) {
            throw new ValidationException("questionId", "Question id cannot be blank");
        }
        if (answerText == null) {
            throw new ValidationException("answer", "Answer is required");
        }
        checkLength("answer", answerText);
        return mergeWithRetry(userId, Map.of(questionId, answerText));
    }

    @Override
    public AnswerStats getStats(String userId) {
        return AnswerStats.of(findExisting(userId).record());
    }

    private AnswerRecord mergeWithRetry(String userId, Map<String, String> incoming) {
        int maxAttempts = properties.getMaxMergeAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<StoredAnswerRecord> current = store.find(userId);
            AnswerRecord merged = AnswerRecord.merge(
                    userId,
                    current.map(StoredAnswerRecord::record).orElse(null),
                    incoming,
                    clock.instant()
            );
            if (merged.totalQuestions() > properties.getMaxQuestions()) {
                throw new ValidationException("answers",
                        "At most " + properties.getMaxQuestions() + " answers can be stored per user");
            }
            try {
                StoredAnswerRecord stored = store.put(merged, current.map(StoredAnswerRecord::version).orElse(null));
                if (current.isEmpty()) {
                    log.info("Created AI answers for user {} with {} questions", userId, merged.totalQuestions());
                } else {
                    log.info("Updated AI answers for user {}: {} questions after merging {}",
                            userId, merged.totalQuestions(), incoming.size());
                }
                return stored.record();
            } catch (StoreConflictException ex) {
                mergeConflictCounter.increment();
                log.debug("Merge attempt {}/{} for user {} lost to a concurrent write", attempt, maxAttempts, userId);
            }
        }
        mergeExhaustedCounter.increment();
        log.warn("Giving up merge for user {} after {} attempts", userId, maxAttempts);
        throw new ConflictRetryExhaustedException(
                "Answers are being modified concurrently, please retry", maxAttempts);
    }

    private StoredAnswerRecord findExisting(String userId) {
        return store.find(userId)
                .orElseThrow(() -> new ResourceNotFoundException("No AI answers found for user"));
    }

    private void validateAnswers(Map<String, String> answers) {
        if (answers == null || answers.isEmpty()) {
            throw new ValidationException("answers", "Answers cannot be empty");
        }
        answers.forEach((questionId, text) -> {
            if (questionId == null || questionId.isBlank()) {
                throw new ValidationException("answers", "Question id cannot be blank");
            }
            if (text == null) {
                throw new ValidationException("answers." + questionId, "Answer must be a string");
            }
            checkLength("answers." + questionId, text);
        });
    }

    private void checkLength(String field, String text) {
        if (text.length() > properties.getMaxAnswerLength()) {
            throw new ValidationException(field,
                    "Answer must not exceed " + properties.getMaxAnswerLength() + " characters");
        }
    }
}
