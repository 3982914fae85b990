package uk.gegc.aianswers.features.answers.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.aianswers.features.answers.api.dto.AnswerStatsResponse;
import uk.gegc.aianswers.features.answers.api.dto.AnswersResponse;
import uk.gegc.aianswers.features.answers.domain.model.AnswerRecord;
import uk.gegc.aianswers.features.answers.domain.model.AnswerStats;
import uk.gegc.aianswers.features.answers.domain.model.StoredAnswerRecord;
import uk.gegc.aianswers.features.answers.infra.persistence.AnswerRecordDocument;

import java.util.LinkedHashMap;

@Component
public class AnswerRecordMapper {

    public StoredAnswerRecord toStored(AnswerRecordDocument document) {
        AnswerRecord record = new AnswerRecord(
                document.getUserId(),
                document.getAnswers(),
                document.getCreatedAt(),
                document.getUpdatedAt()
        );
        return new StoredAnswerRecord(record, document.getVersion());
    }

    public AnswerRecordDocument toNewDocument(AnswerRecord record) {
        AnswerRecordDocument document = new AnswerRecordDocument();
        document.setUserId(record.userId());
        document.setCreatedAt(record.createdAt());
        applyReplacement(document, record);
        return document;
    }

    /**
     * Overwrites every mutable column from {@code record}. {@code createdAt} is left as stored.
     */
    public void applyReplacement(AnswerRecordDocument document, AnswerRecord record) {
        document.setAnswers(new LinkedHashMap<>(record.answers()));
        document.setTotalQuestions(record.totalQuestions());
        document.setUpdatedAt(record.updatedAt());
    }

    public AnswersResponse toResponse(AnswerRecord record, String message) {
        return new AnswersResponse(
                true,
                message,
                record.answers(),
                record.totalQuestions(),
                record.createdAt(),
                record.updatedAt()
        );
    }

    public AnswerStatsResponse toStatsResponse(AnswerStats stats) {
        return new AnswerStatsResponse(
                true,
                stats.totalQuestions(),
                stats.completedQuestions(),
                stats.completionPercentage(),
                stats.createdAt(),
                stats.updatedAt()
        );
    }
}
