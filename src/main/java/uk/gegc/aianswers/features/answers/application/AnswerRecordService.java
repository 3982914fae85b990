package uk.gegc.aianswers.features.answers.application;

import uk.gegc.aianswers.features.answers.domain.model.AnswerRecord;
import uk.gegc.aianswers.features.answers.domain.model.AnswerStats;

import java.util.Map;

public interface AnswerRecordService {

    AnswerRecord saveAnswers(String userId, Map<String, String> answers);

    AnswerRecord getAnswers(String userId);

    void deleteAnswers(String userId);

    AnswerRecord updateSingleAnswer(String userId, String questionId, String answerText);

    AnswerStats getStats(String userId);
}
