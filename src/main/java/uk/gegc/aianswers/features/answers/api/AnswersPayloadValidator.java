package uk.gegc.aianswers.features.answers.api;

import org.springframework.stereotype.Component;
import uk.gegc.aianswers.shared.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a loosely typed JSON answer map into {@code Map<String, String>}, rejecting anything
 * that is not a JSON string.
 */
@Component
public class AnswersPayloadValidator {

    public Map<String, String> toAnswerMap(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new ValidationException("answers", "Answers cannot be empty");
        }
        Map<String, String> answers = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            String questionId = entry.getKey();
            if (questionId == null || questionId.isBlank()) {
                throw new ValidationException("answers", "Question id cannot be blank");
            }
            if (!(entry.getValue() instanceof String text)) {
                throw new ValidationException("answers." + questionId, "Answer must be a string");
            }
            answers.put(questionId, text);
        }
        return answers;
    }
}
