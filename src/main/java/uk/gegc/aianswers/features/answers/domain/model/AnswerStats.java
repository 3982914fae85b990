package uk.gegc.aianswers.features.answers.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

public record AnswerStats(
        int totalQuestions,
        int completedQuestions,
        BigDecimal completionPercentage,
        Instant createdAt,
        Instant updatedAt
) {

    /**
     * Derives stats from the live answer map. An answer counts as completed when its text is not blank.
     */
    public static AnswerStats of(AnswerRecord record) {
        int total = record.answers().size();
        int completed = (int) record.answers().values().stream()
                .filter(text -> text != null && !text.isBlank())
                .count();
        BigDecimal percentage = total == 0
                ? BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP)
                : BigDecimal.valueOf(completed * 100L)
                        .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
        return new AnswerStats(total, completed, percentage, record.createdAt(), record.updatedAt());
    }
}
